package cn.gm.light.bloom.exception;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 布隆过滤器错误类型
 * @date 2025/3/12 10:02:41
 */
public enum BloomErrorType {
    // 构造期校验
    INVALID_KEY_COUNT(1001),
    INVALID_SIZE(1002),
    DUPLICATE_KEYS(1003),

    // 反序列化校验失败（由编解码器抛出）
    HASH_MISMATCH(2001),

    // union / 兼容性
    INCOMPATIBLE(3001),
    ;

    private final int code;

    BloomErrorType(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
