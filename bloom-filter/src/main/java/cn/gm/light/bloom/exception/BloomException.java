package cn.gm.light.bloom.exception;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 布隆过滤器异常
 * @date 2025/3/12 10:05:13
 */
public class BloomException extends RuntimeException {
    private static final long serialVersionUID = 1L;
    private final BloomErrorType type;

    public BloomException(BloomErrorType type, String message) {
        super(message);
        this.type = type;
    }

    // 带异常根源的构造方法
    public BloomException(BloomErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public static BloomException invalidKeyCount(long kMin) {
        return new BloomException(BloomErrorType.INVALID_KEY_COUNT,
                "keys must have length " + kMin + " or greater");
    }

    public static BloomException invalidSize(long mMin, long mMax) {
        return new BloomException(BloomErrorType.INVALID_SIZE,
                "m (number of bits in the Bloom filter) must be >= " + mMin + " and <= " + mMax);
    }

    public static BloomException duplicateKeys() {
        return new BloomException(BloomErrorType.DUPLICATE_KEYS, "Bloom filter keys must be unique");
    }

    public static BloomException hashMismatch() {
        return new BloomException(BloomErrorType.HASH_MISMATCH,
                "Hash mismatch, the Bloom filter is probably corrupt");
    }

    public static BloomException hashMismatch(Throwable cause) {
        return new BloomException(BloomErrorType.HASH_MISMATCH,
                "Hash mismatch, the Bloom filter is probably corrupt", cause);
    }

    public BloomErrorType getType() { return type; }

    public int getCode() { return type.getCode(); }
}
