package cn.gm.light.bloom.exception;

import java.util.ArrayList;
import java.util.List;

/**
 * @author 明溪
 * @version 1.0
 * @project bloomFilter
 * @description 两个过滤器无法合并时抛出，记录具体哪些维度不一致
 * @date 2025/3/12 10:11:07
 */
public class IncompatibleFilterException extends BloomException {
    private static final long serialVersionUID = 1L;

    private final boolean sizeMismatch;
    private final boolean keyCountMismatch;
    private final boolean keysMismatch;

    public IncompatibleFilterException(long m1, long m2, long k1, long k2, boolean keysMismatch) {
        super(BloomErrorType.INCOMPATIBLE, buildMessage(m1, m2, k1, k2, keysMismatch));
        this.sizeMismatch = m1 != m2;
        this.keyCountMismatch = k1 != k2;
        this.keysMismatch = keysMismatch;
    }

    // 只拼接真正不一致的维度
    private static String buildMessage(long m1, long m2, long k1, long k2, boolean keysMismatch) {
        List<String> parts = new ArrayList<>(3);
        if (m1 != m2) {
            parts.add("M=" + m1 + " and M=" + m2);
        }
        if (k1 != k2) {
            parts.add("K=" + k1 + " and K=" + k2);
        }
        if (keysMismatch) {
            parts.add("Mismatched Keys");
        }
        return "Cannot perform union on two incompatible Bloom filters: " + String.join(", ", parts);
    }

    public boolean isSizeMismatch() { return sizeMismatch; }

    public boolean isKeyCountMismatch() { return keyCountMismatch; }

    public boolean isKeysMismatch() { return keysMismatch; }
}
