package cn.gm.light.bloom.core;

/**
 * 由外部传入的一个 64 位哈希值和过滤器的 key 集合推导出 k 个位下标。
 * <p>
 * 下标 = (hash ^ key) mod m，按无符号数取模，结果恒在 [0, m) 内。
 */
public final class KeyHasher {
    private final long m;
    private final long[] keys;

    KeyHasher(long m, long[] keys) {
        this.m = m;
        this.keys = keys;
    }

    public int size() {
        return keys.length;
    }

    // 第 i 个 key 对应的位下标
    public long index(long hash, int i) {
        return Long.remainderUnsigned(hash ^ keys[i], m);
    }

    public long[] indices(long hash) {
        long[] out = new long[keys.length];
        for (int i = 0; i < keys.length; i++) {
            out[i] = index(hash, i);
        }
        return out;
    }
}
