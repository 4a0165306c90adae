package cn.gm.light.bloom.core;

import cn.gm.light.bloom.exception.IncompatibleFilterException;

/**
 * 兼容性判断。调用方负责持有两个过滤器的 exclusive 锁。
 */
final class Compatibility {

    private Compatibility() {
    }

    // 相等返回 0；不提前退出，固定代价。调用前须保证长度一致
    static long noBranchCompare(long[] a, long[] b) {
        long r = 0;
        for (int i = 0; i < a.length; i++) {
            r |= a[i] ^ b[i];
        }
        return r;
    }

    static boolean isCompatible(ConcurrentBloomFilter f, ConcurrentBloomFilter f2) {
        return f.m() == f2.m()
                && f.k() == f2.k()
                && noBranchCompare(f.keysRef(), f2.keysRef()) == 0;
    }

    static void verifyCompatible(ConcurrentBloomFilter f, ConcurrentBloomFilter f2) {
        if (isCompatible(f, f2)) {
            return;
        }
        // key 数量不同时 key 序列自然也不同
        boolean keysMismatch = f.k() != f2.k() || noBranchCompare(f.keysRef(), f2.keysRef()) != 0;
        throw new IncompatibleFilterException(f.m(), f2.m(), f.k(), f2.k(), keysMismatch);
    }
}
