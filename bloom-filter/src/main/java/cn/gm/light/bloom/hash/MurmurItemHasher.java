package cn.gm.light.bloom.hash;

/**
 * MurmurHash64A，处理 byte[] 类型的 key。
 */
public class MurmurItemHasher implements ItemHasher<byte[]> {
    public static final MurmurItemHasher DEFAULT = new MurmurItemHasher(0x9747b28cL); // 固定种子

    private static final long M = 0xc6a4a7935bd1e995L;
    private static final int R = 47;

    private final long seed;

    public MurmurItemHasher(long seed) {
        this.seed = seed;
    }

    @Override
    public long hash64(byte[] data) {
        int length = data.length;
        long h = seed ^ (length * M);
        int tailStart = length & ~7;

        for (int i = 0; i < tailStart; i += 8) {
            long k = ((long) data[i] & 0xff)
                    | (((long) data[i + 1] & 0xff) << 8)
                    | (((long) data[i + 2] & 0xff) << 16)
                    | (((long) data[i + 3] & 0xff) << 24)
                    | (((long) data[i + 4] & 0xff) << 32)
                    | (((long) data[i + 5] & 0xff) << 40)
                    | (((long) data[i + 6] & 0xff) << 48)
                    | (((long) data[i + 7] & 0xff) << 56);

            k *= M;
            k ^= k >>> R;
            k *= M;
            h ^= k;
            h *= M;
        }

        // 剩余不足8字节的部分，小端拼接
        int remaining = length - tailStart;
        if (remaining > 0) {
            for (int i = remaining - 1; i >= 0; i--) {
                h ^= ((long) data[tailStart + i] & 0xff) << (i * 8);
            }
            h *= M;
        }

        h ^= h >>> R;
        h *= M;
        h ^= h >>> R;
        return h;
    }
}
