package cn.gm.light.bloom.utils;

/**
 * 小端序 long 读写。
 */
public class LongToByteArray {
    public static void writeLong(byte[] bytes, int offset, long value) {
        for (int i = 0; i < 8; i++) {
            bytes[offset + i] = (byte) (value >> (i * 8));
        }
    }

    public static long readLong(byte[] bytes, int offset) {
        long value = 0;
        for (int i = 0; i < 8; i++) {
            value |= ((long) bytes[offset + i] & 0xFF) << (i * 8);
        }
        return value;
    }

    private LongToByteArray() {
    }
}
