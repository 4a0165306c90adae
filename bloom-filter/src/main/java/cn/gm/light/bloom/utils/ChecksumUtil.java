package cn.gm.light.bloom.utils;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

public class ChecksumUtil {
    public static final int SHA384_LENGTH = 48;

    public static byte[] sha384(byte[] input, int offset, int length) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-384");
            digest.update(input, offset, length);
            return digest.digest();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    // 比较 data[offset, offset+expected.length) 和 expected，固定耗时
    public static boolean matches(byte[] expected, byte[] data, int offset) {
        if (data.length - offset != expected.length) {
            return false;
        }
        byte[] actual = new byte[expected.length];
        System.arraycopy(data, offset, actual, 0, expected.length);
        return MessageDigest.isEqual(expected, actual);
    }

    public static String toHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder();
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
