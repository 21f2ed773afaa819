package com.work.shield.core.support;

import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.Collection;

/**
 * 32 字节值（承诺、根、nullifier）与 0x 十六进制字符串之间的转换。
 * <p>Map 的 key 一律使用小写 0x 十六进制，避免 byte[] 的引用相等问题。</p>
 */
public final class ByteUtils {

    public static final int HASH_LENGTH = 32;

    private ByteUtils() {
        throw new AssertionError("工具类不允许实例化");
    }

    public static String toHex(byte[] value) {
        return Numeric.toHexString(value).toLowerCase();
    }

    public static byte[] fromHex(String hex) {
        return Numeric.hexStringToByteArray(ValidationUtils.requireNonEmpty(hex, "hex"));
    }

    public static byte[] zero() {
        return new byte[HASH_LENGTH];
    }

    public static boolean isZero(byte[] value) {
        return Arrays.equals(value, new byte[value.length]);
    }

    public static byte[] concat(byte[] first, Collection<byte[]> rest) {
        int total = first.length;
        for (byte[] part : rest) {
            total += part.length;
        }
        byte[] out = Arrays.copyOf(first, total);
        int offset = first.length;
        for (byte[] part : rest) {
            System.arraycopy(part, 0, out, offset, part.length);
            offset += part.length;
        }
        return out;
    }

    public static byte[] concat(byte[] left, byte[] right) {
        byte[] out = Arrays.copyOf(left, left.length + right.length);
        System.arraycopy(right, 0, out, left.length, right.length);
        return out;
    }
}
