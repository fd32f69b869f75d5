package net.katagaitai.shiyou.util;

import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

public class Util {
    public static String toHex(byte[] bytes) {
        return Hex.toHexString(bytes);
    }

    public static byte[] fromHex(String hex) {
        String s = removeHexPrefix(hex);
        if (s.length() % 2 != 0) {
            throw new IllegalArgumentException("odd length hex string: " + hex);
        }
        return Hex.decode(s);
    }

    public static String addHexPrefix(String hex) {
        if (hex == null || hex.length() == 0) {
            return "";
        }
        return hex.startsWith("0x") ? hex : "0x" + hex;
    }

    public static String removeHexPrefix(String hex) {
        if (hex == null) {
            return "";
        }
        return hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
    }

    public static byte[] keccak256(byte[] input) {
        Keccak.Digest256 digest = new Keccak.Digest256();
        return digest.digest(input);
    }

    /**
     * Big-endian bytes of the value, left padded (or truncated from the left) to the given size.
     */
    public static byte[] toFixedBytes(BigInteger value, int byteSize) {
        byte[] bytes = value.toByteArray();
        if (bytes.length < byteSize) {
            byte[] tmp = new byte[byteSize];
            System.arraycopy(bytes, 0, tmp, byteSize - bytes.length, bytes.length);
            bytes = tmp;
        } else if (bytes.length > byteSize) {
            bytes = Arrays.copyOfRange(bytes, bytes.length - byteSize, bytes.length);
        }
        return bytes;
    }

    /**
     * Removes later duplicates, keeping the first occurrence of every element in place.
     */
    public static <T> List<T> nub(List<T> list) {
        Set<T> seen = Sets.newHashSet();
        List<T> result = Lists.newArrayList();
        for (T t : list) {
            if (seen.add(t)) {
                result.add(t);
            }
        }
        return result;
    }

    public static BigInteger maxUnsigned(int bits) {
        return BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE);
    }

    public static BigInteger minSigned(int bits) {
        return BigInteger.ONE.shiftLeft(bits - 1).negate();
    }

    public static BigInteger maxSigned(int bits) {
        return BigInteger.ONE.shiftLeft(bits - 1).subtract(BigInteger.ONE);
    }
}
