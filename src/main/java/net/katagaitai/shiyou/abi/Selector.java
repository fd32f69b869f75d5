package net.katagaitai.shiyou.abi;

import com.google.common.base.Preconditions;
import lombok.Value;
import net.katagaitai.shiyou.util.Constants;
import net.katagaitai.shiyou.util.Util;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * The 4-byte method identifier that prefixes calldata.
 */
@Value
public class Selector {
    String hex;

    public Selector(String hex) {
        String s = Util.removeHexPrefix(hex).toLowerCase();
        Preconditions.checkArgument(s.matches("[0-9a-f]{8}"), "malformed selector: %s", hex);
        this.hex = s;
    }

    public static Selector of(String signature) {
        byte[] hash = Util.keccak256(signature.getBytes(StandardCharsets.UTF_8));
        return new Selector(Util.toHex(Arrays.copyOf(hash, Constants.SELECTOR_BYTES)));
    }

    public byte[] toBytes() {
        return Util.fromHex(hex);
    }

    public BigInteger toBigInteger() {
        return new BigInteger(hex, 16);
    }

    @Override
    public String toString() {
        return "0x" + hex;
    }
}
