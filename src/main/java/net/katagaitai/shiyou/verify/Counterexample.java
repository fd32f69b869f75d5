package net.katagaitai.shiyou.verify;

import com.google.common.collect.ImmutableMap;
import lombok.Value;

import java.math.BigInteger;

/**
 * Values of the symbolic inputs under which two programs behave differently.
 */
@Value
public class Counterexample {
    String description;
    ImmutableMap<String, BigInteger> witness;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(description);
        for (ImmutableMap.Entry<String, BigInteger> entry : witness.entrySet()) {
            sb.append("\n  ").append(entry.getKey()).append(" = 0x").append(entry.getValue().toString(16));
        }
        return sb.toString();
    }
}
