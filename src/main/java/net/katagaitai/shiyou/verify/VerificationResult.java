package net.katagaitai.shiyou.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Value;
import net.katagaitai.shiyou.decompile.EntryPointFailure;

/**
 * Outcome of checking a specification against the bytecode it was decompiled from. Entry points
 * that could not be compiled back are listed in {@code unsupported} and have no result.
 */
@Value
public class VerificationResult {
    // null when the constructor could not be compiled
    EquivalenceResult constructor;
    // keyed by method signature
    ImmutableMap<String, EquivalenceResult> behaviours;
    ExhaustivenessResult abi;
    ImmutableList<EntryPointFailure> unsupported;

    public boolean isSuccess() {
        if (!unsupported.isEmpty() || constructor == null || !constructor.isEquivalent() || !abi.isCovered()) {
            return false;
        }
        for (EquivalenceResult result : behaviours.values()) {
            if (!result.isEquivalent()) {
                return false;
            }
        }
        return true;
    }
}
