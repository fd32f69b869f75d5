package net.katagaitai.shiyou.verify;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import net.katagaitai.shiyou.abi.Selector;

@Value
public class ExhaustivenessResult {
    public enum Kind {
        COVERED, MISSING_SELECTORS, UNKNOWN
    }

    Kind kind;
    ImmutableList<Selector> missing;
    // set for UNKNOWN
    String reason;

    public static ExhaustivenessResult covered() {
        return new ExhaustivenessResult(Kind.COVERED, ImmutableList.of(), null);
    }

    public static ExhaustivenessResult missing(ImmutableList<Selector> missing) {
        return new ExhaustivenessResult(Kind.MISSING_SELECTORS, missing, null);
    }

    public static ExhaustivenessResult unknown(String reason) {
        return new ExhaustivenessResult(Kind.UNKNOWN, ImmutableList.of(), reason);
    }

    public boolean isCovered() {
        return kind == Kind.COVERED;
    }

    @Override
    public String toString() {
        switch (kind) {
            case COVERED:
                return "covered";
            case MISSING_SELECTORS:
                return "missing selectors: " + missing;
            default:
                return "unknown: " + reason;
        }
    }
}
