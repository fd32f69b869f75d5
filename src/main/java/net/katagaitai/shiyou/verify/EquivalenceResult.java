package net.katagaitai.shiyou.verify;

import lombok.Value;

@Value
public class EquivalenceResult {
    public enum Kind {
        EQUIVALENT, COUNTEREXAMPLE, UNKNOWN
    }

    Kind kind;
    // set for COUNTEREXAMPLE
    Counterexample counterexample;
    // set for UNKNOWN
    String reason;

    public static EquivalenceResult equivalent() {
        return new EquivalenceResult(Kind.EQUIVALENT, null, null);
    }

    public static EquivalenceResult counterexample(Counterexample counterexample) {
        return new EquivalenceResult(Kind.COUNTEREXAMPLE, counterexample, null);
    }

    public static EquivalenceResult unknown(String reason) {
        return new EquivalenceResult(Kind.UNKNOWN, null, reason);
    }

    public boolean isEquivalent() {
        return kind == Kind.EQUIVALENT;
    }

    @Override
    public String toString() {
        switch (kind) {
            case EQUIVALENT:
                return "equivalent";
            case COUNTEREXAMPLE:
                return "counterexample: " + counterexample;
            default:
                return "unknown: " + reason;
        }
    }
}
