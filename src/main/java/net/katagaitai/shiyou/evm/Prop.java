package net.katagaitai.shiyou.evm;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * A path condition over symbolic terms.
 */
public abstract class Prop {

    public static Prop isTrue(Word w) {
        return new PNeg(new PEq(w, Word.lit(0)));
    }

    public static Prop and(Iterable<Prop> props) {
        Prop result = null;
        for (Prop p : props) {
            result = result == null ? p : new PAnd(result, p);
        }
        return result == null ? new PBool(true) : result;
    }

    public static Prop or(Iterable<Prop> props) {
        Prop result = null;
        for (Prop p : props) {
            result = result == null ? p : new POr(result, p);
        }
        return result == null ? new PBool(false) : result;
    }

    /**
     * Equality of two terms of any kind; the kinds may differ, in which case the
     * proposition is ill-formed for every consumer that needs word semantics.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PEq extends Prop {
        Expr a;
        Expr b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PLt extends Prop {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PGt extends Prop {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PLeq extends Prop {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PGeq extends Prop {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PNeg extends Prop {
        Prop a;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PAnd extends Prop {
        Prop a;
        Prop b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class POr extends Prop {
        Prop a;
        Prop b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PImpl extends Prop {
        Prop a;
        Prop b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class PBool extends Prop {
        boolean value;
    }
}
