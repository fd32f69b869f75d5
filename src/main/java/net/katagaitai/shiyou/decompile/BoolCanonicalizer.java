package net.katagaitai.shiyou.decompile;

import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.spec.ABoolean;
import net.katagaitai.shiyou.spec.AInteger;
import net.katagaitai.shiyou.spec.Exp;
import net.katagaitai.shiyou.spec.SType;

import java.math.BigInteger;

/**
 * Strips the noise left behind by the 0/1 encoding of booleans in machine words. Every
 * subexpression is rewritten bottom-up until no rule applies, so the result is a fixpoint.
 */
public class BoolCanonicalizer {

    public static Exp<ABoolean> canonicalize(Exp<ABoolean> e) {
        return bool(e);
    }

    private static Exp<ABoolean> bool(Exp<ABoolean> e) {
        Exp<ABoolean> rebuilt;
        if (e instanceof Exp.Neg) {
            rebuilt = Exp.not(bool(((Exp.Neg) e).getA()));
        } else if (e instanceof Exp.And) {
            rebuilt = Exp.and(bool(((Exp.And) e).getA()), bool(((Exp.And) e).getB()));
        } else if (e instanceof Exp.Or) {
            rebuilt = Exp.or(bool(((Exp.Or) e).getA()), bool(((Exp.Or) e).getB()));
        } else if (e instanceof Exp.Impl) {
            rebuilt = new Exp.Impl(bool(((Exp.Impl) e).getA()), bool(((Exp.Impl) e).getB()));
        } else if (e instanceof Exp.LT) {
            rebuilt = new Exp.LT(integer(((Exp.LT) e).getA()), integer(((Exp.LT) e).getB()));
        } else if (e instanceof Exp.LEQ) {
            rebuilt = new Exp.LEQ(integer(((Exp.LEQ) e).getA()), integer(((Exp.LEQ) e).getB()));
        } else if (e instanceof Exp.GT) {
            rebuilt = new Exp.GT(integer(((Exp.GT) e).getA()), integer(((Exp.GT) e).getB()));
        } else if (e instanceof Exp.GEQ) {
            rebuilt = new Exp.GEQ(integer(((Exp.GEQ) e).getA()), integer(((Exp.GEQ) e).getB()));
        } else if (e instanceof Exp.InRange) {
            Exp.InRange inRange = (Exp.InRange) e;
            rebuilt = new Exp.InRange(inRange.getType(), integer(inRange.getE()));
        } else if (e instanceof Exp.Eq) {
            rebuilt = eq((Exp.Eq<?>) e);
        } else if (e instanceof Exp.NEq) {
            rebuilt = neq((Exp.NEq<?>) e);
        } else if (e instanceof Exp.ITE) {
            @SuppressWarnings("unchecked")
            Exp.ITE<ABoolean> ite = (Exp.ITE<ABoolean>) e;
            rebuilt = Exp.ite(bool(ite.getCondition()), bool(ite.getA()), bool(ite.getB()));
        } else {
            rebuilt = e;
        }
        return simplify(rebuilt);
    }

    private static Exp<AInteger> integer(Exp<AInteger> e) {
        if (e instanceof Exp.Add) {
            return new Exp.Add(integer(((Exp.Add) e).getA()), integer(((Exp.Add) e).getB()));
        }
        if (e instanceof Exp.Sub) {
            return new Exp.Sub(integer(((Exp.Sub) e).getA()), integer(((Exp.Sub) e).getB()));
        }
        if (e instanceof Exp.Mul) {
            return new Exp.Mul(integer(((Exp.Mul) e).getA()), integer(((Exp.Mul) e).getB()));
        }
        if (e instanceof Exp.Div) {
            return new Exp.Div(integer(((Exp.Div) e).getA()), integer(((Exp.Div) e).getB()));
        }
        if (e instanceof Exp.Mod) {
            return new Exp.Mod(integer(((Exp.Mod) e).getA()), integer(((Exp.Mod) e).getB()));
        }
        if (e instanceof Exp.Pow) {
            return new Exp.Pow(integer(((Exp.Pow) e).getA()), integer(((Exp.Pow) e).getB()));
        }
        if (e instanceof Exp.ITE) {
            @SuppressWarnings("unchecked")
            Exp.ITE<AInteger> ite = (Exp.ITE<AInteger>) e;
            return Exp.ite(bool(ite.getCondition()), integer(ite.getA()), integer(ite.getB()));
        }
        return e;
    }

    @SuppressWarnings("unchecked")
    private static <S> Exp<S> any(Exp<S> e) {
        if (e.getSort() == SType.BOOLEAN) {
            return (Exp<S>) bool((Exp<ABoolean>) e);
        }
        if (e.getSort() == SType.INTEGER) {
            return (Exp<S>) integer((Exp<AInteger>) e);
        }
        return e;
    }

    private static <S> Exp<ABoolean> eq(Exp.Eq<S> e) {
        return new Exp.Eq<>(e.getOperandSort(), any(e.getA()), any(e.getB()));
    }

    private static <S> Exp<ABoolean> neq(Exp.NEq<S> e) {
        return new Exp.NEq<>(e.getOperandSort(), any(e.getA()), any(e.getB()));
    }

    /**
     * Applies the rules at the root until none matches. Every rule shrinks the term.
     */
    private static Exp<ABoolean> simplify(Exp<ABoolean> e) {
        Exp<ABoolean> current = e;
        while (true) {
            Exp<ABoolean> next = step(current);
            if (next == null) {
                return current;
            }
            current = next;
        }
    }

    private static Exp<ABoolean> step(Exp<ABoolean> e) {
        // not not p
        if (e instanceof Exp.Neg && ((Exp.Neg) e).getA() instanceof Exp.Neg) {
            return ((Exp.Neg) ((Exp.Neg) e).getA()).getA();
        }
        if (e instanceof Exp.Eq && ((Exp.Eq<?>) e).getOperandSort() == SType.INTEGER) {
            @SuppressWarnings("unchecked")
            Exp.Eq<AInteger> eq = (Exp.Eq<AInteger>) e;
            Exp<ABoolean> condition = evmBoolCondition(eq.getA());
            if (condition != null && isLit(eq.getB(), 1)) {
                // (if c then 1 else 0) == 1
                return condition;
            }
            if (condition != null && isLit(eq.getB(), 0)) {
                // (if c then 1 else 0) == 0
                return Exp.not(condition);
            }
        }
        // not (a != 0 and not inRange(t, a * c))  ==  a == 0 or inRange(t, a * c)  ==  inRange(t, a * c)
        if (e instanceof Exp.Neg && ((Exp.Neg) e).getA() instanceof Exp.And) {
            Exp.And and = (Exp.And) ((Exp.Neg) e).getA();
            Exp<AInteger> a = nonZeroOperand(and.getA());
            Exp.InRange inRange = negatedInRange(and.getB());
            if (a != null && inRange != null && inRange.getType() instanceof AbiType.UInt
                    && inRange.getE() instanceof Exp.Mul && ((Exp.Mul) inRange.getE()).getA().equals(a)) {
                return inRange;
            }
        }
        return null;
    }

    private static Exp<ABoolean> evmBoolCondition(Exp<AInteger> e) {
        if (!(e instanceof Exp.ITE)) {
            return null;
        }
        @SuppressWarnings("unchecked")
        Exp.ITE<AInteger> ite = (Exp.ITE<AInteger>) e;
        return isLit(ite.getA(), 1) && isLit(ite.getB(), 0) ? ite.getCondition() : null;
    }

    // not (a == 0)
    private static Exp<AInteger> nonZeroOperand(Exp<ABoolean> e) {
        if (!(e instanceof Exp.Neg) || !(((Exp.Neg) e).getA() instanceof Exp.Eq)) {
            return null;
        }
        Exp.Eq<?> eq = (Exp.Eq<?>) ((Exp.Neg) e).getA();
        if (eq.getOperandSort() != SType.INTEGER) {
            return null;
        }
        @SuppressWarnings("unchecked")
        Exp.Eq<AInteger> intEq = (Exp.Eq<AInteger>) eq;
        return isLit(intEq.getB(), 0) ? intEq.getA() : null;
    }

    private static Exp.InRange negatedInRange(Exp<ABoolean> e) {
        if (e instanceof Exp.Neg && ((Exp.Neg) e).getA() instanceof Exp.InRange) {
            return (Exp.InRange) ((Exp.Neg) e).getA();
        }
        return null;
    }

    private static boolean isLit(Exp<AInteger> e, long value) {
        return e instanceof Exp.LitInt && ((Exp.LitInt) e).getValue().equals(BigInteger.valueOf(value));
    }
}
