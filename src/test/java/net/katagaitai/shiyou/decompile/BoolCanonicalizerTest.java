package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.spec.ABoolean;
import net.katagaitai.shiyou.spec.AInteger;
import net.katagaitai.shiyou.spec.Exp;
import net.katagaitai.shiyou.util.Constants;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class BoolCanonicalizerTest {
    private static final Exp<AInteger> A = Exp.intVar(AbiType.uint(256), "a");
    private static final Exp<AInteger> C = Exp.intVar(AbiType.uint(256), "c");
    private static final Exp<ABoolean> P = new Exp.LT(A, C);

    @Test
    public void test_double_negation() {
        assertEquals(P, BoolCanonicalizer.canonicalize(Exp.not(Exp.not(P))));
        assertEquals(Exp.not(P), BoolCanonicalizer.canonicalize(Exp.not(Exp.not(Exp.not(P)))));
    }

    @Test
    public void test_evm_bool_compared_with_literals() {
        assertEquals(P, BoolCanonicalizer.canonicalize(Exp.eq(Exp.evmBool(P), Exp.lit(1))));
        assertEquals(Exp.not(P), BoolCanonicalizer.canonicalize(Exp.eq(Exp.evmBool(P), Exp.lit(0))));
        // not (ite(p, 1, 0) == 0)
        assertEquals(P, BoolCanonicalizer.canonicalize(Exp.not(Exp.eq(Exp.evmBool(P), Exp.lit(0)))));
    }

    @Test
    public void test_rewrites_below_the_root() {
        Exp<ABoolean> nested = Exp.and(Exp.not(Exp.not(P)), Exp.or(Exp.lit(true), Exp.eq(Exp.evmBool(P), Exp.lit(1))));
        assertEquals(Exp.and(P, Exp.or(Exp.lit(true), P)), BoolCanonicalizer.canonicalize(nested));
    }

    @Test
    public void test_rewrites_inside_integer_terms() {
        Exp<ABoolean> e = new Exp.LT(Exp.ite(Exp.not(Exp.not(P)), A, C), Exp.lit(10));
        assertEquals(new Exp.LT(Exp.ite(P, A, C), Exp.lit(10)), BoolCanonicalizer.canonicalize(e));
    }

    @Test
    public void test_mul_guard_becomes_range_check() {
        Exp.InRange inRange = new Exp.InRange(AbiType.uint(256), new Exp.Mul(A, C));
        Exp<ABoolean> guard = Exp.not(Exp.and(Exp.not(Exp.eq(A, Exp.lit(0))), Exp.not(inRange)));
        assertEquals(inRange, BoolCanonicalizer.canonicalize(guard));
    }

    @Test
    public void test_mul_guard_needs_matching_operand() {
        Exp.InRange inRange = new Exp.InRange(AbiType.uint(256), new Exp.Mul(C, A));
        Exp<ABoolean> guard = Exp.not(Exp.and(Exp.not(Exp.eq(A, Exp.lit(0))), Exp.not(inRange)));
        assertEquals(guard, BoolCanonicalizer.canonicalize(guard));
    }

    @Test
    public void test_idempotent_and_truth_preserving() {
        List<Exp<ABoolean>> exps = ImmutableList.of(
                Exp.not(Exp.not(P)),
                Exp.eq(Exp.evmBool(Exp.not(Exp.not(P))), Exp.lit(0)),
                Exp.not(Exp.and(Exp.not(Exp.eq(A, Exp.lit(0))),
                        Exp.not(new Exp.InRange(AbiType.uint(256), new Exp.Mul(A, C))))),
                Exp.or(Exp.eq(Exp.evmBool(P), Exp.lit(1)), new Exp.Impl(P, Exp.not(Exp.not(Exp.lit(false))))),
                Exp.eq(Exp.evmBool(P), Exp.evmBool(Exp.not(P))));
        List<BigInteger> samples = ImmutableList.of(BigInteger.ZERO, BigInteger.ONE, BigInteger.ONE.shiftLeft(128),
                Constants.MAX_UINT);
        for (Exp<ABoolean> e : exps) {
            Exp<ABoolean> once = BoolCanonicalizer.canonicalize(e);
            assertEquals(once, BoolCanonicalizer.canonicalize(once));
            for (BigInteger a : samples) {
                for (BigInteger c : samples) {
                    Map<String, BigInteger> env = ImmutableMap.of("a", a, "c", c);
                    assertEquals(e + " a=" + a + " c=" + c, Evaluator.bool(e, env), Evaluator.bool(once, env));
                }
            }
        }
    }
}
