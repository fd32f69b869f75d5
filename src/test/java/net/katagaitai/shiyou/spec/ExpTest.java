package net.katagaitai.shiyou.spec;

import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.evm.EnvVar;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class ExpTest {

    @Test
    public void test_sorts_of_constructors() {
        Exp<AInteger> v = Exp.intVar(AbiType.uint(256), "v");
        assertSame(SType.INTEGER, v.getSort());
        assertSame(SType.BOOLEAN, Exp.eq(v, Exp.lit(0)).getSort());
        assertSame(SType.INTEGER, Exp.evmBool(Exp.lit(true)).getSort());
        assertSame(SType.BOOLEAN, Exp.ite(Exp.lit(true), Exp.lit(false), Exp.boolVar("b")).getSort());
        assertSame(SType.INTEGER, new Exp.IntEnv(EnvVar.CALLER).getSort());
        assertSame(SType.BOOLEAN, new Exp.InRange(AbiType.uint(8), v).getSort());
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_bool_variable_with_integer_type_is_rejected() {
        new Exp.Var<>(SType.BOOLEAN, AbiType.uint(256), "v");
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_integer_variable_with_bool_type_is_rejected() {
        Exp.intVar(AbiType.bool(), "b");
    }

    @Test(expected = IllegalArgumentException.class)
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void test_equality_across_sorts_is_rejected() {
        Exp a = Exp.lit(1);
        Exp b = Exp.lit(true);
        Exp.eq(a, b);
    }

    @Test(expected = IllegalArgumentException.class)
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void test_ite_branches_of_different_sorts_are_rejected() {
        Exp a = Exp.lit(1);
        Exp b = Exp.lit(false);
        Exp.ite(Exp.lit(true), a, b);
    }

    @Test(expected = IllegalArgumentException.class)
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void test_arithmetic_on_booleans_is_rejected() {
        Exp a = Exp.lit(true);
        new Exp.Add(a, Exp.lit(1));
    }

    @Test(expected = IllegalArgumentException.class)
    @SuppressWarnings({"unchecked", "rawtypes"})
    public void test_negation_of_integer_is_rejected() {
        Exp a = Exp.lit(1);
        Exp.not(a);
    }

    @Test
    public void test_structural_equality() {
        Exp<AInteger> v = Exp.intVar(AbiType.uint(256), "v");
        assertEquals(new Exp.Add(v, Exp.lit(1)), new Exp.Add(Exp.intVar(AbiType.uint(256), "v"), Exp.lit(1)));
        assertNotEquals(new Exp.Add(v, Exp.lit(1)), new Exp.Sub(v, Exp.lit(1)));
        assertEquals(Exp.evmBool(Exp.lit(true)), Exp.ite(Exp.lit(true), Exp.lit(1), Exp.lit(BigInteger.ONE)));
    }

    @Test
    public void test_toString() {
        Exp<AInteger> v = Exp.intVar(AbiType.uint(256), "v");
        assertEquals("(v + 1)", new Exp.Add(v, Exp.lit(1)).toString());
        assertEquals("not (v == 0)", Exp.not(Exp.eq(v, Exp.lit(0))).toString());
        assertEquals("inRange(uint256, (v * 2))", new Exp.InRange(AbiType.uint(256), new Exp.Mul(v, Exp.lit(2))).toString());
        assertEquals("(if true then 1 else 0)", Exp.evmBool(Exp.lit(true)).toString());
    }
}
