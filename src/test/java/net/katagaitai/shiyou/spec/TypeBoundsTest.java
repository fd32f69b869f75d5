package net.katagaitai.shiyou.spec;

import net.katagaitai.shiyou.abi.AbiType;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class TypeBoundsTest {

    @Test
    public void test_unsigned_ranges() {
        assertEquals(BigInteger.ZERO, TypeBounds.lower(AbiType.uint(8)));
        assertEquals(BigInteger.valueOf(255), TypeBounds.upper(AbiType.uint(8)));
        assertEquals(BigInteger.valueOf(1023), TypeBounds.upper(AbiType.uint(10)));
        assertEquals(BigInteger.ONE.shiftLeft(160).subtract(BigInteger.ONE), TypeBounds.upper(AbiType.address()));
        assertEquals(BigInteger.ONE, TypeBounds.upper(AbiType.bool()));
        assertEquals(BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE), TypeBounds.upper(AbiType.bytes(32)));
    }

    @Test
    public void test_signed_ranges() {
        assertEquals(BigInteger.valueOf(-128), TypeBounds.lower(AbiType.int_(8)));
        assertEquals(BigInteger.valueOf(127), TypeBounds.upper(AbiType.int_(8)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void test_dynamic_types_have_no_range() {
        TypeBounds.lower(AbiType.parse("string"));
    }

    @Test
    public void test_bound() {
        Exp<AInteger> v = Exp.intVar(AbiType.uint(8), "v");
        assertEquals("((0 <= v) and (v <= 255))", TypeBounds.bound(AbiType.uint(8), v).toString());
    }
}
