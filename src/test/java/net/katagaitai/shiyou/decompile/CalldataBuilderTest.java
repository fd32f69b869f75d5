package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import net.katagaitai.shiyou.TestUtil;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.Argument;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.evm.Buf;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.SymbolicCalldata;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.util.Util;
import org.junit.Test;

import static org.junit.Assert.*;

public class CalldataBuilderTest {

    @Test
    public void test_forMethod() throws UnsupportedException {
        Method method = new Method("f", ImmutableList.of(
                new Argument("to", AbiType.address()),
                new Argument("", AbiType.uint(8))), ImmutableList.of());
        SymbolicCalldata calldata = CalldataBuilder.forMethod(method);

        assertEquals(Word.var("to"), Buf.readWord(Word.lit(4), calldata.getData()));
        // unnamed arguments are numbered
        assertEquals(Word.var("arg1"), Buf.readWord(Word.lit(36), calldata.getData()));
        assertEquals(ImmutableList.of(
                new Prop.PLeq(Word.var("to"), Word.lit(Util.maxUnsigned(160))),
                new Prop.PLeq(Word.var("arg1"), Word.lit(255))), calldata.getAssumptions());
    }

    @Test
    public void test_forMethod_starts_with_selector() throws UnsupportedException {
        Buf buf = CalldataBuilder.forMethod(TestUtil.SET).getData();
        while (buf instanceof Buf.WriteWord) {
            buf = ((Buf.WriteWord) buf).getPrev();
        }
        assertArrayEquals(TestUtil.SET.getSelector().toBytes(), ((Buf.ConcreteBuf) buf).getBytes());
    }

    @Test
    public void test_forConstructor() throws UnsupportedException {
        SymbolicCalldata calldata = CalldataBuilder.forConstructor(ImmutableList.of(
                new Argument("supply", AbiType.uint(256)), new Argument("flag", AbiType.bool())));
        assertEquals(Word.var("supply"), Buf.readWord(Word.lit(0), calldata.getData()));
        assertEquals(Word.var("flag"), Buf.readWord(Word.lit(32), calldata.getData()));
        assertEquals(ImmutableList.of(new Prop.PLeq(Word.var("flag"), Word.lit(1))), calldata.getAssumptions());
    }

    @Test
    public void test_signed_argument_is_sign_extended() throws UnsupportedException {
        Word v = Word.var("v");
        assertEquals(ImmutableList.of(new Prop.PEq(new Word.SignExtend(Word.lit(0), v), v)),
                CalldataBuilder.typeAssumptions(AbiType.int_(8), v));
        assertTrue(CalldataBuilder.typeAssumptions(AbiType.int_(256), v).isEmpty());
        assertTrue(CalldataBuilder.typeAssumptions(AbiType.bytes(32), v).isEmpty());
    }

    @Test
    public void test_unsupported_arguments() {
        for (AbiType type : new AbiType[]{AbiType.parse("string"), AbiType.parse("uint256[]"), AbiType.bytes(4),
                AbiType.parse("uint256[2]")}) {
            try {
                CalldataBuilder.typeAssumptions(type, Word.var("v"));
                fail(type.toString());
            } catch (UnsupportedException e) {
                assertTrue(e.getMessage().startsWith("cannot decompile methods"));
            }
        }
    }

    @Test
    public void test_unconstrained() {
        SymbolicCalldata calldata = CalldataBuilder.unconstrained();
        assertEquals(new Buf.AbstractBuf("txdata"), calldata.getData());
        assertTrue(calldata.getAssumptions().isEmpty());
    }
}
