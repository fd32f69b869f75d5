package net.katagaitai.shiyou.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.katagaitai.shiyou.TestUtil;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.SlotType;
import net.katagaitai.shiyou.abi.ValueType;
import net.katagaitai.shiyou.decompile.Evaluator;
import net.katagaitai.shiyou.decompile.UnsupportedException;
import net.katagaitai.shiyou.evm.Address;
import net.katagaitai.shiyou.evm.Buf;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.EnvVar;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.spec.ABoolean;
import net.katagaitai.shiyou.spec.AInteger;
import net.katagaitai.shiyou.spec.Behaviour;
import net.katagaitai.shiyou.spec.Constructor;
import net.katagaitai.shiyou.spec.Contract;
import net.katagaitai.shiyou.spec.Exp;
import net.katagaitai.shiyou.spec.Interface;
import net.katagaitai.shiyou.spec.Specification;
import net.katagaitai.shiyou.spec.StorageDeclaration;
import net.katagaitai.shiyou.spec.StorageItem;
import net.katagaitai.shiyou.spec.StorageUpdate;
import net.katagaitai.shiyou.spec.Time;
import net.katagaitai.shiyou.util.Constants;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.*;

public class SpecCompilerTest {
    private static final AbiType UINT256 = AbiType.uint(256);
    private static final StorageItem X = new StorageItem("Store", "x", new ValueType.PrimitiveType(UINT256));
    private static final StorageItem Y = new StorageItem("Store", "y", new ValueType.PrimitiveType(UINT256));
    private static final Exp<AInteger> V = Exp.intVar(UINT256, "v");

    private static final Specification SPEC = new Specification(
            ImmutableMap.of("Store", ImmutableMap.of(
                    "x", new StorageDeclaration("x", new SlotType.StorageValue(new ValueType.PrimitiveType(UINT256)),
                            BigInteger.ZERO),
                    "y", new StorageDeclaration("y", new SlotType.StorageValue(new ValueType.PrimitiveType(UINT256)),
                            BigInteger.valueOf(3)))),
            new Contract(
                    new Constructor("Store", Interface.constructor(ImmutableList.of()), ImmutableList.of(),
                            ImmutableList.of()),
                    ImmutableList.of()));

    private static Behaviour behaviour(ImmutableList<Exp<ABoolean>> pre, ImmutableList<StorageUpdate> updates,
                                       Exp<AInteger> returns) {
        return new Behaviour("Store", "set", Interface.of(TestUtil.SET), pre, ImmutableList.of(), updates, returns);
    }

    @Test
    public void test_behaviour() throws Exception {
        Exp<ABoolean> noValue = Exp.eq(new Exp.IntEnv(EnvVar.CALLVALUE), Exp.lit(0));
        Behaviour set = behaviour(ImmutableList.of(noValue),
                ImmutableList.of(new StorageUpdate(Y, new Exp.Add(new Exp.TEntry(Time.PRE, X), V))), null);
        End.Success leaf = new SpecCompiler(SPEC).compile(set);

        assertEquals(ImmutableList.of(TestUtil.NO_VALUE), leaf.getProps());
        assertEquals(Buf.EMPTY, leaf.getReturnData());
        assertEquals(new Store.SStore(Word.lit(3),
                        new Word.Add(new Word.SLoad(Word.lit(0), TestUtil.PRE), Word.var("v")),
                        TestUtil.PRE),
                leaf.getStorage().get(Address.ENTRYPOINT));
    }

    @Test
    public void test_returns_read_the_post_state() throws Exception {
        Behaviour get = behaviour(ImmutableList.of(),
                ImmutableList.of(new StorageUpdate(X, V)), new Exp.TEntry(Time.POST, X));
        End.Success leaf = new SpecCompiler(SPEC).compile(get);
        Store post = new Store.SStore(Word.lit(0), Word.var("v"), TestUtil.PRE);
        assertEquals(post, leaf.getStorage().get(Address.ENTRYPOINT));
        assertEquals(TestUtil.returning(new Word.SLoad(Word.lit(0), post)), leaf.getReturnData());
    }

    @Test
    public void test_constructor() throws Exception {
        Constructor ctor = new Constructor("Store", Interface.constructor(ImmutableList.of()), ImmutableList.of(),
                ImmutableList.of(new StorageUpdate(X, Exp.lit(0)), new StorageUpdate(Y, Exp.lit(7))));
        End.Success leaf = new SpecCompiler(SPEC).compile(ctor);
        assertEquals(new Store.SStore(Word.lit(3), Word.lit(7),
                        new Store.SStore(Word.lit(0), Word.lit(0), TestUtil.freshStore())),
                leaf.getStorage().get(Address.ENTRYPOINT));
        assertTrue(leaf.getProps().isEmpty());
    }

    @Test
    public void test_comparisons() throws Exception {
        SpecCompiler compiler = new SpecCompiler(SPEC);
        assertEquals(new Prop.PLt(Word.var("v"), Word.lit(10)),
                compiler.prop(new Exp.LT(V, Exp.lit(10)), TestUtil.PRE, TestUtil.PRE));
        assertEquals(new Prop.PNeg(new Prop.PEq(Word.var("v"), Word.lit(10))),
                compiler.prop(Exp.neq(V, Exp.lit(10)), TestUtil.PRE, TestUtil.PRE));
        assertEquals(new Prop.PBool(true), compiler.prop(Exp.lit(true), TestUtil.PRE, TestUtil.PRE));
    }

    @Test
    public void test_in_range_means_no_wrap_around() throws Exception {
        SpecCompiler compiler = new SpecCompiler(SPEC);
        Exp<AInteger> w = Exp.intVar(UINT256, "w");

        Word add = compiler.boolWord(new Exp.InRange(UINT256, new Exp.Add(V, w)), TestUtil.PRE, TestUtil.PRE);
        assertEquals(BigInteger.ONE, Evaluator.word(add, env(5, 6)));
        assertEquals(BigInteger.ZERO, Evaluator.word(add, ImmutableMap.of("v", Constants.MAX_UINT, "w", BigInteger.ONE)));

        Word sub = compiler.boolWord(new Exp.InRange(UINT256, new Exp.Sub(V, w)), TestUtil.PRE, TestUtil.PRE);
        assertEquals(BigInteger.ONE, Evaluator.word(sub, env(6, 6)));
        assertEquals(BigInteger.ZERO, Evaluator.word(sub, env(5, 6)));

        Word mul = compiler.boolWord(new Exp.InRange(UINT256, new Exp.Mul(V, w)), TestUtil.PRE, TestUtil.PRE);
        assertEquals(BigInteger.ONE, Evaluator.word(mul, env(0, 6)));
        assertEquals(BigInteger.ONE, Evaluator.word(mul, env(5, 6)));
        assertEquals(BigInteger.ZERO, Evaluator.word(mul,
                ImmutableMap.of("v", BigInteger.ONE.shiftLeft(200), "w", BigInteger.ONE.shiftLeft(100))));

        Word uint8 = compiler.boolWord(new Exp.InRange(AbiType.uint(8), V), TestUtil.PRE, TestUtil.PRE);
        assertEquals(BigInteger.ONE, Evaluator.word(uint8, env(255, 0)));
        assertEquals(BigInteger.ZERO, Evaluator.word(uint8, env(256, 0)));
    }

    @Test(expected = UnsupportedException.class)
    public void test_signed_range_is_unsupported() throws Exception {
        new SpecCompiler(SPEC).boolWord(new Exp.InRange(AbiType.int_(256), V), TestUtil.PRE, TestUtil.PRE);
    }

    @Test(expected = UnsupportedException.class)
    public void test_negative_literal_is_unsupported() throws Exception {
        new SpecCompiler(SPEC).word(Exp.lit(-1), TestUtil.PRE, TestUtil.PRE);
    }

    @Test(expected = UnsupportedException.class)
    public void test_undeclared_variable() throws Exception {
        StorageItem z = new StorageItem("Store", "z", new ValueType.PrimitiveType(UINT256));
        new SpecCompiler(SPEC).compile(behaviour(ImmutableList.of(),
                ImmutableList.of(new StorageUpdate(z, V)), null));
    }

    @Test(expected = UnsupportedException.class)
    public void test_post_reads_in_updates() throws Exception {
        new SpecCompiler(SPEC).compile(behaviour(ImmutableList.of(),
                ImmutableList.of(new StorageUpdate(X, new Exp.TEntry(Time.POST, Y))), null));
    }

    private static ImmutableMap<String, BigInteger> env(long v, long w) {
        return ImmutableMap.of("v", BigInteger.valueOf(v), "w", BigInteger.valueOf(w));
    }
}
