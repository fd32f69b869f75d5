package net.katagaitai.shiyou.verify;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import net.katagaitai.shiyou.decompile.UnsupportedException;
import net.katagaitai.shiyou.evm.Buf;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.Expr;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.util.Constants;
import net.katagaitai.shiyou.util.Z3Util;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Encodes symbolic terms into one Z3 context. Words are 256-bit vectors, buffers are arrays of
 * bytes indexed by words and storage is an array of words indexed by words. Symbols with the same
 * name in different programs denote the same value.
 */
class Z3Encoder {
    private static final int BYTE_BITS = 8;

    private final Context context;
    // word symbols by name, reported in counterexamples
    private final Map<String, BitVecExpr> symbols = Maps.newTreeMap();

    Z3Encoder(Context context) {
        this.context = context;
    }

    Map<String, BitVecExpr> getSymbols() {
        return symbols;
    }

    BoolExpr guard(End end) throws UnsupportedException {
        List<BoolExpr> props = Lists.newArrayList();
        for (Prop p : end.getProps()) {
            props.add(prop(p));
        }
        return context.mkAnd(props.toArray(new BoolExpr[0]));
    }

    BoolExpr prop(Prop p) throws UnsupportedException {
        if (p instanceof Prop.PEq) {
            Expr a = ((Prop.PEq) p).getA();
            Expr b = ((Prop.PEq) p).getB();
            if (a.getKind() != b.getKind()) {
                throw new UnsupportedException("equality of terms of different kinds: " + p);
            }
            switch (a.getKind()) {
                case WORD:
                    return context.mkEq(word((Word) a), word((Word) b));
                case BUF:
                    return context.mkEq(buf((Buf) a), buf((Buf) b));
                default:
                    return context.mkEq(store((Store) a), store((Store) b));
            }
        }
        if (p instanceof Prop.PLt) {
            return context.mkBVULT(word(((Prop.PLt) p).getA()), word(((Prop.PLt) p).getB()));
        }
        if (p instanceof Prop.PGt) {
            return context.mkBVUGT(word(((Prop.PGt) p).getA()), word(((Prop.PGt) p).getB()));
        }
        if (p instanceof Prop.PLeq) {
            return context.mkBVULE(word(((Prop.PLeq) p).getA()), word(((Prop.PLeq) p).getB()));
        }
        if (p instanceof Prop.PGeq) {
            return context.mkBVUGE(word(((Prop.PGeq) p).getA()), word(((Prop.PGeq) p).getB()));
        }
        if (p instanceof Prop.PNeg) {
            return context.mkNot(prop(((Prop.PNeg) p).getA()));
        }
        if (p instanceof Prop.PAnd) {
            return context.mkAnd(prop(((Prop.PAnd) p).getA()), prop(((Prop.PAnd) p).getB()));
        }
        if (p instanceof Prop.POr) {
            return context.mkOr(prop(((Prop.POr) p).getA()), prop(((Prop.POr) p).getB()));
        }
        if (p instanceof Prop.PImpl) {
            return context.mkImplies(prop(((Prop.PImpl) p).getA()), prop(((Prop.PImpl) p).getB()));
        }
        if (p instanceof Prop.PBool) {
            return context.mkBool(((Prop.PBool) p).isValue());
        }
        throw new IllegalStateException("unknown prop: " + p);
    }

    BitVecExpr word(Word w) throws UnsupportedException {
        if (w instanceof Word.Lit) {
            return Z3Util.mkBV(context, ((Word.Lit) w).getValue(), Constants.WORD_BITS);
        }
        if (w instanceof Word.Var) {
            return symbol(((Word.Var) w).getName());
        }
        if (w instanceof Word.Env) {
            return symbol("env_" + ((Word.Env) w).getVar().name().toLowerCase());
        }
        if (w instanceof Word.Add) {
            return context.mkBVAdd(word(((Word.Add) w).getA()), word(((Word.Add) w).getB()));
        }
        if (w instanceof Word.Sub) {
            return context.mkBVSub(word(((Word.Sub) w).getA()), word(((Word.Sub) w).getB()));
        }
        if (w instanceof Word.Mul) {
            return context.mkBVMul(word(((Word.Mul) w).getA()), word(((Word.Mul) w).getB()));
        }
        if (w instanceof Word.Div) {
            BitVecExpr b = word(((Word.Div) w).getB());
            return Z3Util.mkITE(context, Z3Util.isZero(context, b), zero(),
                    context.mkBVUDiv(word(((Word.Div) w).getA()), b));
        }
        if (w instanceof Word.Mod) {
            BitVecExpr b = word(((Word.Mod) w).getB());
            return Z3Util.mkITE(context, Z3Util.isZero(context, b), zero(),
                    context.mkBVURem(word(((Word.Mod) w).getA()), b));
        }
        if (w instanceof Word.Exp) {
            return exp((Word.Exp) w);
        }
        if (w instanceof Word.Lt) {
            return Z3Util.mkBool(context, context.mkBVULT(word(((Word.Lt) w).getA()), word(((Word.Lt) w).getB())));
        }
        if (w instanceof Word.Gt) {
            return Z3Util.mkBool(context, context.mkBVUGT(word(((Word.Gt) w).getA()), word(((Word.Gt) w).getB())));
        }
        if (w instanceof Word.SLt) {
            return Z3Util.mkBool(context, context.mkBVSLT(word(((Word.SLt) w).getA()), word(((Word.SLt) w).getB())));
        }
        if (w instanceof Word.SGt) {
            return Z3Util.mkBool(context, context.mkBVSGT(word(((Word.SGt) w).getA()), word(((Word.SGt) w).getB())));
        }
        if (w instanceof Word.Eq) {
            return Z3Util.mkBool(context, context.mkEq(word(((Word.Eq) w).getA()), word(((Word.Eq) w).getB())));
        }
        if (w instanceof Word.IsZero) {
            return Z3Util.mkBool(context, Z3Util.isZero(context, word(((Word.IsZero) w).getA())));
        }
        if (w instanceof Word.And) {
            return context.mkBVAND(word(((Word.And) w).getA()), word(((Word.And) w).getB()));
        }
        if (w instanceof Word.Or) {
            return context.mkBVOR(word(((Word.Or) w).getA()), word(((Word.Or) w).getB()));
        }
        if (w instanceof Word.Xor) {
            return context.mkBVXOR(word(((Word.Xor) w).getA()), word(((Word.Xor) w).getB()));
        }
        if (w instanceof Word.Not) {
            return context.mkBVNot(word(((Word.Not) w).getA()));
        }
        if (w instanceof Word.Shl) {
            return context.mkBVSHL(word(((Word.Shl) w).getValue()), word(((Word.Shl) w).getShift()));
        }
        if (w instanceof Word.Shr) {
            return context.mkBVLSHR(word(((Word.Shr) w).getValue()), word(((Word.Shr) w).getShift()));
        }
        if (w instanceof Word.SignExtend) {
            return signExtend((Word.SignExtend) w);
        }
        if (w instanceof Word.Ite) {
            Word.Ite ite = (Word.Ite) w;
            return Z3Util.mkITE(context, context.mkNot(Z3Util.isZero(context, word(ite.getCondition()))),
                    word(ite.getA()), word(ite.getB()));
        }
        if (w instanceof Word.SLoad) {
            Word.SLoad sload = (Word.SLoad) w;
            return Z3Util.mkSelect(context, store(sload.getStore()), word(sload.getKey()));
        }
        if (w instanceof Word.ReadWord) {
            return readWord(word(((Word.ReadWord) w).getOffset()), buf(((Word.ReadWord) w).getBuf()));
        }
        throw new IllegalStateException("unknown word: " + w);
    }

    ArrayExpr<BitVecSort, BitVecSort> buf(Buf b) throws UnsupportedException {
        if (b instanceof Buf.ConcreteBuf) {
            byte[] bytes = ((Buf.ConcreteBuf) b).getBytes();
            ArrayExpr<BitVecSort, BitVecSort> array = Z3Util.mkConstArray(context, Constants.WORD_BITS, BYTE_BITS);
            for (int i = 0; i < bytes.length; i++) {
                if (bytes[i] != 0) {
                    array = Z3Util.mkStore(context, array, Z3Util.mkBV(context, i, Constants.WORD_BITS),
                            Z3Util.mkBV(context, bytes[i] & 0xff, BYTE_BITS));
                }
            }
            return array;
        }
        if (b instanceof Buf.AbstractBuf) {
            return Z3Util.mkArrayConst(context, "buf_" + ((Buf.AbstractBuf) b).getName(), Constants.WORD_BITS, BYTE_BITS);
        }
        if (b instanceof Buf.WriteWord) {
            Buf.WriteWord write = (Buf.WriteWord) b;
            ArrayExpr<BitVecSort, BitVecSort> array = buf(write.getPrev());
            BitVecExpr offset = word(write.getOffset());
            BitVecExpr value = word(write.getValue());
            for (int i = 0; i < Constants.WORD_BYTES; i++) {
                int high = Constants.WORD_BITS - 1 - i * BYTE_BITS;
                BitVecExpr index = context.mkBVAdd(offset, Z3Util.mkBV(context, i, Constants.WORD_BITS));
                array = Z3Util.mkStore(context, array, index, context.mkExtract(high, high - BYTE_BITS + 1, value));
            }
            return array;
        }
        throw new IllegalStateException("unknown buffer: " + b);
    }

    ArrayExpr<BitVecSort, BitVecSort> store(Store s) throws UnsupportedException {
        if (s instanceof Store.AbstractStore) {
            return Z3Util.mkArrayConst(context, "storage_" + ((Store.AbstractStore) s).getAddress().getName(),
                    Constants.WORD_BITS, Constants.WORD_BITS);
        }
        if (s instanceof Store.ConcreteStore) {
            ArrayExpr<BitVecSort, BitVecSort> array = Z3Util.mkConstArray(context, Constants.WORD_BITS, Constants.WORD_BITS);
            for (Map.Entry<BigInteger, BigInteger> entry : ((Store.ConcreteStore) s).getSlots().entrySet()) {
                array = Z3Util.mkStore(context, array, Z3Util.mkBV(context, entry.getKey(), Constants.WORD_BITS),
                        Z3Util.mkBV(context, entry.getValue(), Constants.WORD_BITS));
            }
            return array;
        }
        if (s instanceof Store.SStore) {
            Store.SStore sstore = (Store.SStore) s;
            return Z3Util.mkStore(context, store(sstore.getPrev()), word(sstore.getKey()), word(sstore.getValue()));
        }
        throw new IllegalStateException("unknown store: " + s);
    }

    /**
     * Big-endian word starting at the offset.
     */
    BitVecExpr readWord(BitVecExpr offset, ArrayExpr<BitVecSort, BitVecSort> array) {
        BitVecExpr result = null;
        for (int i = 0; i < Constants.WORD_BYTES; i++) {
            BitVecExpr index = context.mkBVAdd(offset, Z3Util.mkBV(context, i, Constants.WORD_BITS));
            BitVecExpr b = Z3Util.mkSelect(context, array, index);
            result = result == null ? b : context.mkConcat(result, b);
        }
        return result;
    }

    private BitVecExpr symbol(String name) {
        return symbols.computeIfAbsent(name, n -> Z3Util.mkBVConst(context, n, Constants.WORD_BITS));
    }

    private BitVecExpr zero() {
        return Z3Util.mkBV(context, 0, Constants.WORD_BITS);
    }

    private BitVecExpr exp(Word.Exp w) throws UnsupportedException {
        if (!Word.isLit(w.getExponent()) || Word.litValue(w.getExponent()).compareTo(BigInteger.valueOf(Constants.WORD_BITS)) > 0) {
            throw new UnsupportedException("cannot encode exponentiation with a symbolic or large exponent: " + w);
        }
        BitVecExpr base = word(w.getBase());
        BitVecExpr result = Z3Util.mkBV(context, 1, Constants.WORD_BITS);
        for (int i = 0; i < Word.litValue(w.getExponent()).intValue(); i++) {
            result = context.mkBVMul(result, base);
        }
        return result;
    }

    private BitVecExpr signExtend(Word.SignExtend w) throws UnsupportedException {
        if (!Word.isLit(w.getIndex())) {
            throw new UnsupportedException("cannot encode sign extension from a symbolic byte: " + w);
        }
        BigInteger index = Word.litValue(w.getIndex());
        BitVecExpr value = word(w.getValue());
        if (index.compareTo(BigInteger.valueOf(Constants.WORD_BYTES - 1)) >= 0) {
            return value;
        }
        int bits = (index.intValue() + 1) * BYTE_BITS;
        return context.mkSignExt(Constants.WORD_BITS - bits, context.mkExtract(bits - 1, 0, value));
    }
}
