package net.katagaitai.shiyou.decompile;

import net.katagaitai.shiyou.abi.AbiKind;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.evm.Address;
import net.katagaitai.shiyou.evm.Expr;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.spec.ABoolean;
import net.katagaitai.shiyou.spec.AInteger;
import net.katagaitai.shiyou.spec.Decl;
import net.katagaitai.shiyou.spec.Exp;
import net.katagaitai.shiyou.spec.Interface;
import net.katagaitai.shiyou.spec.SType;
import net.katagaitai.shiyou.spec.Time;
import net.katagaitai.shiyou.util.Constants;

/**
 * Translates machine words and path conditions of one entry point into specification
 * expressions. Calldata variables are typed by the entry point's interface.
 */
public class ExpressionTranslator {
    private static final AbiType UINT256 = AbiType.uint(256);

    private final LayoutResolver layout;
    private final Interface iface;

    public ExpressionTranslator(LayoutResolver layout, Interface iface) {
        this.layout = layout;
        this.iface = iface;
    }

    public Exp<ABoolean> translateProp(Prop prop) throws UnsupportedException {
        return BoolCanonicalizer.canonicalize(prop(prop));
    }

    private Exp<ABoolean> prop(Prop p) throws UnsupportedException {
        if (p instanceof Prop.PEq) {
            Prop.PEq eq = (Prop.PEq) p;
            if (eq.getA().getKind() != Expr.Kind.WORD || eq.getB().getKind() != Expr.Kind.WORD) {
                throw new UnsupportedException("cannot decompile props comparing equality of non word terms: " + p);
            }
            return Exp.eq(translateWord((Word) eq.getA()), translateWord((Word) eq.getB()));
        }
        if (p instanceof Prop.PLt) {
            Prop.PLt lt = (Prop.PLt) p;
            return new Exp.LT(translateWord(lt.getA()), translateWord(lt.getB()));
        }
        if (p instanceof Prop.PGt) {
            Prop.PGt gt = (Prop.PGt) p;
            return new Exp.GT(translateWord(gt.getA()), translateWord(gt.getB()));
        }
        if (p instanceof Prop.PLeq) {
            Prop.PLeq leq = (Prop.PLeq) p;
            return new Exp.LEQ(translateWord(leq.getA()), translateWord(leq.getB()));
        }
        if (p instanceof Prop.PGeq) {
            Prop.PGeq geq = (Prop.PGeq) p;
            return new Exp.GEQ(translateWord(geq.getA()), translateWord(geq.getB()));
        }
        if (p instanceof Prop.PNeg) {
            return Exp.not(prop(((Prop.PNeg) p).getA()));
        }
        if (p instanceof Prop.PAnd) {
            Prop.PAnd and = (Prop.PAnd) p;
            return Exp.and(prop(and.getA()), prop(and.getB()));
        }
        if (p instanceof Prop.POr) {
            Prop.POr or = (Prop.POr) p;
            return Exp.or(prop(or.getA()), prop(or.getB()));
        }
        if (p instanceof Prop.PImpl) {
            Prop.PImpl impl = (Prop.PImpl) p;
            return new Exp.Impl(prop(impl.getA()), prop(impl.getB()));
        }
        if (p instanceof Prop.PBool) {
            return Exp.lit(((Prop.PBool) p).isValue());
        }
        throw new IllegalStateException("unknown prop: " + p);
    }

    public Exp<AInteger> translateWord(Word w) throws UnsupportedException {
        return word(w, w);
    }

    private Exp<AInteger> word(Word w, Word outer) throws UnsupportedException {
        // identifiers

        if (w instanceof Word.Lit) {
            return Exp.lit(((Word.Lit) w).getValue());
        }
        if (w instanceof Word.Var) {
            return variable(((Word.Var) w).getName());
        }
        if (w instanceof Word.Env) {
            return new Exp.IntEnv(((Word.Env) w).getVar());
        }

        // overflow checks

        // ~a < b  <=>  MAX_UINT - a < b  <=>  MAX_UINT < a + b
        if (w instanceof Word.Lt && ((Word.Lt) w).getA() instanceof Word.Not) {
            Word a = ((Word.Not) ((Word.Lt) w).getA()).getA();
            Word b = ((Word.Lt) w).getB();
            return Exp.evmBool(Exp.not(new Exp.InRange(UINT256, new Exp.Add(word(a, outer), word(b, outer)))));
        }
        // a != 0 && MAX_UINT / a < c  <=>  a != 0 && MAX_UINT < a * c
        if (isMulOverflowCheck(w)) {
            Word.And and = (Word.And) w;
            Word a = ((Word.IsZero) ((Word.IsZero) and.getA()).getA()).getA();
            Word c = ((Word.Lt) and.getB()).getB();
            Exp<AInteger> a1 = word(a, outer);
            Exp<AInteger> c1 = word(c, outer);
            return Exp.evmBool(Exp.and(
                    Exp.not(Exp.eq(a1, Exp.lit(0))),
                    Exp.not(new Exp.InRange(UINT256, new Exp.Mul(a1, c1)))));
        }

        // booleans

        if (w instanceof Word.Lt) {
            Word.Lt lt = (Word.Lt) w;
            return Exp.evmBool(new Exp.LT(word(lt.getA(), outer), word(lt.getB(), outer)));
        }
        if (w instanceof Word.Gt) {
            Word.Gt gt = (Word.Gt) w;
            return Exp.evmBool(new Exp.GT(word(gt.getA(), outer), word(gt.getB(), outer)));
        }
        if (w instanceof Word.Eq) {
            Word.Eq eq = (Word.Eq) w;
            return Exp.evmBool(Exp.eq(word(eq.getA(), outer), word(eq.getB(), outer)));
        }
        if (w instanceof Word.IsZero) {
            return Exp.evmBool(Exp.eq(word(((Word.IsZero) w).getA(), outer), Exp.lit(0)));
        }

        // arithmetic

        if (w instanceof Word.Add) {
            Word.Add add = (Word.Add) w;
            return new Exp.Add(word(add.getA(), outer), word(add.getB(), outer));
        }
        if (w instanceof Word.Sub) {
            Word.Sub sub = (Word.Sub) w;
            return new Exp.Sub(word(sub.getA(), outer), word(sub.getB(), outer));
        }
        if (w instanceof Word.Div) {
            Word.Div div = (Word.Div) w;
            return new Exp.Div(word(div.getA(), outer), word(div.getB(), outer));
        }
        if (w instanceof Word.Mul) {
            Word.Mul mul = (Word.Mul) w;
            return new Exp.Mul(word(mul.getA(), outer), word(mul.getB(), outer));
        }
        if (w instanceof Word.Mod) {
            Word.Mod mod = (Word.Mod) w;
            return new Exp.Mod(word(mod.getA(), outer), word(mod.getB(), outer));
        }

        // storage

        if (w instanceof Word.SLoad) {
            Word.SLoad sload = (Word.SLoad) w;
            if (Word.isLit(sload.getKey()) && sload.getStore() instanceof Store.AbstractStore) {
                Address address = ((Store.AbstractStore) sload.getStore()).getAddress();
                if (!address.getName().equals(Constants.ENTRYPOINT_ADDRESS)) {
                    throw new UnsupportedException("cannot decompile reads from the storage of other contracts: " + w);
                }
                return new Exp.TEntry(Time.PRE, layout.resolveRead(Word.litValue(sload.getKey())));
            }
            throw new UnsupportedException("cannot decompile storage reads with symbolic keys or over unresolved writes: " + w);
        }

        throw new UnsupportedException("unable to convert to word: " + w + "\nouter expression: " + outer);
    }

    private Exp<AInteger> variable(String name) throws UnsupportedException {
        Decl decl = iface.lookup(name);
        if (decl == null) {
            return Exp.intVar(AbiType.bytes(32), name);
        }
        AbiType type = decl.getType();
        if (type.getKind() == AbiKind.DYNAMIC) {
            throw new UnsupportedException("cannot decompile methods that take dynamically sized arguments: " + decl);
        }
        if (type instanceof AbiType.Bool) {
            return Exp.evmBool(new Exp.Var<>(SType.BOOLEAN, type, name));
        }
        if (type instanceof AbiType.Tuple || type instanceof AbiType.Function || type instanceof AbiType.FixedArray) {
            throw new UnsupportedException("cannot decompile reads of arguments of type: " + type);
        }
        return Exp.intVar(type, name);
    }

    private static boolean isMulOverflowCheck(Word w) {
        if (!(w instanceof Word.And)) {
            return false;
        }
        Word.And and = (Word.And) w;
        if (!(and.getA() instanceof Word.IsZero) || !(((Word.IsZero) and.getA()).getA() instanceof Word.IsZero)) {
            return false;
        }
        if (!(and.getB() instanceof Word.Lt) || !(((Word.Lt) and.getB()).getA() instanceof Word.Div)) {
            return false;
        }
        Word a = ((Word.IsZero) ((Word.IsZero) and.getA()).getA()).getA();
        Word.Div div = (Word.Div) ((Word.Lt) and.getB()).getA();
        return Word.isLit(div.getA()) && Word.litValue(div.getA()).equals(Constants.MAX_UINT) && a.equals(div.getB());
    }
}
