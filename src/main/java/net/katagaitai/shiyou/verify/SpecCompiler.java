package net.katagaitai.shiyou.verify;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.decompile.UnsupportedException;
import net.katagaitai.shiyou.evm.Address;
import net.katagaitai.shiyou.evm.Buf;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.spec.ABoolean;
import net.katagaitai.shiyou.spec.AInteger;
import net.katagaitai.shiyou.spec.Behaviour;
import net.katagaitai.shiyou.spec.Constructor;
import net.katagaitai.shiyou.spec.Exp;
import net.katagaitai.shiyou.spec.SType;
import net.katagaitai.shiyou.spec.Specification;
import net.katagaitai.shiyou.spec.StorageDeclaration;
import net.katagaitai.shiyou.spec.StorageItem;
import net.katagaitai.shiyou.spec.StorageUpdate;
import net.katagaitai.shiyou.spec.Time;
import net.katagaitai.shiyou.spec.TypeBounds;
import net.katagaitai.shiyou.util.Constants;

import java.math.BigInteger;
import java.util.List;

/**
 * Compiles a specification back into terminal states over machine words, so that it can be
 * compared with the bytecode. Integers become words; this is exact as long as no intermediate
 * value leaves the word range, which is what the range conditions of the specification say.
 */
public class SpecCompiler {
    private final Specification spec;

    public SpecCompiler(Specification spec) {
        this.spec = spec;
    }

    public End.Success compile(Constructor ctor) throws UnsupportedException {
        Store pre = new Store.ConcreteStore(ImmutableMap.of());
        Store post = pre;
        for (StorageUpdate update : ctor.getInitialStorage()) {
            post = new Store.SStore(Word.lit(slot(update.getItem())), word(update.getValue(), pre, null), post);
        }
        List<Prop> props = Lists.newArrayList();
        for (Exp<ABoolean> e : ctor.getPreconditions()) {
            props.add(prop(e, pre, post));
        }
        return new End.Success(props, Buf.EMPTY, ImmutableMap.of(Address.ENTRYPOINT, post));
    }

    public End.Success compile(Behaviour behaviour) throws UnsupportedException {
        Store pre = new Store.AbstractStore(Address.ENTRYPOINT);
        Store post = pre;
        for (StorageUpdate update : behaviour.getStorageUpdates()) {
            post = new Store.SStore(Word.lit(slot(update.getItem())), word(update.getValue(), pre, null), post);
        }
        List<Prop> props = Lists.newArrayList();
        for (Exp<ABoolean> e : behaviour.getPreconditions()) {
            props.add(prop(e, pre, post));
        }
        for (Exp<ABoolean> e : behaviour.getCaseConditions()) {
            props.add(prop(e, pre, post));
        }
        Buf returnData = Buf.EMPTY;
        if (behaviour.hasReturns()) {
            returnData = new Buf.WriteWord(Word.lit(0), word(behaviour.getReturns(), pre, post), Buf.EMPTY);
        }
        return new End.Success(props, returnData, ImmutableMap.of(Address.ENTRYPOINT, post));
    }

    private BigInteger slot(StorageItem item) throws UnsupportedException {
        StorageDeclaration decl = spec.lookup(item.getContract(), item.getName());
        if (decl == null) {
            throw new UnsupportedException("storage variable not declared: " + item);
        }
        return decl.getSlot();
    }

    Prop prop(Exp<ABoolean> e, Store pre, Store post) throws UnsupportedException {
        if (e instanceof Exp.LitBool) {
            return new Prop.PBool(((Exp.LitBool) e).isValue());
        }
        if (e instanceof Exp.And) {
            return new Prop.PAnd(prop(((Exp.And) e).getA(), pre, post), prop(((Exp.And) e).getB(), pre, post));
        }
        if (e instanceof Exp.Or) {
            return new Prop.POr(prop(((Exp.Or) e).getA(), pre, post), prop(((Exp.Or) e).getB(), pre, post));
        }
        if (e instanceof Exp.Impl) {
            return new Prop.PImpl(prop(((Exp.Impl) e).getA(), pre, post), prop(((Exp.Impl) e).getB(), pre, post));
        }
        if (e instanceof Exp.Neg) {
            return new Prop.PNeg(prop(((Exp.Neg) e).getA(), pre, post));
        }
        if (e instanceof Exp.LT) {
            return new Prop.PLt(word(((Exp.LT) e).getA(), pre, post), word(((Exp.LT) e).getB(), pre, post));
        }
        if (e instanceof Exp.LEQ) {
            return new Prop.PLeq(word(((Exp.LEQ) e).getA(), pre, post), word(((Exp.LEQ) e).getB(), pre, post));
        }
        if (e instanceof Exp.GT) {
            return new Prop.PGt(word(((Exp.GT) e).getA(), pre, post), word(((Exp.GT) e).getB(), pre, post));
        }
        if (e instanceof Exp.GEQ) {
            return new Prop.PGeq(word(((Exp.GEQ) e).getA(), pre, post), word(((Exp.GEQ) e).getB(), pre, post));
        }
        if (e instanceof Exp.Eq && ((Exp.Eq<?>) e).getOperandSort() == SType.INTEGER) {
            @SuppressWarnings("unchecked")
            Exp.Eq<AInteger> eq = (Exp.Eq<AInteger>) e;
            return new Prop.PEq(word(eq.getA(), pre, post), word(eq.getB(), pre, post));
        }
        if (e instanceof Exp.NEq && ((Exp.NEq<?>) e).getOperandSort() == SType.INTEGER) {
            @SuppressWarnings("unchecked")
            Exp.NEq<AInteger> neq = (Exp.NEq<AInteger>) e;
            return new Prop.PNeg(new Prop.PEq(word(neq.getA(), pre, post), word(neq.getB(), pre, post)));
        }
        return Prop.isTrue(boolWord(e, pre, post));
    }

    /**
     * A boolean as the word 1 or 0.
     */
    Word boolWord(Exp<ABoolean> e, Store pre, Store post) throws UnsupportedException {
        if (e instanceof Exp.LitBool) {
            return Word.lit(((Exp.LitBool) e).isValue() ? 1 : 0);
        }
        if (e instanceof Exp.Var) {
            // a bool argument is a word holding 0 or 1
            return Word.var(((Exp.Var<?>) e).getName());
        }
        if (e instanceof Exp.And) {
            return new Word.And(boolWord(((Exp.And) e).getA(), pre, post), boolWord(((Exp.And) e).getB(), pre, post));
        }
        if (e instanceof Exp.Or) {
            return new Word.Or(boolWord(((Exp.Or) e).getA(), pre, post), boolWord(((Exp.Or) e).getB(), pre, post));
        }
        if (e instanceof Exp.Impl) {
            return new Word.Or(new Word.IsZero(boolWord(((Exp.Impl) e).getA(), pre, post)),
                    boolWord(((Exp.Impl) e).getB(), pre, post));
        }
        if (e instanceof Exp.Neg) {
            return new Word.IsZero(boolWord(((Exp.Neg) e).getA(), pre, post));
        }
        if (e instanceof Exp.LT) {
            return new Word.Lt(word(((Exp.LT) e).getA(), pre, post), word(((Exp.LT) e).getB(), pre, post));
        }
        if (e instanceof Exp.LEQ) {
            return new Word.IsZero(new Word.Gt(word(((Exp.LEQ) e).getA(), pre, post), word(((Exp.LEQ) e).getB(), pre, post)));
        }
        if (e instanceof Exp.GT) {
            return new Word.Gt(word(((Exp.GT) e).getA(), pre, post), word(((Exp.GT) e).getB(), pre, post));
        }
        if (e instanceof Exp.GEQ) {
            return new Word.IsZero(new Word.Lt(word(((Exp.GEQ) e).getA(), pre, post), word(((Exp.GEQ) e).getB(), pre, post)));
        }
        if (e instanceof Exp.Eq) {
            return new Word.Eq(operand(((Exp.Eq<?>) e).getA(), pre, post), operand(((Exp.Eq<?>) e).getB(), pre, post));
        }
        if (e instanceof Exp.NEq) {
            return new Word.IsZero(new Word.Eq(operand(((Exp.NEq<?>) e).getA(), pre, post),
                    operand(((Exp.NEq<?>) e).getB(), pre, post)));
        }
        if (e instanceof Exp.ITE) {
            @SuppressWarnings("unchecked")
            Exp.ITE<ABoolean> ite = (Exp.ITE<ABoolean>) e;
            return new Word.Ite(boolWord(ite.getCondition(), pre, post),
                    boolWord(ite.getA(), pre, post), boolWord(ite.getB(), pre, post));
        }
        if (e instanceof Exp.InRange) {
            return inRange((Exp.InRange) e, pre, post);
        }
        throw new UnsupportedException("cannot compile boolean expression: " + e);
    }

    @SuppressWarnings("unchecked")
    private Word operand(Exp<?> e, Store pre, Store post) throws UnsupportedException {
        if (e.getSort() == SType.INTEGER) {
            return word((Exp<AInteger>) e, pre, post);
        }
        if (e.getSort() == SType.BOOLEAN) {
            return boolWord((Exp<ABoolean>) e, pre, post);
        }
        throw new UnsupportedException("cannot compile comparisons of sort " + e.getSort() + ": " + e);
    }

    Word word(Exp<AInteger> e, Store pre, Store post) throws UnsupportedException {
        if (e instanceof Exp.LitInt) {
            BigInteger value = ((Exp.LitInt) e).getValue();
            if (value.signum() < 0 || value.compareTo(Constants.MAX_UINT) > 0) {
                throw new UnsupportedException("cannot compile integer literal outside the word range: " + value);
            }
            return Word.lit(value);
        }
        if (e instanceof Exp.Var) {
            Exp.Var<?> var = (Exp.Var<?>) e;
            if (var.getAbiType() instanceof AbiType.Int) {
                throw new UnsupportedException("cannot compile signed variables: " + var.getName());
            }
            return Word.var(var.getName());
        }
        if (e instanceof Exp.IntEnv) {
            return new Word.Env(((Exp.IntEnv) e).getEnv());
        }
        if (e instanceof Exp.TEntry) {
            Exp.TEntry entry = (Exp.TEntry) e;
            Store store = entry.getTime() == Time.PRE ? pre : post;
            if (store == null) {
                throw new UnsupportedException("cannot compile post state reads in storage updates: " + e);
            }
            return new Word.SLoad(Word.lit(slot(entry.getItem())), store);
        }
        if (e instanceof Exp.Add) {
            return new Word.Add(word(((Exp.Add) e).getA(), pre, post), word(((Exp.Add) e).getB(), pre, post));
        }
        if (e instanceof Exp.Sub) {
            return new Word.Sub(word(((Exp.Sub) e).getA(), pre, post), word(((Exp.Sub) e).getB(), pre, post));
        }
        if (e instanceof Exp.Mul) {
            return new Word.Mul(word(((Exp.Mul) e).getA(), pre, post), word(((Exp.Mul) e).getB(), pre, post));
        }
        if (e instanceof Exp.Div) {
            return new Word.Div(word(((Exp.Div) e).getA(), pre, post), word(((Exp.Div) e).getB(), pre, post));
        }
        if (e instanceof Exp.Mod) {
            return new Word.Mod(word(((Exp.Mod) e).getA(), pre, post), word(((Exp.Mod) e).getB(), pre, post));
        }
        if (e instanceof Exp.Pow) {
            return new Word.Exp(word(((Exp.Pow) e).getA(), pre, post), word(((Exp.Pow) e).getB(), pre, post));
        }
        if (e instanceof Exp.ITE) {
            @SuppressWarnings("unchecked")
            Exp.ITE<AInteger> ite = (Exp.ITE<AInteger>) e;
            return new Word.Ite(boolWord(ite.getCondition(), pre, post),
                    word(ite.getA(), pre, post), word(ite.getB(), pre, post));
        }
        throw new UnsupportedException("cannot compile integer expression: " + e);
    }

    /**
     * The value is in range iff no operation wraps around and the word is below the upper bound.
     */
    private Word inRange(Exp.InRange e, Store pre, Store post) throws UnsupportedException {
        AbiType type = e.getType();
        if (type instanceof AbiType.Int) {
            throw new UnsupportedException("cannot compile range checks of signed types: " + e);
        }
        BigInteger upper = TypeBounds.upper(type);
        Word result = noWrap(e.getE(), pre, post);
        if (upper.compareTo(Constants.MAX_UINT) < 0) {
            Word below = new Word.IsZero(new Word.Gt(word(e.getE(), pre, post), Word.lit(upper)));
            result = result == null ? below : new Word.And(result, below);
        }
        return result == null ? Word.lit(1) : result;
    }

    // null when nothing can wrap
    private Word noWrap(Exp<AInteger> e, Store pre, Store post) throws UnsupportedException {
        if (!(e instanceof Exp.IntBinOp)) {
            return null;
        }
        Exp.IntBinOp op = (Exp.IntBinOp) e;
        Word a = word(op.getA(), pre, post);
        Word b = word(op.getB(), pre, post);
        Word own = null;
        if (e instanceof Exp.Add) {
            // a <= a + b
            own = new Word.IsZero(new Word.Gt(a, new Word.Add(a, b)));
        } else if (e instanceof Exp.Sub) {
            // b <= a
            own = new Word.IsZero(new Word.Gt(b, a));
        } else if (e instanceof Exp.Mul) {
            // a == 0 || (a * b) / a == b
            own = new Word.Or(new Word.IsZero(a), new Word.Eq(new Word.Div(new Word.Mul(a, b), a), b));
        } else if (e instanceof Exp.Pow) {
            throw new UnsupportedException("cannot compile range checks of exponentiation: " + e);
        }
        Word result = own;
        for (Word child : new Word[]{noWrap(op.getA(), pre, post), noWrap(op.getB(), pre, post)}) {
            if (child != null) {
                result = result == null ? child : new Word.And(result, child);
            }
        }
        return result;
    }
}
