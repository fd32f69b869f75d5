package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import net.katagaitai.shiyou.abi.AbiKind;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.Argument;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.evm.Buf;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.SymbolicCalldata;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.spec.Interface;
import net.katagaitai.shiyou.util.Constants;
import net.katagaitai.shiyou.util.Util;

import java.util.List;

/**
 * Builds fully symbolic inputs for the entry points of a contract. Every static argument becomes
 * one symbolic word named after the argument, constrained to the values its type can hold.
 */
public class CalldataBuilder {

    /**
     * Calldata of a method call: the selector followed by one word per argument.
     */
    public static SymbolicCalldata forMethod(Method method) throws UnsupportedException {
        Buf buf = new Buf.ConcreteBuf(method.getSelector().toBytes());
        List<Prop> assumptions = Lists.newArrayList();
        List<Argument> inputs = method.getInputs();
        for (int i = 0; i < inputs.size(); i++) {
            Word offset = Word.lit(Constants.SELECTOR_BYTES + (long) Constants.WORD_BYTES * i);
            Word.Var var = Word.var(Interface.argumentName(inputs.get(i), i));
            buf = new Buf.WriteWord(offset, var, buf);
            assumptions.addAll(typeAssumptions(inputs.get(i).getType(), var));
        }
        return new SymbolicCalldata(buf, ImmutableList.copyOf(assumptions));
    }

    /**
     * Constructor arguments, which the caller appends to the creation code.
     */
    public static SymbolicCalldata forConstructor(List<Argument> inputs) throws UnsupportedException {
        Buf buf = Buf.EMPTY;
        List<Prop> assumptions = Lists.newArrayList();
        for (int i = 0; i < inputs.size(); i++) {
            Word offset = Word.lit((long) Constants.WORD_BYTES * i);
            Word.Var var = Word.var(Interface.argumentName(inputs.get(i), i));
            buf = new Buf.WriteWord(offset, var, buf);
            assumptions.addAll(typeAssumptions(inputs.get(i).getType(), var));
        }
        return new SymbolicCalldata(buf, ImmutableList.copyOf(assumptions));
    }

    /**
     * Completely unconstrained calldata, used to look for reachable code behind unknown selectors.
     */
    public static SymbolicCalldata unconstrained() {
        return new SymbolicCalldata(new Buf.AbstractBuf(Constants.CALLDATA_BUFFER), ImmutableList.of());
    }

    /**
     * Facts that hold for every abi encoded value of the given type.
     */
    public static List<Prop> typeAssumptions(AbiType type, Word var) throws UnsupportedException {
        if (type.getKind() == AbiKind.DYNAMIC) {
            throw new UnsupportedException("cannot decompile methods with dynamically sized arguments: " + type);
        }
        if (type instanceof AbiType.UInt) {
            int bits = ((AbiType.UInt) type).getBits();
            return bits == Constants.WORD_BITS
                    ? ImmutableList.of()
                    : ImmutableList.of(new Prop.PLeq(var, Word.lit(Util.maxUnsigned(bits))));
        }
        if (type instanceof AbiType.AddressType) {
            return ImmutableList.of(new Prop.PLeq(var, Word.lit(Util.maxUnsigned(160))));
        }
        if (type instanceof AbiType.Bool) {
            return ImmutableList.of(new Prop.PLeq(var, Word.lit(1)));
        }
        if (type instanceof AbiType.Int) {
            int bits = ((AbiType.Int) type).getBits();
            return bits == Constants.WORD_BITS
                    ? ImmutableList.of()
                    : ImmutableList.of(new Prop.PEq(new Word.SignExtend(Word.lit(bits / 8 - 1), var), var));
        }
        if (type instanceof AbiType.FixedBytes) {
            if (((AbiType.FixedBytes) type).getSize() != Constants.WORD_BYTES) {
                // left aligned in the word, so the integer value is not the declared range
                throw new UnsupportedException("cannot decompile methods with arguments of type: " + type);
            }
            return ImmutableList.of();
        }
        throw new UnsupportedException("cannot decompile methods with arguments of type: " + type);
    }
}
