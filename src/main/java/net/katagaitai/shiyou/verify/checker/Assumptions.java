package net.katagaitai.shiyou.verify.checker;

import com.google.common.collect.Lists;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.SlotType;
import net.katagaitai.shiyou.abi.ValueType;
import net.katagaitai.shiyou.decompile.Enricher;
import net.katagaitai.shiyou.evm.Address;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.EnvVar;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.SymbolicProgram;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.spec.Specification;
import net.katagaitai.shiyou.spec.StorageDeclaration;
import net.katagaitai.shiyou.spec.TypeBounds;
import net.katagaitai.shiyou.util.Constants;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Facts about the environment that both the specification and the bytecode may rely on: the
 * pre-state storage and the environment values hold values of their declared types.
 */
public class Assumptions {

    public static List<Prop> of(Specification spec) {
        List<Prop> result = Lists.newArrayList();
        Store pre = new Store.AbstractStore(Address.ENTRYPOINT);
        Map<String, StorageDeclaration> decls = spec.getStore().get(spec.getContract().getName());
        if (decls != null) {
            for (StorageDeclaration decl : decls.values()) {
                if (!(decl.getSlotType() instanceof SlotType.StorageValue)) {
                    continue;
                }
                ValueType valueType = ((SlotType.StorageValue) decl.getSlotType()).getType();
                if (!(valueType instanceof ValueType.PrimitiveType)) {
                    continue;
                }
                BigInteger upper = upper(((ValueType.PrimitiveType) valueType).getType());
                if (upper != null) {
                    result.add(new Prop.PLeq(new Word.SLoad(Word.lit(decl.getSlot()), pre), Word.lit(upper)));
                }
            }
        }
        for (EnvVar env : EnvVar.values()) {
            BigInteger upper = upper(Enricher.envType(env));
            if (upper != null) {
                result.add(new Prop.PLeq(new Word.Env(env), Word.lit(upper)));
            }
        }
        return result;
    }

    // null when the type spans the whole word or has no unsigned range
    private static BigInteger upper(AbiType type) {
        if (!(type instanceof AbiType.UInt || type instanceof AbiType.AddressType || type instanceof AbiType.Bool
                || type instanceof AbiType.FixedBytes)) {
            return null;
        }
        BigInteger upper = TypeBounds.upper(type);
        return upper.compareTo(Constants.MAX_UINT) < 0 ? upper : null;
    }

    public static SymbolicProgram assume(SymbolicProgram program, List<Prop> props) {
        List<End> ends = Lists.newArrayList();
        for (End end : program.flatten()) {
            ends.add(assume(end, props));
        }
        return SymbolicProgram.branches(ends);
    }

    public static End assume(End end, List<Prop> props) {
        List<Prop> all = Lists.newArrayList(end.getProps());
        all.addAll(props);
        if (end instanceof End.Success) {
            End.Success success = (End.Success) end;
            return new End.Success(all, success.getReturnData(), success.getStorage());
        }
        if (end instanceof End.Failure) {
            return new End.Failure(all, ((End.Failure) end).getReason());
        }
        return new End.Partial(all, ((End.Partial) end).getReason());
    }
}
