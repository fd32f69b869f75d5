package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.abi.AbiKind;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.Argument;
import net.katagaitai.shiyou.abi.Method;
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
import net.katagaitai.shiyou.spec.Interface;
import net.katagaitai.shiyou.spec.StorageUpdate;
import net.katagaitai.shiyou.util.Constants;
import net.katagaitai.shiyou.util.Util;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Turns the branches of a summarized contract into a constructor and one behaviour per method
 * branch. Entry points fail independently of each other.
 */
@Slf4j(topic = "shiyou")
public class SpecificationAssembler {

    public static AssemblyResult assemble(ContractSummary summary) {
        LayoutResolver layout = new LayoutResolver(summary.getName(), summary.getStorageLayout());
        List<EntryPointFailure> failures = Lists.newArrayList(summary.getFailures());

        Constructor constructor = null;
        if (summary.getCreation() != null) {
            try {
                constructor = mkConstructor(summary, layout);
            } catch (UnsupportedException e) {
                log.debug("constructor: {}", e.getMessage());
                failures.add(new EntryPointFailure(Constants.CONSTRUCTOR_NAME, e.getMessage()));
            }
        }

        List<Behaviour> behaviours = Lists.newArrayList();
        for (Map.Entry<Method, ImmutableSet<End>> entry : summary.getRuntime().entrySet()) {
            Method method = entry.getKey();
            try {
                List<Behaviour> assembled = Lists.newArrayList();
                for (End end : entry.getValue()) {
                    assembled.add(mkBehaviour(summary.getName(), layout, method, end));
                }
                behaviours.addAll(assembled);
            } catch (UnsupportedException e) {
                log.debug("{}: {}", method.getSignature(), e.getMessage());
                failures.add(new EntryPointFailure(method.getSignature(), e.getMessage()));
            }
        }

        return new AssemblyResult(
                ImmutableMap.of(summary.getName(), layout.declarations()),
                constructor,
                ImmutableList.copyOf(behaviours),
                ImmutableList.copyOf(failures));
    }

    static Constructor mkConstructor(ContractSummary summary, LayoutResolver layout) throws UnsupportedException {
        ImmutableSet<End> creation = summary.getCreation();
        if (creation.isEmpty()) {
            throw new UnsupportedException("creation code has no successful branch");
        }
        if (creation.size() > 1) {
            throw new UnsupportedException("cannot decompile constructors with multiple branches");
        }
        End end = creation.iterator().next();
        if (!(end instanceof End.Success)) {
            throw new IllegalStateException("constructor built from a non success branch: " + end);
        }
        End.Success success = (End.Success) end;
        ExpressionTranslator translator = new ExpressionTranslator(layout, summary.getCreationInterface());
        List<Exp<ABoolean>> preconditions = translateProps(translator, success.getProps());

        DistinctStore store = partitionEntrypoint(success);
        List<StorageUpdate> updates = mkUpdates(translator, layout, store);
        if (store.isConcreteBase()) {
            // fresh storage is zero
            for (BigInteger slot : layout.scalarSlots()) {
                if (!store.getWrites().containsKey(slot)) {
                    updates.add(new StorageUpdate(layout.resolveWrite(slot), Exp.lit(0)));
                }
            }
        }
        return new Constructor(
                summary.getName(),
                summary.getCreationInterface(),
                ImmutableList.copyOf(preconditions),
                ImmutableList.copyOf(updates));
    }

    static Behaviour mkBehaviour(String contract, LayoutResolver layout, Method method, End end)
            throws UnsupportedException {
        if (!(end instanceof End.Success)) {
            throw new IllegalStateException("behaviour built from a non success branch: " + end);
        }
        End.Success success = (End.Success) end;
        Interface iface = Interface.of(method);
        ExpressionTranslator translator = new ExpressionTranslator(layout, iface);
        List<Exp<ABoolean>> preconditions = translateProps(translator, success.getProps());
        Exp<AInteger> returns = mkReturns(translator, method, success.getReturnData());
        List<StorageUpdate> updates = mkUpdates(translator, layout, partitionEntrypoint(success));
        return new Behaviour(
                contract,
                method.getName(),
                iface,
                ImmutableList.copyOf(preconditions),
                ImmutableList.of(),
                ImmutableList.copyOf(updates),
                returns);
    }

    private static Exp<AInteger> mkReturns(ExpressionTranslator translator, Method method, Buf returnData)
            throws UnsupportedException {
        List<Argument> outputs = method.getOutputs();
        if (outputs.isEmpty()) {
            return null;
        }
        if (outputs.size() > 1) {
            throw new UnsupportedException("cannot decompile methods with multiple return types");
        }
        AbiType type = outputs.get(0).getType();
        if (type.getKind() == AbiKind.DYNAMIC) {
            throw new UnsupportedException("cannot decompile methods that return dynamically sized types");
        }
        if (type instanceof AbiType.Tuple) {
            throw new UnsupportedException("cannot decompile methods that return a tuple");
        }
        if (type instanceof AbiType.Function) {
            throw new UnsupportedException("cannot decompile methods that return a function pointer");
        }
        return translator.translateWord(Buf.readWord(Word.lit(0), returnData));
    }

    private static List<Exp<ABoolean>> translateProps(ExpressionTranslator translator, List<Prop> props)
            throws UnsupportedException {
        List<Exp<ABoolean>> result = Lists.newArrayList();
        for (Prop prop : props) {
            flattenAnd(translator.translateProp(prop), result);
        }
        return Util.nub(result);
    }

    private static void flattenAnd(Exp<ABoolean> e, List<Exp<ABoolean>> result) {
        if (e instanceof Exp.And) {
            flattenAnd(((Exp.And) e).getA(), result);
            flattenAnd(((Exp.And) e).getB(), result);
        } else {
            result.add(e);
        }
    }

    private static DistinctStore partitionEntrypoint(End.Success success) throws UnsupportedException {
        Map<Address, Store> storage = success.getStorage();
        if (storage.isEmpty()) {
            throw new IllegalStateException("unexpected empty state");
        }
        if (storage.size() > 1) {
            throw new UnsupportedException("cannot decompile methods that update storage on other contracts");
        }
        Map.Entry<Address, Store> entry = storage.entrySet().iterator().next();
        if (!entry.getKey().equals(Address.ENTRYPOINT)) {
            throw new IllegalStateException("state contains a single entry for an unexpected contract: " + storage);
        }
        return StoragePartitioner.partition(entry.getValue());
    }

    private static List<StorageUpdate> mkUpdates(ExpressionTranslator translator, LayoutResolver layout,
                                                 DistinctStore store) throws UnsupportedException {
        List<StorageUpdate> updates = Lists.newArrayList();
        for (Map.Entry<BigInteger, Word> write : store.getWrites().entrySet()) {
            updates.add(new StorageUpdate(layout.resolveWrite(write.getKey()), translator.translateWord(write.getValue())));
        }
        return updates;
    }
}
