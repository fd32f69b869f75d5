package net.katagaitai.shiyou;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.Argument;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.abi.SlotType;
import net.katagaitai.shiyou.abi.StorageLayoutItem;
import net.katagaitai.shiyou.abi.ValueType;
import net.katagaitai.shiyou.artifact.SolcContract;
import net.katagaitai.shiyou.evm.Address;
import net.katagaitai.shiyou.evm.Buf;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.EnvVar;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.util.Constants;

import java.math.BigInteger;
import java.util.List;

public class TestUtil {
    public static final Method SET = new Method("set",
            ImmutableList.of(new Argument("v", AbiType.uint(256))), ImmutableList.of());
    public static final Method GET = new Method("get",
            ImmutableList.of(), ImmutableList.of(new Argument("", AbiType.uint(256))));
    public static final Method NAME = new Method("name",
            ImmutableList.of(), ImmutableList.of(new Argument("", AbiType.parse("string"))));

    public static final Store PRE = new Store.AbstractStore(Address.ENTRYPOINT);
    public static final Word CALLVALUE = new Word.Env(EnvVar.CALLVALUE);
    public static final Prop NO_VALUE = new Prop.PEq(CALLVALUE, Word.lit(0));

    public static StorageLayoutItem uintVariable(String name, long slot) {
        return variable(name, slot, 0, AbiType.uint(256));
    }

    public static StorageLayoutItem variable(String name, long slot, int offset, AbiType type) {
        return new StorageLayoutItem(name, BigInteger.valueOf(slot), offset,
                new SlotType.StorageValue(new ValueType.PrimitiveType(type)));
    }

    public static ImmutableMap<String, StorageLayoutItem> layout(StorageLayoutItem... items) {
        ImmutableMap.Builder<String, StorageLayoutItem> builder = ImmutableMap.builder();
        for (StorageLayoutItem item : items) {
            builder.put(item.getName(), item);
        }
        return builder.build();
    }

    /**
     * contract Store { uint256 x; function set(uint256 v) { x = v; } function get() returns (uint256) }
     */
    public static SolcContract storeContract(Method... methods) {
        return SolcContract.builder()
                .name("src/Store.sol:Store")
                .creationCode(new byte[]{0x60, 0x00})
                .runtimeCode(new byte[]{0x60, 0x01})
                .methods(ImmutableList.copyOf(methods))
                .storageLayout(layout(uintVariable("x", 0)))
                .build();
    }

    public static End.Success success(List<Prop> props, Store store) {
        return new End.Success(props, Buf.EMPTY, ImmutableMap.of(Address.ENTRYPOINT, store));
    }

    public static End.Success success(List<Prop> props, Buf returnData, Store store) {
        return new End.Success(props, returnData, ImmutableMap.of(Address.ENTRYPOINT, store));
    }

    public static End.Failure revert(List<Prop> props) {
        return new End.Failure(props, "revert");
    }

    public static Buf returning(Word value) {
        return new Buf.WriteWord(Word.lit(0), value, Buf.EMPTY);
    }

    public static Store freshStore() {
        return new Store.ConcreteStore(ImmutableMap.of());
    }

    // the selector as the runtime dispatcher reads it
    public static Word selectorOf(Buf calldata) {
        return new Word.Shr(Word.lit(Constants.WORD_BITS - Constants.SELECTOR_BYTES * 8),
                new Word.ReadWord(Word.lit(0), calldata));
    }
}
