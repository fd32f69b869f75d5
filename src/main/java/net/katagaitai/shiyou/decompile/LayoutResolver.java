package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import lombok.Getter;
import net.katagaitai.shiyou.abi.AbiKind;
import net.katagaitai.shiyou.abi.AbiType;
import net.katagaitai.shiyou.abi.SlotType;
import net.katagaitai.shiyou.abi.StorageLayoutItem;
import net.katagaitai.shiyou.abi.ValueType;
import net.katagaitai.shiyou.spec.StorageDeclaration;
import net.katagaitai.shiyou.spec.StorageItem;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps concrete storage slots back to the variables the compiler placed there.
 */
public class LayoutResolver {
    @Getter
    private final String contract;
    private final ImmutableMap<Pair<BigInteger, Integer>, StorageLayoutItem> inverted;
    private final Set<BigInteger> packedSlots = Sets.newHashSet();

    public LayoutResolver(String contract, Map<String, StorageLayoutItem> layout) {
        this.contract = contract;
        Map<Pair<BigInteger, Integer>, StorageLayoutItem> map = Maps.newLinkedHashMap();
        Set<BigInteger> seen = Sets.newHashSet();
        for (StorageLayoutItem item : layout.values()) {
            map.put(Pair.of(item.getSlot(), item.getOffset()), item);
            if (!seen.add(item.getSlot())) {
                packedSlots.add(item.getSlot());
            }
        }
        this.inverted = ImmutableMap.copyOf(map);
    }

    public StorageLayoutItem lookup(BigInteger slot, int offset) {
        return inverted.get(Pair.of(slot, offset));
    }

    /**
     * Resolves a read of a whole slot from the pre-state storage.
     */
    public StorageItem resolveRead(BigInteger slot) throws UnsupportedException {
        StorageLayoutItem item = lookup(slot, 0);
        if (item == null) {
            throw new UnsupportedException("read from a storage location that is not present in the solc layout: " + slot);
        }
        if (packedSlots.contains(slot)) {
            throw new UnsupportedException("cannot decompile reads from packed storage slots: " + slot);
        }
        SlotType slotType = item.getSlotType();
        if (slotType instanceof SlotType.StorageValue) {
            ValueType valueType = ((SlotType.StorageValue) slotType).getType();
            if (valueType instanceof ValueType.PrimitiveType && isWordSized(((ValueType.PrimitiveType) valueType).getType())) {
                return new StorageItem(contract, item.getName(), valueType);
            }
        }
        throw new UnsupportedException("unable to handle storage reads for variables of type: " + slotType);
    }

    /**
     * Resolves the target of a write to a whole slot.
     */
    public StorageItem resolveWrite(BigInteger slot) throws UnsupportedException {
        StorageLayoutItem item = lookup(slot, 0);
        if (item == null) {
            throw new UnsupportedException("write to a storage location that is not mentioned in the solc layout: " + slot);
        }
        SlotType slotType = item.getSlotType();
        if (slotType instanceof SlotType.StorageMapping) {
            throw new UnsupportedException("cannot decompile contracts that write to mappings");
        }
        ValueType valueType = ((SlotType.StorageValue) slotType).getType();
        if (valueType instanceof ValueType.ContractType) {
            throw new UnsupportedException("cannot decompile contracts that have contract types in storage");
        }
        AbiType type = ((ValueType.PrimitiveType) valueType).getType();
        if (type.getKind() == AbiKind.DYNAMIC) {
            throw new UnsupportedException("cannot decompile methods that store dynamically sized types");
        }
        if (type instanceof AbiType.Tuple) {
            throw new UnsupportedException("cannot decompile methods that write to tuple in storage");
        }
        if (type instanceof AbiType.Function) {
            throw new UnsupportedException("cannot decompile methods that store function pointers");
        }
        if (packedSlots.contains(slot)) {
            throw new UnsupportedException("cannot decompile writes to packed storage slots: " + slot);
        }
        if (!isWordSized(type)) {
            throw new UnsupportedException("cannot decompile writes to storage variables of type: " + type);
        }
        return new StorageItem(contract, item.getName(), valueType);
    }

    /**
     * Slots of the variables that can be written, i.e. the ones {@link #resolveWrite} accepts.
     */
    public List<BigInteger> scalarSlots() {
        List<BigInteger> slots = Lists.newArrayList();
        for (StorageLayoutItem item : inverted.values()) {
            if (item.getOffset() != 0 || packedSlots.contains(item.getSlot())
                    || !(item.getSlotType() instanceof SlotType.StorageValue)) {
                continue;
            }
            ValueType valueType = ((SlotType.StorageValue) item.getSlotType()).getType();
            if (valueType instanceof ValueType.PrimitiveType && isWordSized(((ValueType.PrimitiveType) valueType).getType())) {
                slots.add(item.getSlot());
            }
        }
        return slots;
    }

    public ImmutableMap<String, StorageDeclaration> declarations() {
        ImmutableMap.Builder<String, StorageDeclaration> builder = ImmutableMap.builder();
        for (StorageLayoutItem item : inverted.values()) {
            builder.put(item.getName(), new StorageDeclaration(item.getName(), item.getSlotType(), item.getSlot()));
        }
        return builder.build();
    }

    // static array types span several slots
    private static boolean isWordSized(AbiType type) {
        return type instanceof AbiType.UInt || type instanceof AbiType.Int || type instanceof AbiType.AddressType
                || type instanceof AbiType.Bool || type instanceof AbiType.FixedBytes;
    }
}
