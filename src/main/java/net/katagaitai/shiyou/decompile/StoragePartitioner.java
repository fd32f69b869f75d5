package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.Word;

import java.math.BigInteger;
import java.util.Map;
import java.util.SortedMap;

/**
 * Decomposes a storage tree into its final writes. Only writes to concrete slots are supported,
 * since telling symbolic slots apart would need the solver.
 */
public class StoragePartitioner {

    public static DistinctStore partition(Store store) throws UnsupportedException {
        SortedMap<BigInteger, Word> writes = Maps.newTreeMap();
        Store current = store;
        // walks from the most recent write down to the base, so the first write seen for a slot wins
        while (current instanceof Store.SStore) {
            Store.SStore sstore = (Store.SStore) current;
            if (!Word.isLit(sstore.getKey())) {
                throw new UnsupportedException("cannot decompile contracts with writes to symbolic storage slots: "
                        + sstore.getKey());
            }
            writes.putIfAbsent(Word.litValue(sstore.getKey()), sstore.getValue());
            current = sstore.getPrev();
        }
        boolean concreteBase = current instanceof Store.ConcreteStore;
        if (concreteBase) {
            for (Map.Entry<BigInteger, BigInteger> entry : ((Store.ConcreteStore) current).getSlots().entrySet()) {
                writes.putIfAbsent(entry.getKey(), Word.lit(entry.getValue()));
            }
        } else if (!(current instanceof Store.AbstractStore)) {
            throw new IllegalStateException("unknown storage base: " + current);
        }
        return new DistinctStore(ImmutableSortedMap.copyOfSorted(writes), concreteBase);
    }
}
