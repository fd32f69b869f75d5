package net.katagaitai.shiyou.evm;

import com.google.common.collect.ImmutableSortedMap;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.math.BigInteger;
import java.util.Map;

/**
 * Contract storage: a base store overlaid by writes, the most recent write outermost.
 */
public abstract class Store extends Expr {
    @Override
    public Kind getKind() {
        return Kind.STORE;
    }

    /**
     * Storage of the given contract before the transaction; every slot is unknown.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class AbstractStore extends Store {
        Address address;
    }

    /**
     * Fully known storage; missing slots hold zero.
     */
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class ConcreteStore extends Store {
        ImmutableSortedMap<BigInteger, BigInteger> slots;

        public ConcreteStore(Map<BigInteger, BigInteger> slots) {
            this.slots = ImmutableSortedMap.copyOf(slots);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class SStore extends Store {
        Word key;
        Word value;
        Store prev;
    }
}
