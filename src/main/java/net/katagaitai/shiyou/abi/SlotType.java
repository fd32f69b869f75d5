package net.katagaitai.shiyou.abi;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The declared type of a storage variable as reported by the compiler.
 */
public abstract class SlotType {

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class StorageValue extends SlotType {
        private final ValueType type;

        public StorageValue(ValueType type) {
            this.type = type;
        }

        @Override
        public String toString() {
            return type.toString();
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class StorageMapping extends SlotType {
        private final ImmutableList<ValueType> keys;
        private final ValueType value;

        public StorageMapping(List<ValueType> keys, ValueType value) {
            this.keys = ImmutableList.copyOf(keys);
            this.value = value;
        }

        @Override
        public String toString() {
            return "mapping(" + keys.stream().map(Object::toString).collect(Collectors.joining(" => "))
                    + " => " + value + ")";
        }
    }
}
