package net.katagaitai.shiyou.abi;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The type of a value held in a storage slot.
 */
public abstract class ValueType {

    @Getter
    @RequiredArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class PrimitiveType extends ValueType {
        private final AbiType type;

        @Override
        public String toString() {
            return type.typeName();
        }
    }

    @Getter
    @RequiredArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class ContractType extends ValueType {
        private final String contract;

        @Override
        public String toString() {
            return contract;
        }
    }
}
