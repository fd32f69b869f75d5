package net.katagaitai.shiyou.abi;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A Solidity ABI type.
 */
public abstract class AbiType {

    public abstract String typeName();

    public AbiKind getKind() {
        return AbiKind.STATIC;
    }

    @Override
    public String toString() {
        return typeName();
    }

    public static AbiType uint(int bits) {
        return new UInt(bits);
    }

    public static AbiType int_(int bits) {
        return new Int(bits);
    }

    public static AbiType address() {
        return new AddressType();
    }

    public static AbiType bool() {
        return new Bool();
    }

    public static AbiType bytes(int size) {
        return new FixedBytes(size);
    }

    /**
     * Parses a canonical type name such as {@code uint256}, {@code bytes32[2]} or {@code string}.
     * Tuples have no canonical name of their own and are built by the artifact reader.
     */
    public static AbiType parse(String name) {
        String s = name.trim();
        if (s.endsWith("]")) {
            int open = s.lastIndexOf('[');
            Preconditions.checkArgument(open > 0, "malformed array type: %s", name);
            AbiType base = parse(s.substring(0, open));
            String len = s.substring(open + 1, s.length() - 1);
            if (len.isEmpty()) {
                return new DynamicArray(base);
            }
            return new FixedArray(Integer.parseInt(len), base);
        }
        if (s.equals("address") || s.equals("address payable")) {
            return new AddressType();
        }
        if (s.equals("bool")) {
            return new Bool();
        }
        if (s.equals("string")) {
            return new StringType();
        }
        if (s.equals("bytes")) {
            return new Bytes();
        }
        if (s.equals("function")) {
            return new Function();
        }
        if (s.startsWith("uint")) {
            return new UInt(s.length() == 4 ? 256 : Integer.parseInt(s.substring(4)));
        }
        if (s.startsWith("int")) {
            return new Int(s.length() == 3 ? 256 : Integer.parseInt(s.substring(3)));
        }
        if (s.startsWith("bytes")) {
            return new FixedBytes(Integer.parseInt(s.substring(5)));
        }
        throw new IllegalArgumentException("unknown abi type: " + name);
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class UInt extends AbiType {
        private final int bits;

        public UInt(int bits) {
            // the call depth is bounded by a uint10, so widths need not be whole bytes
            Preconditions.checkArgument(bits > 0 && bits <= 256, "invalid uint size: %s", bits);
            this.bits = bits;
        }

        @Override
        public String typeName() {
            return "uint" + bits;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class Int extends AbiType {
        private final int bits;

        public Int(int bits) {
            Preconditions.checkArgument(bits > 0 && bits <= 256 && bits % 8 == 0, "invalid int size: %s", bits);
            this.bits = bits;
        }

        @Override
        public String typeName() {
            return "int" + bits;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static class AddressType extends AbiType {
        @Override
        public String typeName() {
            return "address";
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static class Bool extends AbiType {
        @Override
        public String typeName() {
            return "bool";
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class FixedBytes extends AbiType {
        private final int size;

        public FixedBytes(int size) {
            Preconditions.checkArgument(size > 0 && size <= 32, "invalid bytes size: %s", size);
            this.size = size;
        }

        @Override
        public String typeName() {
            return "bytes" + size;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static class Bytes extends AbiType {
        @Override
        public String typeName() {
            return "bytes";
        }

        @Override
        public AbiKind getKind() {
            return AbiKind.DYNAMIC;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static class StringType extends AbiType {
        @Override
        public String typeName() {
            return "string";
        }

        @Override
        public AbiKind getKind() {
            return AbiKind.DYNAMIC;
        }
    }

    @Getter
    @RequiredArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class FixedArray extends AbiType {
        private final int length;
        private final AbiType base;

        @Override
        public String typeName() {
            return base.typeName() + "[" + length + "]";
        }

        @Override
        public AbiKind getKind() {
            return base.getKind();
        }
    }

    @Getter
    @RequiredArgsConstructor
    @EqualsAndHashCode(callSuper = false)
    public static class DynamicArray extends AbiType {
        private final AbiType base;

        @Override
        public String typeName() {
            return base.typeName() + "[]";
        }

        @Override
        public AbiKind getKind() {
            return AbiKind.DYNAMIC;
        }
    }

    @Getter
    @EqualsAndHashCode(callSuper = false)
    public static class Tuple extends AbiType {
        private final ImmutableList<AbiType> components;

        public Tuple(List<AbiType> components) {
            this.components = ImmutableList.copyOf(components);
        }

        @Override
        public String typeName() {
            return "(" + components.stream().map(AbiType::typeName).collect(Collectors.joining(",")) + ")";
        }

        @Override
        public AbiKind getKind() {
            for (AbiType t : components) {
                if (t.getKind() == AbiKind.DYNAMIC) {
                    return AbiKind.DYNAMIC;
                }
            }
            return AbiKind.STATIC;
        }
    }

    @EqualsAndHashCode(callSuper = false)
    public static class Function extends AbiType {
        @Override
        public String typeName() {
            return "function";
        }
    }
}
