package net.katagaitai.shiyou.spec;

import lombok.Getter;
import net.katagaitai.shiyou.abi.AbiType;

/**
 * Runtime witness of a sort. There is exactly one instance per sort, so identity comparison is
 * sort comparison.
 */
public final class SType<S> {
    public static final SType<AInteger> INTEGER = new SType<>(Tag.INTEGER);
    public static final SType<ABoolean> BOOLEAN = new SType<>(Tag.BOOLEAN);
    public static final SType<AByteStr> BYTESTRING = new SType<>(Tag.BYTESTRING);
    public static final SType<AContract> CONTRACT = new SType<>(Tag.CONTRACT);

    public enum Tag {
        INTEGER, BOOLEAN, BYTESTRING, CONTRACT
    }

    @Getter
    private final Tag tag;

    private SType(Tag tag) {
        this.tag = tag;
    }

    /**
     * The sort an ABI value takes in the specification language.
     */
    public static Tag of(AbiType type) {
        if (type instanceof AbiType.UInt || type instanceof AbiType.Int || type instanceof AbiType.AddressType) {
            return Tag.INTEGER;
        }
        if (type instanceof AbiType.Bool) {
            return Tag.BOOLEAN;
        }
        if (type instanceof AbiType.FixedBytes) {
            return Tag.INTEGER;
        }
        if (type instanceof AbiType.Bytes || type instanceof AbiType.StringType) {
            return Tag.BYTESTRING;
        }
        throw new IllegalArgumentException("no specification sort for abi type: " + type);
    }

    @Override
    public String toString() {
        return tag.name();
    }
}
