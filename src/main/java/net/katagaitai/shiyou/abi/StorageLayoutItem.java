package net.katagaitai.shiyou.abi;

import lombok.Value;

import java.math.BigInteger;

/**
 * One entry of the compiler-reported storage layout.
 */
@Value
public class StorageLayoutItem {
    String name;
    BigInteger slot;
    int offset;
    SlotType slotType;
}
