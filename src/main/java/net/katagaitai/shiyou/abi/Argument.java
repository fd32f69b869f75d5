package net.katagaitai.shiyou.abi;

import lombok.Value;

@Value
public class Argument {
    String name;
    AbiType type;
}
