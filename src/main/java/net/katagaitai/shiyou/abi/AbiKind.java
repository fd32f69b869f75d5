package net.katagaitai.shiyou.abi;

public enum AbiKind {
    STATIC, DYNAMIC
}
