package net.katagaitai.shiyou.evm;

/**
 * Transaction and block environment values readable by bytecode.
 */
public enum EnvVar {
    CALLER,
    CALLVALUE,
    CALLDEPTH,
    ORIGIN,
    BLOCKHASH,
    BLOCKNUMBER,
    DIFFICULTY,
    CHAINID,
    GASLIMIT,
    COINBASE,
    TIMESTAMP,
    THIS,
    NONCE
}
