package net.katagaitai.shiyou.util;

import java.math.BigInteger;

public class Constants {
    public static final int WORD_BITS = 256;
    public static final int WORD_BYTES = WORD_BITS / 8;
    public static final int SELECTOR_BYTES = 4;
    public static final BigInteger WORD_MODULUS = BigInteger.ONE.shiftLeft(WORD_BITS);
    public static final BigInteger MAX_UINT = WORD_MODULUS.subtract(BigInteger.ONE);

    public static final int THREAD_POOL_SIZE = Runtime.getRuntime().availableProcessors();
    public static final long SUMMARIZER_TIMEOUT_MILLS = 600_000;
    public static final int SOLVER_TIMEOUT_MILLS = 10_000;

    // symbolic address of the contract under analysis
    public static final String ENTRYPOINT_ADDRESS = "entrypoint";
    public static final String CALLDATA_BUFFER = "txdata";
    public static final String CONSTRUCTOR_NAME = "constructor";
}
