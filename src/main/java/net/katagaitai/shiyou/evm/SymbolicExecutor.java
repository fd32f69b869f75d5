package net.katagaitai.shiyou.evm;

/**
 * The symbolic-execution engine. Implementations explore every path of the given code and return
 * the simplified program; paths that could not be fully explored end in {@link End.Partial}.
 * Implementations must be safe to call from several threads at once.
 */
public interface SymbolicExecutor {
    SymbolicProgram explore(byte[] code, SymbolicCalldata input, boolean creation) throws InterruptedException;
}
