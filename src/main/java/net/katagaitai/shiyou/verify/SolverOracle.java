package net.katagaitai.shiyou.verify;

import net.katagaitai.shiyou.abi.Selector;
import net.katagaitai.shiyou.evm.SymbolicProgram;

import java.util.Collection;

/**
 * Decision procedure used to check decompiled specifications against bytecode.
 */
public interface SolverOracle {
    /**
     * Two programs are equivalent when they succeed on the same inputs and, wherever both
     * succeed, leave the same storage and return the same word.
     */
    EquivalenceResult checkEquivalence(SymbolicProgram spec, SymbolicProgram code);

    /**
     * Checks that no successful branch of the runtime program, explored with unconstrained
     * calldata, is reachable through a selector outside the given set.
     */
    ExhaustivenessResult checkExhaustiveness(Collection<Selector> selectors, SymbolicProgram runtime);
}
