package net.katagaitai.shiyou.verify.checker;

import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.abi.Selector;
import net.katagaitai.shiyou.artifact.SolcContract;
import net.katagaitai.shiyou.decompile.CalldataBuilder;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.SymbolicExecutor;
import net.katagaitai.shiyou.evm.SymbolicProgram;
import net.katagaitai.shiyou.verify.ExhaustivenessResult;
import net.katagaitai.shiyou.verify.SolverOracle;

import java.util.Collection;
import java.util.List;

/**
 * Checks that the runtime code cannot succeed through any selector other than the given ones.
 */
@Slf4j(topic = "shiyou")
public class AbiChecker {

    public static ExhaustivenessResult check(SymbolicExecutor executor, SolverOracle oracle,
                                             Collection<Selector> selectors, SolcContract contract,
                                             List<Prop> assumptions) throws InterruptedException {
        SymbolicProgram runtime = executor.explore(contract.getRuntimeCode(), CalldataBuilder.unconstrained(), false);
        ExhaustivenessResult result = oracle.checkExhaustiveness(selectors, Assumptions.assume(runtime, assumptions));
        log.debug("abi: {}", result);
        return result;
    }
}
