package net.katagaitai.shiyou.verify.checker;

import com.google.common.collect.Lists;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.artifact.SolcContract;
import net.katagaitai.shiyou.decompile.CalldataBuilder;
import net.katagaitai.shiyou.decompile.UnsupportedException;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.SymbolicCalldata;
import net.katagaitai.shiyou.evm.SymbolicExecutor;
import net.katagaitai.shiyou.evm.SymbolicProgram;
import net.katagaitai.shiyou.spec.Behaviour;
import net.katagaitai.shiyou.verify.EquivalenceResult;
import net.katagaitai.shiyou.verify.SolverOracle;
import net.katagaitai.shiyou.verify.SpecCompiler;

import java.util.List;

/**
 * Checks that the behaviours of one method, taken together, describe the runtime code of that
 * method exactly.
 */
@Slf4j(topic = "shiyou")
public class BehaviourChecker {

    public static EquivalenceResult check(SymbolicExecutor executor, SolverOracle oracle, SpecCompiler compiler,
                                          Method method, List<Behaviour> behaviours, SolcContract contract,
                                          List<Prop> assumptions) throws UnsupportedException, InterruptedException {
        SymbolicCalldata input = CalldataBuilder.forMethod(method);
        List<Prop> props = Lists.newArrayList(input.getAssumptions());
        props.addAll(assumptions);

        List<End> cases = Lists.newArrayList();
        for (Behaviour behaviour : behaviours) {
            cases.add(Assumptions.assume(compiler.compile(behaviour), props));
        }
        SymbolicProgram spec = SymbolicProgram.branches(cases);
        SymbolicProgram code = Assumptions.assume(executor.explore(contract.getRuntimeCode(), input, false), props);
        EquivalenceResult result = oracle.checkEquivalence(spec, code);
        log.debug("{}: {}", method.getSignature(), result);
        return result;
    }
}
