package net.katagaitai.shiyou.verify.checker;

import com.google.common.collect.Lists;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.artifact.SolcContract;
import net.katagaitai.shiyou.decompile.CalldataBuilder;
import net.katagaitai.shiyou.decompile.UnsupportedException;
import net.katagaitai.shiyou.evm.Buf;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.SymbolicCalldata;
import net.katagaitai.shiyou.evm.SymbolicExecutor;
import net.katagaitai.shiyou.evm.SymbolicProgram;
import net.katagaitai.shiyou.spec.Constructor;
import net.katagaitai.shiyou.verify.EquivalenceResult;
import net.katagaitai.shiyou.verify.SolverOracle;
import net.katagaitai.shiyou.verify.SpecCompiler;

import java.util.List;

@Slf4j(topic = "shiyou")
public class ConstructorChecker {

    public static EquivalenceResult check(SymbolicExecutor executor, SolverOracle oracle, SpecCompiler compiler,
                                          Constructor ctor, SolcContract contract, List<Prop> assumptions)
            throws UnsupportedException, InterruptedException {
        SymbolicCalldata input = CalldataBuilder.forConstructor(contract.getConstructorInputs());
        List<Prop> props = Lists.newArrayList(input.getAssumptions());
        props.addAll(assumptions);

        SymbolicProgram spec = SymbolicProgram.leaf(Assumptions.assume(compiler.compile(ctor), props));
        SymbolicProgram creation = executor.explore(contract.getCreationCode(), input, true);
        SymbolicProgram code = Assumptions.assume(withoutReturnData(creation), props);
        EquivalenceResult result = oracle.checkEquivalence(spec, code);
        log.debug("constructor: {}", result);
        return result;
    }

    // creation code returns the runtime code, which is not part of the specification
    private static SymbolicProgram withoutReturnData(SymbolicProgram program) {
        List<End> ends = Lists.newArrayList();
        for (End end : program.flatten()) {
            if (end instanceof End.Success) {
                End.Success success = (End.Success) end;
                ends.add(new End.Success(success.getProps(), Buf.EMPTY, success.getStorage()));
            } else {
                ends.add(end);
            }
        }
        return SymbolicProgram.branches(ends);
    }
}
