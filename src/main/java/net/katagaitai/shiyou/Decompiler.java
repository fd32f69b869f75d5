package net.katagaitai.shiyou;

import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.artifact.SolcContract;
import net.katagaitai.shiyou.decompile.AssemblyResult;
import net.katagaitai.shiyou.decompile.ContractSummarizer;
import net.katagaitai.shiyou.decompile.ContractSummary;
import net.katagaitai.shiyou.decompile.Enricher;
import net.katagaitai.shiyou.decompile.EntryPointFailure;
import net.katagaitai.shiyou.decompile.SpecificationAssembler;
import net.katagaitai.shiyou.decompile.UnsupportedException;
import net.katagaitai.shiyou.evm.SymbolicExecutor;
import net.katagaitai.shiyou.spec.Specification;
import net.katagaitai.shiyou.verify.RoundTripVerifier;
import net.katagaitai.shiyou.verify.SolverOracle;
import net.katagaitai.shiyou.verify.VerificationResult;
import net.katagaitai.shiyou.verify.Z3SolverOracle;

/**
 * Turns a compiled contract into a specification: explores every entry point, assembles and
 * enriches the result and checks it against the bytecode it came from.
 */
@Slf4j(topic = "shiyou")
public class Decompiler {
    private final SymbolicExecutor executor;
    private final SolverOracle oracle;
    private final DecompilerOptions options;
    private final DecompilerListener listener;

    public Decompiler(SymbolicExecutor executor) {
        this(executor, DecompilerOptions.defaults());
    }

    public Decompiler(SymbolicExecutor executor, DecompilerOptions options) {
        this(executor, new Z3SolverOracle(options.getSolverTimeoutMills()), options, new LoggingListener());
    }

    public Decompiler(SymbolicExecutor executor, SolverOracle oracle, DecompilerOptions options,
                      DecompilerListener listener) {
        this.executor = executor;
        this.oracle = oracle;
        this.options = options;
        this.listener = listener;
    }

    public DecompileResult decompile(SolcContract contract) throws InterruptedException {
        String name = contract.getName();

        listener.stageStarted(name, DecompilerListener.Stage.SUMMARIZE);
        ContractSummary summary;
        try {
            summary = new ContractSummarizer(executor, options.getPoolSize(), options.getSummarizerTimeoutMills())
                    .summarize(contract);
        } catch (UnsupportedException e) {
            EntryPointFailure failure = new EntryPointFailure(name, e.getMessage());
            listener.entryPointFailed(name, failure);
            return new DecompileResult(name, null, null, ImmutableList.of(failure), null);
        }
        name = summary.getName();

        listener.stageStarted(name, DecompilerListener.Stage.ASSEMBLE);
        AssemblyResult assembly = SpecificationAssembler.assemble(summary);
        for (EntryPointFailure failure : assembly.getFailures()) {
            listener.entryPointFailed(name, failure);
        }
        if (!assembly.isSuccess()) {
            return new DecompileResult(name, assembly, null, assembly.getFailures(), null);
        }

        listener.stageStarted(name, DecompilerListener.Stage.ENRICH);
        Specification spec = Enricher.enrich(assembly.getSpecification());
        if (!options.isVerify()) {
            return new DecompileResult(name, assembly, spec, ImmutableList.of(), null);
        }

        listener.stageStarted(name, DecompilerListener.Stage.VERIFY);
        VerificationResult verification = new RoundTripVerifier(executor, oracle).verify(spec, contract);
        listener.verificationFinished(name, verification);
        return new DecompileResult(name, assembly, spec, ImmutableList.of(), verification);
    }
}
