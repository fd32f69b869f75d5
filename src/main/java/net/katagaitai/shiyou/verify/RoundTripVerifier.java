package net.katagaitai.shiyou.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.abi.Selector;
import net.katagaitai.shiyou.artifact.SolcContract;
import net.katagaitai.shiyou.decompile.EntryPointFailure;
import net.katagaitai.shiyou.decompile.UnsupportedException;
import net.katagaitai.shiyou.evm.Prop;
import net.katagaitai.shiyou.evm.SymbolicExecutor;
import net.katagaitai.shiyou.spec.Behaviour;
import net.katagaitai.shiyou.spec.Interface;
import net.katagaitai.shiyou.spec.Specification;
import net.katagaitai.shiyou.util.Constants;
import net.katagaitai.shiyou.verify.checker.AbiChecker;
import net.katagaitai.shiyou.verify.checker.Assumptions;
import net.katagaitai.shiyou.verify.checker.BehaviourChecker;
import net.katagaitai.shiyou.verify.checker.ConstructorChecker;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compiles a specification back into symbolic programs and asks the solver whether they agree
 * with the bytecode: the constructor, every method the specification describes, and the set of
 * selectors through which the runtime code can succeed.
 */
@Slf4j(topic = "shiyou")
public class RoundTripVerifier {
    private final SymbolicExecutor executor;
    private final SolverOracle oracle;

    public RoundTripVerifier(SymbolicExecutor executor, SolverOracle oracle) {
        this.executor = executor;
        this.oracle = oracle;
    }

    public VerificationResult verify(Specification spec, SolcContract contract) throws InterruptedException {
        SpecCompiler compiler = new SpecCompiler(spec);
        List<Prop> assumptions = Assumptions.of(spec);
        List<EntryPointFailure> unsupported = Lists.newArrayList();

        EquivalenceResult constructor = null;
        try {
            constructor = ConstructorChecker.check(executor, oracle, compiler, spec.getContract().getConstructor(),
                    contract, assumptions);
        } catch (UnsupportedException e) {
            log.debug("constructor: {}", e.getMessage());
            unsupported.add(new EntryPointFailure(Constants.CONSTRUCTOR_NAME, e.getMessage()));
        }

        Map<String, EquivalenceResult> behaviours = Maps.newLinkedHashMap();
        Set<Selector> selectors = Sets.newLinkedHashSet();
        for (Method method : contract.getMethods()) {
            List<Behaviour> cases = behavioursOf(spec, method);
            if (cases.isEmpty()) {
                // nothing was decompiled for this method
                continue;
            }
            selectors.add(method.getSelector());
            try {
                behaviours.put(method.getSignature(), BehaviourChecker.check(executor, oracle, compiler, method,
                        cases, contract, assumptions));
            } catch (UnsupportedException e) {
                log.debug("{}: {}", method.getSignature(), e.getMessage());
                unsupported.add(new EntryPointFailure(method.getSignature(), e.getMessage()));
            }
        }

        ExhaustivenessResult abi = AbiChecker.check(executor, oracle, selectors, contract, assumptions);
        VerificationResult result = new VerificationResult(constructor, ImmutableMap.copyOf(behaviours), abi,
                ImmutableList.copyOf(unsupported));
        log.info("verification of {}: {}", spec.getContract().getName(), result.isSuccess() ? "passed" : "failed");
        return result;
    }

    private static List<Behaviour> behavioursOf(Specification spec, Method method) {
        Interface iface = Interface.of(method);
        List<Behaviour> result = Lists.newArrayList();
        for (Behaviour behaviour : spec.getContract().getBehaviours()) {
            if (behaviour.getIface().equals(iface)) {
                result.add(behaviour);
            }
        }
        return result;
    }
}
