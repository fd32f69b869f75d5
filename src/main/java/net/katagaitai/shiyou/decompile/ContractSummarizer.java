package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.artifact.SolcContract;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.SymbolicCalldata;
import net.katagaitai.shiyou.evm.SymbolicExecutor;
import net.katagaitai.shiyou.spec.Interface;
import net.katagaitai.shiyou.util.Constants;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the symbolic executor over the creation code and over every method of a contract and
 * collects the successful branches of each entry point. Methods are explored in parallel.
 */
@Slf4j(topic = "shiyou")
public class ContractSummarizer {
    private final SymbolicExecutor executor;
    private final int poolSize;
    private final long timeoutMills;

    public ContractSummarizer(SymbolicExecutor executor) {
        this(executor, Constants.THREAD_POOL_SIZE, Constants.SUMMARIZER_TIMEOUT_MILLS);
    }

    public ContractSummarizer(SymbolicExecutor executor, int poolSize, long timeoutMills) {
        this.executor = executor;
        this.poolSize = poolSize;
        this.timeoutMills = timeoutMills;
    }

    public ContractSummary summarize(SolcContract contract) throws UnsupportedException, InterruptedException {
        if (contract.getStorageLayout() == null) {
            throw new UnsupportedException("missing storage layout in solc output");
        }
        String name = contract.getName().contains(":")
                ? StringUtils.substringAfterLast(contract.getName(), ":")
                : contract.getName();
        List<EntryPointFailure> failures = Lists.newArrayList();

        ImmutableSet<End> creation = null;
        try {
            SymbolicCalldata input = CalldataBuilder.forConstructor(contract.getConstructorInputs());
            creation = explore(Constants.CONSTRUCTOR_NAME, contract.getCreationCode(), input, true);
        } catch (UnsupportedException e) {
            log.debug("creation code: {}", e.getMessage());
            failures.add(new EntryPointFailure(Constants.CONSTRUCTOR_NAME, e.getMessage()));
        }

        Map<Method, ImmutableSet<End>> runtime = Maps.newLinkedHashMap();
        ThreadFactory namedThreadFactory = new ThreadFactoryBuilder().setNameFormat("summarizer-%d").build();
        ExecutorService pool = Executors.newFixedThreadPool(poolSize, namedThreadFactory);
        try {
            Map<Method, Future<ImmutableSet<End>>> futures = Maps.newLinkedHashMap();
            for (Method method : contract.getMethods()) {
                futures.put(method, pool.submit(() -> {
                    SymbolicCalldata input = CalldataBuilder.forMethod(method);
                    return explore(method.getSignature(), contract.getRuntimeCode(), input, false);
                }));
            }
            long deadline = System.currentTimeMillis() + timeoutMills;
            for (Map.Entry<Method, Future<ImmutableSet<End>>> entry : futures.entrySet()) {
                String signature = entry.getKey().getSignature();
                Future<ImmutableSet<End>> f = entry.getValue();
                try {
                    long remaining = Math.max(0, deadline - System.currentTimeMillis());
                    runtime.put(entry.getKey(), f.get(remaining, TimeUnit.MILLISECONDS));
                } catch (TimeoutException | CancellationException e) {
                    log.info("timeout: {}", signature);
                    f.cancel(true);
                    failures.add(new EntryPointFailure(signature, "symbolic execution timed out"));
                } catch (ExecutionException e) {
                    if (!(e.getCause() instanceof UnsupportedException)) {
                        throw new IllegalStateException("symbolic execution failed: " + signature, e.getCause());
                    }
                    log.debug("{}: {}", signature, e.getCause().getMessage());
                    failures.add(new EntryPointFailure(signature, e.getCause().getMessage()));
                }
            }
        } finally {
            pool.shutdownNow();
            pool.awaitTermination(1, TimeUnit.MINUTES);
        }

        return new ContractSummary(
                name,
                contract.getStorageLayout(),
                ImmutableMap.copyOf(runtime),
                Interface.constructor(contract.getConstructorInputs()),
                creation,
                ImmutableList.copyOf(failures));
    }

    private ImmutableSet<End> explore(String entryPoint, byte[] code, SymbolicCalldata input, boolean creation)
            throws UnsupportedException, InterruptedException {
        log.debug("explore: {}", entryPoint);
        List<End> branches = executor.explore(code, input, creation).flatten();
        List<String> partials = Lists.newArrayList();
        for (End end : branches) {
            if (end.isPartial()) {
                partials.add(end.toString());
            }
        }
        if (!partials.isEmpty()) {
            throw new PartialExplorationException(entryPoint, partials);
        }
        ImmutableSet.Builder<End> successes = ImmutableSet.builder();
        for (End end : branches) {
            if (end.isSuccess()) {
                successes.add(end);
            }
        }
        ImmutableSet<End> result = successes.build();
        log.debug("{}: {} branches, {} successful", entryPoint, branches.size(), result.size());
        return result;
    }
}
