package net.katagaitai.shiyou.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;
import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.abi.Selector;
import net.katagaitai.shiyou.decompile.UnsupportedException;
import net.katagaitai.shiyou.evm.Address;
import net.katagaitai.shiyou.evm.Buf;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.evm.Store;
import net.katagaitai.shiyou.evm.SymbolicProgram;
import net.katagaitai.shiyou.evm.Word;
import net.katagaitai.shiyou.util.Constants;
import net.katagaitai.shiyou.util.Util;
import net.katagaitai.shiyou.util.Z3Util;

import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Solver oracle backed by Z3. Every query gets its own context, so one instance can be shared
 * between threads.
 */
@Slf4j(topic = "shiyou")
public class Z3SolverOracle implements SolverOracle {
    private static final int MAX_MISSING_SELECTORS = 16;

    private final int timeoutMills;

    public Z3SolverOracle() {
        this(Constants.SOLVER_TIMEOUT_MILLS);
    }

    public Z3SolverOracle(int timeoutMills) {
        this.timeoutMills = timeoutMills;
    }

    @Override
    public EquivalenceResult checkEquivalence(SymbolicProgram spec, SymbolicProgram code) {
        List<End.Success> specLeaves = successes(spec);
        List<End.Success> codeLeaves = successes(code);

        // wherever both succeed, the results agree
        for (int i = 0; i < specLeaves.size(); i++) {
            for (int j = 0; j < codeLeaves.size(); j++) {
                EquivalenceResult result = checkSameResult(specLeaves.get(i), codeLeaves.get(j),
                        "spec branch " + i + " and code branch " + j + " leave different states");
                if (!result.isEquivalent()) {
                    return result;
                }
            }
        }

        // both succeed on the same inputs
        try (Context context = new Context()) {
            Z3Encoder encoder = new Z3Encoder(context);
            BoolExpr specSuccess = anyGuard(context, encoder, specLeaves);
            BoolExpr codeSuccess = anyGuard(context, encoder, codeLeaves);
            return solve(context, encoder, context.mkXor(specSuccess, codeSuccess),
                    "spec and code succeed on different inputs");
        } catch (UnsupportedException e) {
            return EquivalenceResult.unknown(e.getMessage());
        }
    }

    private EquivalenceResult checkSameResult(End.Success spec, End.Success code, String description) {
        try (Context context = new Context()) {
            Z3Encoder encoder = new Z3Encoder(context);
            List<BoolExpr> same = Lists.newArrayList();
            Set<Address> addresses = Sets.newLinkedHashSet(spec.getStorage().keySet());
            addresses.addAll(code.getStorage().keySet());
            for (Address address : addresses) {
                Store unchanged = new Store.AbstractStore(address);
                same.add(context.mkEq(
                        encoder.store(spec.getStorage().getOrDefault(address, unchanged)),
                        encoder.store(code.getStorage().getOrDefault(address, unchanged))));
            }
            same.add(context.mkEq(returnWord(encoder, spec.getReturnData()), returnWord(encoder, code.getReturnData())));
            BoolExpr query = context.mkAnd(
                    encoder.guard(spec),
                    encoder.guard(code),
                    context.mkNot(context.mkAnd(same.toArray(new BoolExpr[0]))));
            return solve(context, encoder, query, description);
        } catch (UnsupportedException e) {
            return EquivalenceResult.unknown(e.getMessage());
        }
    }

    private EquivalenceResult solve(Context context, Z3Encoder encoder, BoolExpr query, String description) {
        Solver solver = Z3Util.mkSolver(context, timeoutMills);
        Z3Util.add(solver, query);
        Status status = Z3Util.check(solver);
        log.debug("{}: {}", description, status);
        if (status == Status.UNSATISFIABLE) {
            return EquivalenceResult.equivalent();
        }
        if (status == Status.UNKNOWN) {
            return EquivalenceResult.unknown("solver returned unknown: " + solver.getReasonUnknown());
        }
        Model model = solver.getModel();
        ImmutableMap.Builder<String, BigInteger> witness = ImmutableMap.builder();
        for (Map.Entry<String, BitVecExpr> entry : encoder.getSymbols().entrySet()) {
            witness.put(entry.getKey(), Z3Util.eval(model, entry.getValue()));
        }
        return EquivalenceResult.counterexample(new Counterexample(description, witness.build()));
    }

    @Override
    public ExhaustivenessResult checkExhaustiveness(Collection<Selector> selectors, SymbolicProgram runtime) {
        List<End.Success> leaves = successes(runtime);
        try (Context context = new Context()) {
            Z3Encoder encoder = new Z3Encoder(context);
            ArrayExpr<BitVecSort, BitVecSort> calldata = encoder.buf(new Buf.AbstractBuf(Constants.CALLDATA_BUFFER));
            BitVecExpr firstWord = encoder.readWord(Z3Util.mkBV(context, 0, Constants.WORD_BITS), calldata);
            BitVecExpr selector = context.mkExtract(Constants.WORD_BITS - 1,
                    Constants.WORD_BITS - Constants.SELECTOR_BYTES * 8, firstWord);

            Solver solver = Z3Util.mkSolver(context, timeoutMills);
            Z3Util.add(solver, anyGuard(context, encoder, leaves));
            for (Selector known : selectors) {
                Z3Util.add(solver, context.mkNot(context.mkEq(selector,
                        Z3Util.mkBV(context, known.toBigInteger(), Constants.SELECTOR_BYTES * 8))));
            }
            List<Selector> missing = Lists.newArrayList();
            while (missing.size() < MAX_MISSING_SELECTORS) {
                Status status = Z3Util.check(solver);
                if (status == Status.UNSATISFIABLE) {
                    break;
                }
                if (status == Status.UNKNOWN) {
                    return ExhaustivenessResult.unknown("solver returned unknown: " + solver.getReasonUnknown());
                }
                BigInteger value = Z3Util.eval(solver.getModel(), selector);
                Selector found = new Selector(Util.toHex(Util.toFixedBytes(value, Constants.SELECTOR_BYTES)));
                log.debug("reachable unknown selector: {}", found);
                missing.add(found);
                Z3Util.add(solver, context.mkNot(context.mkEq(selector,
                        Z3Util.mkBV(context, value, Constants.SELECTOR_BYTES * 8))));
            }
            return missing.isEmpty()
                    ? ExhaustivenessResult.covered()
                    : ExhaustivenessResult.missing(ImmutableList.copyOf(missing));
        } catch (UnsupportedException e) {
            return ExhaustivenessResult.unknown(e.getMessage());
        }
    }

    private static BitVecExpr returnWord(Z3Encoder encoder, Buf returnData) throws UnsupportedException {
        return encoder.word(Buf.readWord(Word.lit(0), returnData));
    }

    private static BoolExpr anyGuard(Context context, Z3Encoder encoder, List<End.Success> leaves)
            throws UnsupportedException {
        List<BoolExpr> guards = Lists.newArrayList();
        for (End.Success leaf : leaves) {
            guards.add(encoder.guard(leaf));
        }
        return context.mkOr(guards.toArray(new BoolExpr[0]));
    }

    private static List<End.Success> successes(SymbolicProgram program) {
        List<End.Success> result = Lists.newArrayList();
        for (End end : program.flatten()) {
            if (end instanceof End.Success) {
                result.add((End.Success) end);
            }
        }
        return result;
    }
}
