package net.katagaitai.shiyou.util;

import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;

public class Z3Util {
    public static BitVecExpr mkBVConst(Context context, String name, int bits) {
        if (StringUtils.isNumeric(name)) {
            throw new IllegalArgumentException("numeric symbol name: " + name);
        }
        return context.mkBVConst(name, bits);
    }

    public static BitVecNum mkBV(Context context, BigInteger value, int bits) {
        return context.mkBV(value.toString(), bits);
    }

    public static BitVecNum mkBV(Context context, long value, int bits) {
        return context.mkBV(value, bits);
    }

    public static BitVecExpr mkITE(Context context, BoolExpr condition, BitVecExpr trueExpr, BitVecExpr falseExpr) {
        return (BitVecExpr) context.mkITE(condition, trueExpr, falseExpr);
    }

    public static BitVecExpr mkBool(Context context, BoolExpr condition) {
        return mkITE(context, condition, mkBV(context, 1, Constants.WORD_BITS), mkBV(context, 0, Constants.WORD_BITS));
    }

    public static BoolExpr isZero(Context context, BitVecExpr expr) {
        return context.mkEq(expr, mkBV(context, 0, expr.getSortSize()));
    }

    public static BitVecExpr mkSelect(Context context, ArrayExpr<BitVecSort, BitVecSort> array, BitVecExpr index) {
        return (BitVecExpr) context.mkSelect(array, index);
    }

    public static ArrayExpr<BitVecSort, BitVecSort> mkStore(Context context, ArrayExpr<BitVecSort, BitVecSort> array,
                                                            BitVecExpr index, BitVecExpr value) {
        return context.mkStore(array, index, value);
    }

    public static ArrayExpr<BitVecSort, BitVecSort> mkConstArray(Context context, int indexBits, int valueBits) {
        return context.mkConstArray(context.mkBitVecSort(indexBits), mkBV(context, 0, valueBits));
    }

    public static ArrayExpr<BitVecSort, BitVecSort> mkArrayConst(Context context, String name, int indexBits,
                                                                 int valueBits) {
        return context.mkArrayConst(name, context.mkBitVecSort(indexBits), context.mkBitVecSort(valueBits));
    }

    public static void add(Solver solver, BoolExpr constraint) {
        solver.add(constraint);
    }

    public static Status check(Solver solver) {
        return solver.check();
    }

    public static BigInteger eval(Model model, BitVecExpr expr) {
        Expr<?> value = model.eval(expr, true);
        return ((BitVecNum) value).getBigInteger();
    }

    public static Solver mkSolver(Context context, int timeoutMills) {
        // the default solver handles arrays, the qfbv tactic does not
        final Solver solver = context.mkSolver();
        setParameters(context, solver, timeoutMills);
        return solver;
    }

    public static void setParameters(Context context, Solver solver, int timeoutMills) {
        Params params = context.mkParams();
        params.add("timeout", timeoutMills);
        solver.setParameters(params);
    }
}
