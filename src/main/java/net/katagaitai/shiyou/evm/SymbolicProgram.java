package net.katagaitai.shiyou.evm;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import lombok.EqualsAndHashCode;
import lombok.Value;

import java.util.List;

/**
 * The result of exploring one entry point: a tree of branches whose leaves are terminal states.
 * Every leaf carries its own path conditions.
 */
public abstract class SymbolicProgram {

    public static SymbolicProgram leaf(End end) {
        return new Leaf(end);
    }

    public static SymbolicProgram branches(List<End> ends) {
        List<SymbolicProgram> alternatives = Lists.newArrayList();
        for (End end : ends) {
            alternatives.add(new Leaf(end));
        }
        return new Branches(ImmutableList.copyOf(alternatives));
    }

    public List<End> flatten() {
        List<End> result = Lists.newArrayList();
        collect(this, result);
        return result;
    }

    private static void collect(SymbolicProgram program, List<End> result) {
        if (program instanceof Leaf) {
            result.add(((Leaf) program).getEnd());
        } else if (program instanceof Ite) {
            Ite ite = (Ite) program;
            collect(ite.getThen(), result);
            collect(ite.getOtherwise(), result);
        } else if (program instanceof Branches) {
            for (SymbolicProgram p : ((Branches) program).getAlternatives()) {
                collect(p, result);
            }
        } else {
            throw new IllegalStateException("unknown program node: " + program);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Leaf extends SymbolicProgram {
        End end;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Ite extends SymbolicProgram {
        Word condition;
        SymbolicProgram then;
        SymbolicProgram otherwise;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Branches extends SymbolicProgram {
        ImmutableList<SymbolicProgram> alternatives;
    }
}
