package net.katagaitai.shiyou.evm;

import com.google.common.base.Preconditions;
import lombok.EqualsAndHashCode;
import lombok.Value;
import net.katagaitai.shiyou.util.Constants;

import java.math.BigInteger;

/**
 * A 256-bit machine word. Arithmetic is modulo 2^256, comparisons yield 0 or 1.
 */
public abstract class Word extends Expr {
    @Override
    public Kind getKind() {
        return Kind.WORD;
    }

    public static Lit lit(long value) {
        return new Lit(BigInteger.valueOf(value));
    }

    public static Lit lit(BigInteger value) {
        return new Lit(value);
    }

    public static Var var(String name) {
        return new Var(name);
    }

    public static boolean isLit(Word w) {
        return w instanceof Lit;
    }

    public static BigInteger litValue(Word w) {
        return ((Lit) w).getValue();
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Lit extends Word {
        BigInteger value;

        public Lit(BigInteger value) {
            Preconditions.checkArgument(value.signum() >= 0 && value.compareTo(Constants.MAX_UINT) <= 0,
                    "literal out of word range: %s", value);
            this.value = value;
        }

        @Override
        public String toString() {
            return "0x" + value.toString(16);
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Var extends Word {
        String name;

        @Override
        public String toString() {
            return name;
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Env extends Word {
        EnvVar var;

        @Override
        public String toString() {
            return var.name();
        }
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Add extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Sub extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Mul extends Word {
        Word a;
        Word b;
    }

    // x / 0 == 0
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Div extends Word {
        Word a;
        Word b;
    }

    // x % 0 == 0
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Mod extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Exp extends Word {
        Word base;
        Word exponent;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Lt extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Gt extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class SLt extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class SGt extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Eq extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class IsZero extends Word {
        Word a;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class And extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Or extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Xor extends Word {
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Not extends Word {
        Word a;
    }

    // value << shift
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Shl extends Word {
        Word shift;
        Word value;
    }

    // value >> shift
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Shr extends Word {
        Word shift;
        Word value;
    }

    // sign extends value from byte index (counted from the right)
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class SignExtend extends Word {
        Word index;
        Word value;
    }

    // condition != 0 ? a : b
    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class Ite extends Word {
        Word condition;
        Word a;
        Word b;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class SLoad extends Word {
        Word key;
        Store store;
    }

    @Value
    @EqualsAndHashCode(callSuper = false)
    public static class ReadWord extends Word {
        Word offset;
        Buf buf;
    }
}
