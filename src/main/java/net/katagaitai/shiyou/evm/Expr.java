package net.katagaitai.shiyou.evm;

/**
 * A term of the symbolic domain produced by the symbolic-execution engine.
 */
public abstract class Expr {
    public enum Kind {
        WORD, BUF, STORE
    }

    public abstract Kind getKind();
}
