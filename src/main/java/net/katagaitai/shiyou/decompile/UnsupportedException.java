package net.katagaitai.shiyou.decompile;

/**
 * The input uses a construct outside of what can be decompiled soundly.
 */
public class UnsupportedException extends Exception {
    public UnsupportedException(String message) {
        super(message);
    }
}
