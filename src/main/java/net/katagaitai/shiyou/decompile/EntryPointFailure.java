package net.katagaitai.shiyou.decompile;

import lombok.Value;

/**
 * An entry point (the constructor or a method signature) that could not be decompiled.
 */
@Value
public class EntryPointFailure {
    String entryPoint;
    String message;

    @Override
    public String toString() {
        return entryPoint + ": " + message;
    }
}
