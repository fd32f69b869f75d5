package net.katagaitai.shiyou.evm;

import com.google.common.collect.ImmutableList;
import lombok.Value;

/**
 * Symbolic input of one entry point together with the facts assumed about it.
 */
@Value
public class SymbolicCalldata {
    Buf data;
    ImmutableList<Prop> assumptions;
}
