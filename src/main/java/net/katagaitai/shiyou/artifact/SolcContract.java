package net.katagaitai.shiyou.artifact;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Builder;
import lombok.Value;
import net.katagaitai.shiyou.abi.Argument;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.abi.StorageLayoutItem;

/**
 * A compiled contract as read from the build output.
 */
@Value
@Builder
public class SolcContract {
    String name;
    byte[] creationCode;
    byte[] runtimeCode;
    @Builder.Default
    ImmutableList<Argument> constructorInputs = ImmutableList.of();
    // in abi order
    @Builder.Default
    ImmutableList<Method> methods = ImmutableList.of();
    // null when the compiler was not asked for the layout
    ImmutableMap<String, StorageLayoutItem> storageLayout;
}
