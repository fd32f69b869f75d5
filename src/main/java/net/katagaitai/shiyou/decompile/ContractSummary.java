package net.katagaitai.shiyou.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import lombok.Value;
import net.katagaitai.shiyou.abi.Method;
import net.katagaitai.shiyou.abi.StorageLayoutItem;
import net.katagaitai.shiyou.evm.End;
import net.katagaitai.shiyou.spec.Interface;

/**
 * The successful branches of every entry point of a contract, together with the metadata needed
 * to interpret them. Entry points whose exploration failed are listed in {@code failures} and
 * have no branches.
 */
@Value
public class ContractSummary {
    String name;
    ImmutableMap<String, StorageLayoutItem> storageLayout;
    // in abi order
    ImmutableMap<Method, ImmutableSet<End>> runtime;
    Interface creationInterface;
    // null when the creation code could not be explored
    ImmutableSet<End> creation;
    ImmutableList<EntryPointFailure> failures;
}
