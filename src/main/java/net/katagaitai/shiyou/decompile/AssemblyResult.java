package net.katagaitai.shiyou.decompile;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Value;
import net.katagaitai.shiyou.spec.Behaviour;
import net.katagaitai.shiyou.spec.Constructor;
import net.katagaitai.shiyou.spec.Contract;
import net.katagaitai.shiyou.spec.Specification;
import net.katagaitai.shiyou.spec.StorageDeclaration;

/**
 * The entry points that could be assembled and the ones that could not. A specification is only
 * available when nothing failed.
 */
@Value
public class AssemblyResult {
    ImmutableMap<String, ImmutableMap<String, StorageDeclaration>> store;
    // null when the constructor failed
    Constructor constructor;
    ImmutableList<Behaviour> behaviours;
    ImmutableList<EntryPointFailure> failures;

    public boolean isSuccess() {
        return failures.isEmpty();
    }

    public Specification getSpecification() {
        Preconditions.checkState(isSuccess(), "assembly failed: %s", failures);
        return new Specification(store, new Contract(constructor, behaviours));
    }
}
