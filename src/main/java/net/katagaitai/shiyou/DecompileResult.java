package net.katagaitai.shiyou;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import net.katagaitai.shiyou.decompile.AssemblyResult;
import net.katagaitai.shiyou.decompile.EntryPointFailure;
import net.katagaitai.shiyou.spec.Specification;
import net.katagaitai.shiyou.verify.VerificationResult;

/**
 * The outcome of decompiling one contract. A specification is only produced when every entry
 * point could be decompiled; the assembled entry points are kept either way.
 */
@Value
public class DecompileResult {
    String contract;
    // the entry points that could be assembled, null when exploration failed as a whole
    AssemblyResult assembly;
    // null when any entry point failed
    Specification specification;
    ImmutableList<EntryPointFailure> failures;
    // null when verification was skipped or not reached
    VerificationResult verification;

    public boolean isSuccess() {
        return failures.isEmpty() && specification != null && (verification == null || verification.isSuccess());
    }
}
