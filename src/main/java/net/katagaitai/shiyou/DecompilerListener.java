package net.katagaitai.shiyou;

import net.katagaitai.shiyou.decompile.EntryPointFailure;
import net.katagaitai.shiyou.verify.VerificationResult;

/**
 * Receives the events of a decompiler run. Callbacks are made on the thread that called
 * {@link Decompiler#decompile}.
 */
public interface DecompilerListener {
    enum Stage {
        SUMMARIZE, ASSEMBLE, ENRICH, VERIFY
    }

    void stageStarted(String contract, Stage stage);

    void entryPointFailed(String contract, EntryPointFailure failure);

    void verificationFinished(String contract, VerificationResult result);
}
