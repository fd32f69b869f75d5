package net.katagaitai.shiyou;

import lombok.extern.slf4j.Slf4j;
import net.katagaitai.shiyou.decompile.EntryPointFailure;
import net.katagaitai.shiyou.verify.VerificationResult;

@Slf4j(topic = "shiyou")
public class LoggingListener implements DecompilerListener {

    @Override
    public void stageStarted(String contract, Stage stage) {
        log.debug("{}: {}", contract, stage);
    }

    @Override
    public void entryPointFailed(String contract, EntryPointFailure failure) {
        log.info("{}: {} failed: {}", contract, failure.getEntryPoint(), failure.getMessage());
    }

    @Override
    public void verificationFinished(String contract, VerificationResult result) {
        if (result.isSuccess()) {
            log.info("{}: verified", contract);
            return;
        }
        log.info("{}: constructor {}", contract, result.getConstructor());
        result.getBehaviours().forEach((signature, r) -> log.info("{}: {} {}", contract, signature, r));
        log.info("{}: abi {}", contract, result.getAbi());
    }
}
