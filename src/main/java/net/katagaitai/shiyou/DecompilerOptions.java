package net.katagaitai.shiyou;

import lombok.Builder;
import lombok.Value;
import net.katagaitai.shiyou.util.Constants;

@Value
@Builder
public class DecompilerOptions {
    @Builder.Default
    int poolSize = Constants.THREAD_POOL_SIZE;
    // shared by all methods of one contract
    @Builder.Default
    long summarizerTimeoutMills = Constants.SUMMARIZER_TIMEOUT_MILLS;
    // per solver query
    @Builder.Default
    int solverTimeoutMills = Constants.SOLVER_TIMEOUT_MILLS;
    @Builder.Default
    boolean verify = true;

    public static DecompilerOptions defaults() {
        return builder().build();
    }
}
