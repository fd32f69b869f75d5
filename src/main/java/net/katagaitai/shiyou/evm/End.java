package net.katagaitai.shiyou.evm;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * A terminal state of one explored execution path.
 */
@EqualsAndHashCode
@ToString
public abstract class End {
    @Getter
    private final ImmutableList<Prop> props;

    protected End(List<Prop> props) {
        this.props = ImmutableList.copyOf(props);
    }

    public boolean isSuccess() {
        return false;
    }

    public boolean isPartial() {
        return false;
    }

    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class Success extends End {
        private final Buf returnData;
        private final ImmutableMap<Address, Store> storage;

        public Success(List<Prop> props, Buf returnData, Map<Address, Store> storage) {
            super(props);
            this.returnData = returnData;
            this.storage = ImmutableMap.copyOf(storage);
        }

        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * A reverting or erroring path. Dropped by the decompiler, kept in programs for the solver.
     */
    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class Failure extends End {
        private final String reason;

        public Failure(List<Prop> props, String reason) {
            super(props);
            this.reason = reason;
        }
    }

    /**
     * A path the engine gave up on: loop bound, timeout, unresolved external call.
     */
    @Getter
    @EqualsAndHashCode(callSuper = true)
    @ToString(callSuper = true)
    public static class Partial extends End {
        private final String reason;

        public Partial(List<Prop> props, String reason) {
            super(props);
            this.reason = reason;
        }

        @Override
        public boolean isPartial() {
            return true;
        }
    }
}
