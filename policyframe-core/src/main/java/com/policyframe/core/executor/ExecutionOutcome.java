package com.policyframe.core.executor;

import com.policyframe.api.exception.AccessDeniedException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 一次策略链执行的最终结果
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ExecutionOutcome {

    private static final ExecutionOutcome COMPLETED = new ExecutionOutcome(ExecutionState.COMPLETED, null, null, null);

    private final ExecutionState state;
    private final String reason;
    private final Throwable error;
    /** 给出终态的策略，COMPLETED 时为 null */
    private final String decidedBy;

    public static ExecutionOutcome completed() {
        return COMPLETED;
    }

    public static ExecutionOutcome denied(String decidedBy, String reason) {
        return new ExecutionOutcome(ExecutionState.DENIED, reason, null, decidedBy);
    }

    public static ExecutionOutcome errored(String decidedBy, Throwable error) {
        return new ExecutionOutcome(ExecutionState.ERRORED, null, error, decidedBy);
    }

    public boolean isCompleted() {
        return state == ExecutionState.COMPLETED;
    }

    /**
     * 映射为交给宿主的错误：拒绝映射为禁止访问，错误原样返回，完成时为 null
     */
    public Throwable toError() {
        switch (state) {
            case DENIED:
                return new AccessDeniedException(reason);
            case ERRORED:
                return error;
            default:
                return null;
        }
    }

    @Override
    public String toString() {
        switch (state) {
            case DENIED:
                return "DENIED(" + reason + ") by " + decidedBy;
            case ERRORED:
                return "ERRORED(" + error + ") by " + decidedBy;
            default:
                return state.name();
        }
    }
}
