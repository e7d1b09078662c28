package com.policyframe.core.executor;

/**
 * 策略执行状态
 * <p>
 * PENDING -> RUNNING(i) -> CONTINUED(i) -> RUNNING(i+1) ... -> COMPLETED / DENIED / ERRORED
 */
public enum ExecutionState {
    PENDING,
    RUNNING,
    CONTINUED,
    DENIED,
    ERRORED,
    COMPLETED;

    public boolean isTerminal() {
        return this == DENIED || this == ERRORED || this == COMPLETED;
    }
}
