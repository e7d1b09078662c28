package com.policyframe.api.policy;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 策略决策结果
 */
public final class PolicyDecision {

    private static final PolicyDecision ALLOW = new PolicyDecision(true, null);

    private final boolean allowed;
    private final String reason;

    private PolicyDecision(boolean allowed, String reason) {
        this.allowed = allowed;
        this.reason = reason;
    }

    public static PolicyDecision allow() {
        return ALLOW;
    }

    public static PolicyDecision deny() {
        return new PolicyDecision(false, null);
    }

    /**
     * @param reason 可读的拒绝原因，会透传给客户端
     */
    public static PolicyDecision deny(String reason) {
        return new PolicyDecision(false, reason);
    }

    public boolean isAllowed() {
        return allowed;
    }

    public String getReason() {
        return reason;
    }

    /**
     * 包装为已完成的阶段，便于同步策略直接返回
     */
    public CompletionStage<PolicyDecision> asStage() {
        return CompletableFuture.completedFuture(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PolicyDecision)) return false;
        PolicyDecision that = (PolicyDecision) o;
        return allowed == that.allowed && Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(allowed, reason);
    }

    @Override
    public String toString() {
        return allowed ? "PolicyDecision{allow}" : "PolicyDecision{deny, reason='" + reason + "'}";
    }
}
