package com.policyframe.api.policy;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.CompletableFuture;

/**
 * 只接受第一次信号的回调
 */
@Slf4j
final class SingleShotCallback implements PolicyCallback {

    private final Object policy;
    private final CompletableFuture<PolicyDecision> future;

    SingleShotCallback(Object policy, CompletableFuture<PolicyDecision> future) {
        this.policy = policy;
        this.future = future;
    }

    @Override
    public void done(Throwable error, boolean canContinue, String message) {
        boolean accepted;
        if (error != null) {
            accepted = future.completeExceptionally(error);
        } else if (canContinue) {
            accepted = future.complete(PolicyDecision.allow());
        } else {
            accepted = future.complete(PolicyDecision.deny(message));
        }
        if (!accepted) {
            log.warn("Policy {} signalled completion more than once, extra signal ignored", policy);
        }
    }
}
