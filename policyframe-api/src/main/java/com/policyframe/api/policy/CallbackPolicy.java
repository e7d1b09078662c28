package com.policyframe.api.policy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 回调风格的策略
 * <p>
 * 适配 "(请求, 完成信号)" 形态的策略实现。第一次信号决定结果，之后的信号被忽略。
 */
@FunctionalInterface
public interface CallbackPolicy extends Policy {

    void apply(PolicyRequest request, PolicyCallback callback);

    @Override
    default CompletionStage<PolicyDecision> check(PolicyRequest request) {
        CompletableFuture<PolicyDecision> future = new CompletableFuture<>();
        apply(request, new SingleShotCallback(this, future));
        return future;
    }
}
