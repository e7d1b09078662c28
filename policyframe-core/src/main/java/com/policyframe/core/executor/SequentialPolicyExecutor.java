package com.policyframe.core.executor;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.policy.PolicyRequest;
import com.policyframe.core.resolver.ResolvedPolicy;

import java.util.List;

/**
 * 顺序执行器：按顺序逐个执行策略，第一个拒绝或错误即停止
 * <p>
 * 无状态，可以在所有请求之间共享；每次执行的状态保存在 {@link PolicyExecution} 中。
 * 本层不做超时控制，一个永不完成的策略只会挂起它自己的请求。
 */
public class SequentialPolicyExecutor {

    public PolicyExecution execute(ApplyPoint applyPoint, List<ResolvedPolicy> policies, PolicyRequest request) {
        PolicyExecution execution = new PolicyExecution(applyPoint, List.copyOf(policies), request);
        execution.start();
        return execution;
    }
}
