package com.policyframe.api.policy;

import com.policyframe.api.ApplyPoint;

import java.util.Objects;
import java.util.concurrent.CompletionStage;

/**
 * 策略工具方法
 */
public final class Policies {

    private Policies() {
    }

    /**
     * 绑定到指定挂载点
     */
    public static Policy at(ApplyPoint applyPoint, Policy policy) {
        return new BoundPolicy(policy, Objects.requireNonNull(applyPoint, "applyPoint").getName());
    }

    /**
     * 以原始名称绑定挂载点，名称的合法性在注册或解析时校验
     */
    public static Policy at(String applyPoint, Policy policy) {
        return new BoundPolicy(policy, applyPoint);
    }

    /**
     * 保留名称但不绑定挂载点
     */
    public static Policy disabled(Policy policy) {
        return new BoundPolicy(policy, Policy.DISABLED);
    }

    public static Policy allowAll() {
        return request -> PolicyDecision.allow().asStage();
    }

    public static Policy denyAll(String reason) {
        return request -> PolicyDecision.deny(reason).asStage();
    }

    /**
     * 日志中使用的策略描述
     */
    public static String describe(Policy policy) {
        if (policy == null) {
            return "null";
        }
        return policy instanceof BoundPolicy ? policy.toString() : policy.getClass().getName();
    }

    private static final class BoundPolicy implements Policy {

        private final Policy delegate;
        private final String applyPoint;

        private BoundPolicy(Policy delegate, String applyPoint) {
            this.delegate = Objects.requireNonNull(delegate, "policy");
            this.applyPoint = applyPoint;
        }

        @Override
        public CompletionStage<PolicyDecision> check(PolicyRequest request) {
            return delegate.check(request);
        }

        @Override
        public String applyPoint() {
            return applyPoint;
        }

        @Override
        public String toString() {
            return describe(delegate) + "@" + applyPoint;
        }
    }
}
