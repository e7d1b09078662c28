package com.policyframe.core.resolver;

import com.policyframe.api.policy.Policies;
import com.policyframe.api.policy.Policy;
import lombok.Value;

/**
 * 解析后待执行的策略
 */
@Value
public class ResolvedPolicy {
    /** 内联策略为 null */
    String name;
    Policy policy;

    public static ResolvedPolicy named(String name, Policy policy) {
        return new ResolvedPolicy(name, policy);
    }

    public static ResolvedPolicy inline(Policy policy) {
        return new ResolvedPolicy(null, policy);
    }

    public boolean isInline() {
        return name == null;
    }

    /**
     * 日志标签
     */
    public String label() {
        return name != null ? name : "inline:" + Policies.describe(policy);
    }
}
