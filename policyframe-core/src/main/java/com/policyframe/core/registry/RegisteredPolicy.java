package com.policyframe.core.registry;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.policy.Policy;
import lombok.Value;

/**
 * 注册表中的一条策略记录
 */
@Value
public class RegisteredPolicy {
    String name;
    /** 为 null 表示名称已保留但未绑定挂载点 */
    ApplyPoint applyPoint;
    Policy policy;

    public boolean isBound() {
        return applyPoint != null;
    }
}
