package com.policyframe.core.registry;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.policy.Policy;

/**
 * 挂载点属性解析
 * <p>
 * 属性取值：null (使用默认)、{@link Policy#DISABLED} (不绑定) 或合法挂载点名称。
 */
public final class ApplyPointBinding {

    private ApplyPointBinding() {
    }

    public static boolean isAcceptable(String attribute) {
        return attribute == null || isDisabled(attribute) || ApplyPoint.isValid(attribute);
    }

    public static boolean isDisabled(String attribute) {
        return Policy.DISABLED.equals(attribute);
    }

    /**
     * 计算生效的挂载点，调用前应先用 {@link #isAcceptable(String)} 校验
     *
     * @return 不绑定时返回 null
     */
    public static ApplyPoint effective(String attribute, ApplyPoint defaultApplyPoint) {
        if (attribute == null) {
            return defaultApplyPoint;
        }
        if (isDisabled(attribute)) {
            return null;
        }
        return ApplyPoint.of(attribute);
    }
}
