package com.policyframe.api.exception;

/**
 * 策略缺失异常
 * 路由按名称引用了未注册的策略，通常是拼写错误。以 "未实现" 语义返回给调用方。
 */
public class MissingPolicyException extends PolicyFrameException {

    private final String policyName;

    public MissingPolicyException(String policyName) {
        super(ErrorKind.MISSING_POLICY, "Missing policy: " + policyName);
        this.policyName = policyName;
    }

    public String getPolicyName() {
        return policyName;
    }
}
