package com.policyframe.api.exception;

/**
 * 策略重复异常
 * 策略名在整个注册表内必须唯一 (不是按挂载点唯一)。
 */
public class DuplicatePolicyException extends PolicyFrameException {

    private final String policyName;

    public DuplicatePolicyException(String policyName) {
        super(ErrorKind.DUPLICATE_NAME, "Trying to add a duplicate policy: " + policyName);
        this.policyName = policyName;
    }

    public String getPolicyName() {
        return policyName;
    }
}
