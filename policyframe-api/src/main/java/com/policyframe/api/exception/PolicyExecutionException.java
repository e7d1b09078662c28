package com.policyframe.api.exception;

/**
 * 策略执行异常
 * 策略违反执行契约 (例如返回 null) 时由执行器产生。策略自身抛出的异常原样传递，不会被包装。
 */
public class PolicyExecutionException extends PolicyFrameException {

    private final String policy;

    public PolicyExecutionException(String policy, String message) {
        super(ErrorKind.POLICY_EXECUTION, message);
        this.policy = policy;
    }

    public PolicyExecutionException(String policy, String message, Throwable cause) {
        super(ErrorKind.POLICY_EXECUTION, message, cause);
        this.policy = policy;
    }

    public String getPolicy() {
        return policy;
    }
}
