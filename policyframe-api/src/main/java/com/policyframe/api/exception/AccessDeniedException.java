package com.policyframe.api.exception;

/**
 * 访问拒绝异常
 * 策略明确拒绝放行时产生，携带策略给出的原因 (可能为空)。
 */
public class AccessDeniedException extends PolicyFrameException {

    private final String reason;

    public AccessDeniedException(String reason) {
        super(ErrorKind.ACCESS_DENIED, reason != null ? reason : "Forbidden");
        this.reason = reason;
    }

    public String getReason() {
        return reason;
    }
}
