package com.policyframe.api.exception;

/**
 * 无效挂载点异常
 * 注册、解析或配置时遇到不在合法集合内的挂载点名称时抛出。
 */
public class InvalidApplyPointException extends PolicyFrameException {

    private final String applyPoint;
    private final String policyName;

    public InvalidApplyPointException(String applyPoint) {
        super(ErrorKind.INVALID_APPLY_POINT, "Specified invalid applyPoint: " + applyPoint);
        this.applyPoint = applyPoint;
        this.policyName = null;
    }

    public InvalidApplyPointException(String policyName, String applyPoint) {
        super(ErrorKind.INVALID_APPLY_POINT,
                "Trying to set incorrect applyPoint for the policy " + policyName + ": " + applyPoint);
        this.applyPoint = applyPoint;
        this.policyName = policyName;
    }

    /**
     * 动态策略没有名称
     */
    public static InvalidApplyPointException forInlinePolicy(String applyPoint) {
        return new InvalidApplyPointException(
                "Trying to use incorrect applyPoint for the dynamic policy: " + applyPoint, applyPoint, null);
    }

    private InvalidApplyPointException(String message, String applyPoint, String policyName) {
        super(ErrorKind.INVALID_APPLY_POINT, message);
        this.applyPoint = applyPoint;
        this.policyName = policyName;
    }

    public String getApplyPoint() {
        return applyPoint;
    }

    public String getPolicyName() {
        return policyName;
    }
}
