package com.policyframe.api.exception;

/**
 * 错误类型
 * 宿主可以据此决定如何向客户端呈现错误，状态码沿用 HTTP 语义。
 */
public enum ErrorKind {
    /** 策略名重复注册 */
    DUPLICATE_NAME(500),
    /** 挂载点不在合法集合内 */
    INVALID_APPLY_POINT(500),
    /** 路由引用了未注册的策略 */
    MISSING_POLICY(501),
    /** 路由引用既不是名称也不是策略 */
    MALFORMED_DIRECTIVE(500),
    /** 策略违反执行契约 */
    POLICY_EXECUTION(500),
    /** 策略明确拒绝放行 */
    ACCESS_DENIED(403),
    /** 策略清单无效 */
    INVALID_DEFINITION(500),
    /** 参数不合法 */
    INVALID_ARGUMENT(400);

    private final int statusCode;

    ErrorKind(int statusCode) {
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
