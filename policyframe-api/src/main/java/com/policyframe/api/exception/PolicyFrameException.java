package com.policyframe.api.exception;

/**
 * PolicyFrame 异常基类
 * 所有框架自身产生的错误都继承此类，并携带 {@link ErrorKind}。
 */
public abstract class PolicyFrameException extends RuntimeException {

    private final ErrorKind kind;

    protected PolicyFrameException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PolicyFrameException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * 建议宿主使用的状态码
     */
    public int getStatusCode() {
        return kind.getStatusCode();
    }
}
