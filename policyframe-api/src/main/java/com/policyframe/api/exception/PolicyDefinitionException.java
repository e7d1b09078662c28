package com.policyframe.api.exception;

/**
 * 策略清单异常
 * 发现阶段解析清单或实例化策略失败时抛出，会中止整个加载阶段。
 */
public class PolicyDefinitionException extends PolicyFrameException {

    private final String source;

    public PolicyDefinitionException(String source, String message) {
        super(ErrorKind.INVALID_DEFINITION, message);
        this.source = source;
    }

    public PolicyDefinitionException(String source, String message, Throwable cause) {
        super(ErrorKind.INVALID_DEFINITION, message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
