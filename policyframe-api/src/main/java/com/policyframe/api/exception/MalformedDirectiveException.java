package com.policyframe.api.exception;

/**
 * 路由策略引用格式错误
 */
public class MalformedDirectiveException extends PolicyFrameException {

    private final transient Object directive;

    public MalformedDirectiveException(Object directive) {
        super(ErrorKind.MALFORMED_DIRECTIVE, "Policy not specified by name or by function: "
                + (directive == null ? "null" : directive.getClass().getName()));
        this.directive = directive;
    }

    public Object getDirective() {
        return directive;
    }
}
