package com.policyframe.runtime.host;

import com.policyframe.api.exception.PolicyFrameException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

/**
 * 进程内响应
 */
@Getter
@ToString
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class NativeResponse {

    public static final int OK = 200;
    public static final int NOT_FOUND = 404;
    public static final int INTERNAL_ERROR = 500;

    private final int status;
    private final Object body;

    /**
     * 结束请求的错误，成功时为 null
     */
    private final Throwable error;

    public static NativeResponse ok(Object body) {
        return new NativeResponse(OK, body, null);
    }

    public static NativeResponse notFound(String method, String path) {
        return new NativeResponse(NOT_FOUND, "No route for " + method + " " + path, null);
    }

    /**
     * 框架异常使用其状态码，其余按内部错误处理
     */
    public static NativeResponse failed(Throwable error) {
        int status = error instanceof PolicyFrameException pfe ? pfe.getStatusCode() : INTERNAL_ERROR;
        return new NativeResponse(status, error.getMessage(), error);
    }

    public boolean isSuccess() {
        return status == OK;
    }
}
