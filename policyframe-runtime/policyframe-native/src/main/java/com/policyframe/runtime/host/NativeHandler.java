package com.policyframe.runtime.host;

/**
 * 路由的业务处理器，返回值作为响应体
 */
@FunctionalInterface
public interface NativeHandler {

    Object handle(NativeRequest request) throws Exception;
}
