package com.policyframe.runtime.host;

import com.policyframe.api.exception.InvalidArgumentException;
import lombok.Getter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * 路由定义：方法 + 路径精确匹配
 */
@Getter
public final class NativeRoute {

    private final String method;
    private final String path;
    private final NativeHandler handler;

    /**
     * 路由声明的策略引用，null 表示未声明
     */
    private final List<?> policies;

    private NativeRoute(String method, String path, NativeHandler handler, List<?> policies) {
        if (method == null || method.trim().isEmpty()) {
            throw new InvalidArgumentException("method", "Route method cannot be blank");
        }
        if (path == null || !path.startsWith("/")) {
            throw new InvalidArgumentException("path", "Route path must start with '/': " + path);
        }
        if (handler == null) {
            throw new InvalidArgumentException("handler", "Route handler cannot be null: " + path);
        }
        this.method = method.trim().toUpperCase(Locale.ROOT);
        this.path = path;
        this.handler = handler;
        this.policies = policies == null ? null : Collections.unmodifiableList(policies);
    }

    public static NativeRoute of(String method, String path, NativeHandler handler) {
        return new NativeRoute(method, path, handler, null);
    }

    public static NativeRoute get(String path, NativeHandler handler) {
        return of("GET", path, handler);
    }

    public static NativeRoute post(String path, NativeHandler handler) {
        return of("POST", path, handler);
    }

    /**
     * 声明策略引用：策略名、策略实例或 RouteDirective
     */
    public NativeRoute policies(Object... declared) {
        return policies(Arrays.asList(declared));
    }

    public NativeRoute policies(List<?> declared) {
        return new NativeRoute(method, path, handler, declared);
    }

    String key() {
        return key(method, path);
    }

    static String key(String method, String path) {
        return method + " " + path;
    }

    @Override
    public String toString() {
        return key();
    }
}
