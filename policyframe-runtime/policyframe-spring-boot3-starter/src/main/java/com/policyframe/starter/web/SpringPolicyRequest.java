package com.policyframe.starter.web;

import com.policyframe.api.policy.PolicyRequest;
import jakarta.servlet.http.HttpServletRequest;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Servlet 请求的策略视图
 */
public class SpringPolicyRequest implements PolicyRequest {

    private final HttpServletRequest servletRequest;
    private final List<?> routePolicies;
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private final AtomicBoolean finalized = new AtomicBoolean(false);

    public SpringPolicyRequest(HttpServletRequest servletRequest, List<?> routePolicies) {
        this.servletRequest = servletRequest;
        this.routePolicies = routePolicies;
    }

    @Override
    public String getMethod() {
        return servletRequest.getMethod();
    }

    @Override
    public String getPath() {
        return servletRequest.getRequestURI();
    }

    @Override
    public String getHeader(String name) {
        return servletRequest.getHeader(name);
    }

    @Override
    public List<?> getRoutePolicies() {
        return routePolicies;
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public HttpServletRequest getServletRequest() {
        return servletRequest;
    }

    boolean isFinalized() {
        return finalized.get();
    }

    /**
     * @return 是否由本次调用结束了请求
     */
    boolean markFinalized() {
        return finalized.compareAndSet(false, true);
    }
}
