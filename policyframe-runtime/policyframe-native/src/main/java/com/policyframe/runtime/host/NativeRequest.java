package com.policyframe.runtime.host;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.policy.PolicyRequest;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 进程内请求
 * <p>
 * 请求头名称大小写不敏感。路由策略在匹配路由后由宿主绑定。
 */
public class NativeRequest implements PolicyRequest {

    private final String method;
    private final String path;
    private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private final Map<String, Object> attributes = new ConcurrentHashMap<>();
    private Object body;

    private volatile List<?> routePolicies;
    private volatile ApplyPoint currentApplyPoint;

    public NativeRequest(String method, String path) {
        this.method = method == null ? null : method.trim().toUpperCase(Locale.ROOT);
        this.path = path;
    }

    public static NativeRequest get(String path) {
        return new NativeRequest("GET", path);
    }

    public static NativeRequest post(String path, Object body) {
        return new NativeRequest("POST", path).body(body);
    }

    public NativeRequest header(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public NativeRequest body(Object body) {
        this.body = body;
        return this;
    }

    @Override
    public String getMethod() {
        return method;
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getHeader(String name) {
        return headers.get(name);
    }

    public Map<String, String> getHeaders() {
        return Collections.unmodifiableMap(headers);
    }

    @Override
    public List<?> getRoutePolicies() {
        return routePolicies;
    }

    @Override
    public Map<String, Object> getAttributes() {
        return attributes;
    }

    public Object getBody() {
        return body;
    }

    /**
     * 正在执行的挂载点，处理器执行期间为 null
     */
    public ApplyPoint getCurrentApplyPoint() {
        return currentApplyPoint;
    }

    void bindRoute(NativeRoute route) {
        this.routePolicies = route.getPolicies();
    }

    void enter(ApplyPoint applyPoint) {
        this.currentApplyPoint = applyPoint;
    }
}
