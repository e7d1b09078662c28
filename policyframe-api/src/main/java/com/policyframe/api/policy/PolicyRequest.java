package com.policyframe.api.policy;

import java.util.List;
import java.util.Map;

/**
 * 策略看到的请求视图，由宿主实现
 */
public interface PolicyRequest {

    /**
     * 请求方法 (GET/POST 等)
     */
    String getMethod();

    /**
     * 请求路径
     */
    String getPath();

    /**
     * 读取请求头，不存在时返回 null
     */
    String getHeader(String name);

    /**
     * 当前路由声明的策略引用 (原始形态，按声明顺序)
     * <p>
     * 元素可以是策略名 {@link String}、{@link Policy} 或已构造的
     * {@link com.policyframe.api.route.RouteDirective}。路由没有声明时返回 null。
     */
    List<?> getRoutePolicies();

    /**
     * 请求级属性，策略之间可以借此传递数据 (例如认证结果)
     */
    Map<String, Object> getAttributes();

    @SuppressWarnings("unchecked")
    default <T> T getAttribute(String name) {
        return (T) getAttributes().get(name);
    }
}
