package com.policyframe.api;

import com.policyframe.api.exception.InvalidApplyPointException;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 挂载点枚举
 * 定义了请求生命周期中可以执行策略的阶段，按发生顺序排列。
 * <p>
 * 集合是封闭的：运行时不能新增或移除挂载点。
 * </p>
 */
public enum ApplyPoint {
    /**
     * 收到请求 (连接建立后、路由匹配后)
     */
    ON_REQUEST("onRequest"),

    /**
     * 认证之前
     */
    ON_PRE_AUTH("onPreAuth"),

    /**
     * 认证之后
     */
    ON_POST_AUTH("onPostAuth"),

    /**
     * 业务处理器执行之前 (默认挂载点)
     */
    ON_PRE_HANDLER("onPreHandler"),

    /**
     * 业务处理器执行之后
     */
    ON_POST_HANDLER("onPostHandler"),

    /**
     * 响应发出之前
     */
    ON_PRE_RESPONSE("onPreResponse");

    private static final List<ApplyPoint> ORDERED = Collections.unmodifiableList(Arrays.asList(values()));

    private final String name;

    ApplyPoint(String name) {
        this.name = name;
    }

    /**
     * 对外名称 (配置、清单文件中使用的标识)
     */
    public String getName() {
        return name;
    }

    /**
     * 按生命周期顺序返回全部挂载点
     */
    public static List<ApplyPoint> ordered() {
        return ORDERED;
    }

    /**
     * 判断名称是否为合法挂载点
     */
    public static boolean isValid(String name) {
        if (name == null) {
            return false;
        }
        for (ApplyPoint point : ORDERED) {
            if (point.name.equals(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 按名称查找挂载点
     *
     * @throws InvalidApplyPointException 名称不在合法集合内
     */
    public static ApplyPoint of(String name) {
        for (ApplyPoint point : ORDERED) {
            if (point.name.equals(name)) {
                return point;
            }
        }
        throw new InvalidApplyPointException(name);
    }

    /**
     * 是否在指定挂载点之前发生
     */
    public boolean isBefore(ApplyPoint other) {
        return this.ordinal() < other.ordinal();
    }

    @Override
    public String toString() {
        return name;
    }
}
