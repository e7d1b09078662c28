package com.policyframe.api.route;

import com.policyframe.api.exception.MalformedDirectiveException;
import com.policyframe.api.policy.Policies;
import com.policyframe.api.policy.Policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 路由上的策略引用
 * <p>
 * 只有两种形态：按名称引用已注册策略 ({@link ByName})，或直接内联策略 ({@link Inline})。
 */
public abstract class RouteDirective {

    private RouteDirective() {
    }

    public static RouteDirective byName(String name) {
        return new ByName(name);
    }

    public static RouteDirective inline(Policy policy) {
        return new Inline(policy);
    }

    /**
     * 将路由上声明的原始元素转换为引用
     *
     * @throws MalformedDirectiveException 元素既不是名称也不是策略
     */
    public static RouteDirective of(Object declared) {
        if (declared instanceof RouteDirective directive) {
            return directive;
        }
        if (declared instanceof String name) {
            return new ByName(name);
        }
        if (declared instanceof Policy policy) {
            return new Inline(policy);
        }
        throw new MalformedDirectiveException(declared);
    }

    /**
     * 批量转换，保持声明顺序，遇到第一个非法元素即失败
     */
    public static List<RouteDirective> listOf(List<?> declared) {
        if (declared == null || declared.isEmpty()) {
            return Collections.emptyList();
        }
        List<RouteDirective> directives = new ArrayList<>(declared.size());
        for (Object element : declared) {
            directives.add(of(element));
        }
        return Collections.unmodifiableList(directives);
    }

    /**
     * 按名称引用
     */
    public static final class ByName extends RouteDirective {

        private final String name;

        private ByName(String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ByName other && name.equals(other.name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return "ByName(" + name + ")";
        }
    }

    /**
     * 内联策略，不进入注册表，不受名称唯一性约束
     */
    public static final class Inline extends RouteDirective {

        private final Policy policy;

        private Inline(Policy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
        }

        public Policy getPolicy() {
            return policy;
        }

        @Override
        public String toString() {
            return "Inline(" + Policies.describe(policy) + ")";
        }
    }
}
