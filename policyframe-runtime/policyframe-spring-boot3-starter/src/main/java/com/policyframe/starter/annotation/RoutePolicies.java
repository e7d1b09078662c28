package com.policyframe.starter.annotation;

import com.policyframe.api.policy.Policy;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 声明路由上的策略
 * <p>
 * 可用于 Controller 方法或类上，方法上的声明优先于类上的声明 (不合并)。
 * 按名称引用的策略先于内联策略，各自保持声明顺序。
 *
 * <pre>
 * &#64;RoutePolicies(value = {"auth", "quota"}, inline = AuditPolicy.class)
 * &#64;GetMapping("/orders")
 * public List&lt;Order&gt; list() { ... }
 * </pre>
 */
@Documented
@Target({ElementType.TYPE, ElementType.METHOD})
@Retention(RetentionPolicy.RUNTIME)
public @interface RoutePolicies {

    /**
     * 已注册策略的名称
     */
    String[] value() default {};

    /**
     * 内联策略类型：存在同类型 Bean 时使用该 Bean，否则通过无参构造创建
     */
    Class<? extends Policy>[] inline() default {};
}
