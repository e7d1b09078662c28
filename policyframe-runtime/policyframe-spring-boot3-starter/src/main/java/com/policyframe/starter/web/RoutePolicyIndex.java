package com.policyframe.starter.web;

import com.policyframe.api.policy.Policy;
import com.policyframe.api.route.RouteDirective;
import com.policyframe.core.manager.PolicyManager;
import com.policyframe.starter.annotation.RoutePolicies;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.web.method.HandlerMethod;

import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Controller 方法上声明的路由策略索引
 * <p>
 * 启动时对全部 HandlerMethod 调用 {@link #declareAll}，借此校验声明并为内联策略的挂载点安装分发器。
 * 启动后才出现的 HandlerMethod 在首次请求时声明。
 */
@Slf4j
public class RoutePolicyIndex {

    private final PolicyManager policyManager;
    private final Function<Class<? extends Policy>, Policy> inlineFactory;
    private final Map<RouteKey, Optional<List<RouteDirective>>> routes = new ConcurrentHashMap<>();

    public RoutePolicyIndex(PolicyManager policyManager) {
        this(policyManager, type -> BeanUtils.instantiateClass(type));
    }

    public RoutePolicyIndex(PolicyManager policyManager, Function<Class<? extends Policy>, Policy> inlineFactory) {
        this.policyManager = policyManager;
        this.inlineFactory = inlineFactory;
    }

    /**
     * 启动阶段批量声明
     */
    public void declareAll(Collection<HandlerMethod> handlerMethods) {
        int declared = 0;
        for (HandlerMethod handlerMethod : handlerMethods) {
            if (find(handlerMethod) != null) {
                declared++;
            }
        }
        log.info("Route policies declared on {} of {} handler methods", declared, handlerMethods.size());
    }

    /**
     * @return 路由声明的策略引用，未声明时为 null
     */
    public List<RouteDirective> find(HandlerMethod handlerMethod) {
        RouteKey key = new RouteKey(handlerMethod.getBeanType(), handlerMethod.getMethod());
        return routes.computeIfAbsent(key, k -> Optional.ofNullable(declare(k))).orElse(null);
    }

    private List<RouteDirective> declare(RouteKey key) {
        // 方法上的声明优先于类上的声明
        RoutePolicies annotation = AnnotatedElementUtils.findMergedAnnotation(key.method(), RoutePolicies.class);
        if (annotation == null) {
            annotation = AnnotatedElementUtils.findMergedAnnotation(key.beanType(), RoutePolicies.class);
        }
        if (annotation == null) {
            return null;
        }

        List<Object> declared = new ArrayList<>(Arrays.asList(annotation.value()));
        for (Class<? extends Policy> type : annotation.inline()) {
            declared.add(inlineFactory.apply(type));
        }
        List<RouteDirective> directives = policyManager.declareRoute(declared);
        log.debug("Route {}#{} declares {} policies", key.beanType().getSimpleName(), key.method().getName(),
                directives.size());
        return directives;
    }

    private record RouteKey(Class<?> beanType, Method method) {
    }
}
