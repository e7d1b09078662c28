package com.policyframe.core.manager;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.DuplicatePolicyException;
import com.policyframe.api.exception.InvalidApplyPointException;
import com.policyframe.api.exception.InvalidArgumentException;
import com.policyframe.api.host.HostLifecycle;
import com.policyframe.api.policy.Policies;
import com.policyframe.api.policy.Policy;
import com.policyframe.api.route.RouteDirective;
import com.policyframe.core.config.PolicyFrameConfig;
import com.policyframe.core.dispatch.StageDispatcher;
import com.policyframe.core.executor.SequentialPolicyExecutor;
import com.policyframe.core.loader.PolicySource;
import com.policyframe.core.registry.ApplyPointBinding;
import com.policyframe.core.registry.PolicyRegistry;
import com.policyframe.core.resolver.PolicyResolver;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 策略管理器
 * <p>
 * 职责：
 * 1. 注册策略 (名称唯一、挂载点校验)
 * 2. 首次有策略绑定到某挂载点时，向宿主安装该挂载点的分发器
 * 3. 批量加载、重置
 * <p>
 * 生命周期分两阶段：加载阶段 (单线程调用注册方法) 和服务阶段 (只读)。
 * 注册方法不保证与请求处理并发安全。
 */
@Slf4j
public class PolicyManager {

    private final HostLifecycle host;
    private final PolicyFrameConfig config;
    private final PolicyRegistry registry;
    private final PolicyResolver resolver;
    private final SequentialPolicyExecutor executor;

    public PolicyManager(HostLifecycle host, PolicyFrameConfig config) {
        this(host, config, new PolicyRegistry(), new SequentialPolicyExecutor());
    }

    public PolicyManager(HostLifecycle host, PolicyFrameConfig config,
                         PolicyRegistry registry, SequentialPolicyExecutor executor) {
        if (host == null) {
            throw new InvalidArgumentException("host", "Host lifecycle is required");
        }
        this.host = host;
        this.config = config != null ? config : PolicyFrameConfig.defaults();
        this.registry = registry;
        this.executor = executor;
        this.resolver = new PolicyResolver(registry, this.config.getDefaultApplyPoint());
        log.info("PolicyManager initialized, defaultApplyPoint={}", this.config.getDefaultApplyPoint());
    }

    /**
     * 注册策略
     *
     * @throws DuplicatePolicyException   名称已存在
     * @throws InvalidApplyPointException 挂载点属性非法
     */
    public void register(String name, Policy policy) {
        if (name == null || name.trim().isEmpty()) {
            throw new InvalidArgumentException("name", "Policy name cannot be blank");
        }
        if (policy == null) {
            throw new InvalidArgumentException("policy", "Policy cannot be null: " + name);
        }
        if (registry.contains(name)) {
            log.error("Trying to add a duplicate policy: {}", name);
            throw new DuplicatePolicyException(name);
        }

        String attribute = policy.applyPoint();
        if (!ApplyPointBinding.isAcceptable(attribute)) {
            log.error("Trying to set incorrect applyPoint for the policy {}: {}", name, attribute);
            throw new InvalidApplyPointException(name, attribute);
        }

        ApplyPoint applyPoint = ApplyPointBinding.effective(attribute, config.getDefaultApplyPoint());
        registry.add(name, applyPoint, policy);

        if (applyPoint == null) {
            log.info("Reserved policy name {} (not bound to any applyPoint)", name);
            return;
        }
        log.info("Added policy {} at {}", name, applyPoint);
        ensureDispatcher(applyPoint);
    }

    /**
     * 按顺序批量注册，第一个失败即中止并抛出；之前已注册的策略保留
     */
    public void loadFromSource(PolicySource source) {
        List<PolicySource.Entry> entries = source.load();
        log.info("Loading {} policies", entries.size());
        for (PolicySource.Entry entry : entries) {
            register(entry.getName(), entry.getPolicy());
        }
        log.info("Policy loading finished. Total registered: {}", registry.size());
    }

    /**
     * 预先声明路由上的策略引用
     * <p>
     * 在路由定义时校验引用形态和内联策略的挂载点，并为内联策略的挂载点安装分发器
     * (内联策略不进入注册表，否则其挂载点可能没有分发器)。
     * 按名称的引用此时不检查是否存在，缺失的策略在请求时报告。
     *
     * @return 校验后的引用列表
     */
    public List<RouteDirective> declareRoute(List<?> declared) {
        List<RouteDirective> directives = RouteDirective.listOf(declared);
        for (RouteDirective directive : directives) {
            if (directive instanceof RouteDirective.Inline inline) {
                ApplyPoint applyPoint = resolver.inlineApplyPoint(inline.getPolicy());
                if (applyPoint != null) {
                    log.debug("Route declares inline policy {} at {}", Policies.describe(inline.getPolicy()), applyPoint);
                    ensureDispatcher(applyPoint);
                }
            }
        }
        return directives;
    }

    /**
     * 清空注册表
     * <p>
     * 已安装到宿主的分发器无法卸载，重置后它们不再生效 (请求原样放行)。
     * 需要干净重启时应同时重建宿主的扩展点。
     */
    public void reset() {
        log.info("Resetting policy registry ({} policies)", registry.size());
        registry.clear();
    }

    private void ensureDispatcher(ApplyPoint applyPoint) {
        if (registry.markDispatcherInstalled(applyPoint)) {
            host.ext(applyPoint, new StageDispatcher(applyPoint, registry.getGeneration(), registry, resolver, executor));
            log.info("Installed policy dispatcher at {}", applyPoint);
        }
    }

    public boolean contains(String name) {
        return registry.contains(name);
    }

    public Set<String> getPolicyNames() {
        return registry.getNames();
    }

    public Map<String, Policy> getPolicies(ApplyPoint applyPoint) {
        return registry.getPolicies(applyPoint);
    }

    public boolean isDispatcherInstalled(ApplyPoint applyPoint) {
        return registry.isDispatcherInstalled(applyPoint);
    }

    public ApplyPoint getDefaultApplyPoint() {
        return config.getDefaultApplyPoint();
    }

    public PolicyFrameConfig getConfig() {
        return config;
    }

    public PolicyResolver getResolver() {
        return resolver;
    }
}
