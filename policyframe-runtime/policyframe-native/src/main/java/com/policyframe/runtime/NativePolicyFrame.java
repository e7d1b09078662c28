package com.policyframe.runtime;

import com.policyframe.api.policy.Policy;
import com.policyframe.api.route.RouteDirective;
import com.policyframe.core.config.PolicyFrameConfig;
import com.policyframe.core.loader.PolicyDiscoveryService;
import com.policyframe.core.manager.PolicyManager;
import com.policyframe.runtime.host.NativePolicyHost;
import com.policyframe.runtime.host.NativeRequest;
import com.policyframe.runtime.host.NativeResponse;
import com.policyframe.runtime.host.NativeRoute;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * PolicyFrame Native 启动器
 * <p>
 * 纯 Java 应用通过此类组装宿主和策略管理器。启动时按配置扫描策略清单；
 * 之后可以继续注册策略和添加路由，全部完成后再开始处理请求。
 */
@Slf4j
public class NativePolicyFrame {

    private final NativePolicyHost host;
    private final PolicyManager policyManager;

    private NativePolicyFrame(NativePolicyHost host, PolicyManager policyManager) {
        this.host = host;
        this.policyManager = policyManager;
    }

    /**
     * 启动 (使用默认配置)
     */
    public static NativePolicyFrame start() {
        return start(PolicyFrameConfig.defaults());
    }

    public static NativePolicyFrame start(PolicyFrameConfig config) {
        return start(config, new NativePolicyHost());
    }

    /**
     * 启动 (自定义配置和宿主)
     *
     * @throws com.policyframe.api.exception.PolicyFrameException 清单扫描或注册失败
     */
    public static NativePolicyFrame start(PolicyFrameConfig config, NativePolicyHost host) {
        long start = System.currentTimeMillis();
        log.info("Starting PolicyFrame Native Runtime...");

        PolicyManager policyManager = new PolicyManager(host, config);

        // 自动扫描策略清单
        new PolicyDiscoveryService(policyManager.getConfig()).scanAndLoad(policyManager);

        log.info("PolicyFrame Native started in {} ms, policies: {}",
                System.currentTimeMillis() - start, policyManager.getPolicyNames().size());
        return new NativePolicyFrame(host, policyManager);
    }

    public NativePolicyFrame register(String name, Policy policy) {
        policyManager.register(name, policy);
        return this;
    }

    /**
     * 添加路由，路由上的策略引用在此处校验
     */
    public NativePolicyFrame route(NativeRoute route) {
        if (route.getPolicies() != null) {
            List<RouteDirective> directives = policyManager.declareRoute(route.getPolicies());
            route = route.policies(directives);
        }
        host.addRoute(route);
        return this;
    }

    public CompletableFuture<NativeResponse> handle(NativeRequest request) {
        return host.handle(request);
    }

    public NativePolicyHost getHost() {
        return host;
    }

    public PolicyManager getPolicyManager() {
        return policyManager;
    }
}
