package com.policyframe.starter.configuration;

import com.policyframe.api.policy.Policy;
import com.policyframe.core.loader.PolicyDiscoveryService;
import com.policyframe.core.manager.PolicyManager;
import com.policyframe.starter.web.RoutePolicyIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.util.Map;

/**
 * 策略加载阶段
 * <p>
 * 在全部单例创建之后、开始处理请求之前执行：
 * 1. Policy 类型的 Bean 按 Bean 名称注册
 * 2. 扫描 policyHome 下的清单
 * 3. 声明全部 Controller 路由上的策略
 * 任一步骤失败都会让应用启动失败。
 */
@Slf4j
@RequiredArgsConstructor
public class PolicyFrameInitializer implements SmartInitializingSingleton {

    private final PolicyManager policyManager;
    private final PolicyDiscoveryService discoveryService;
    private final RoutePolicyIndex routePolicyIndex;
    private final ListableBeanFactory beanFactory;
    private final RequestMappingHandlerMapping handlerMapping;

    @Override
    public void afterSingletonsInstantiated() {
        long start = System.currentTimeMillis();

        Map<String, Policy> policyBeans = beanFactory.getBeansOfType(Policy.class);
        policyBeans.forEach(policyManager::register);
        log.info("Registered {} policy beans", policyBeans.size());

        discoveryService.scanAndLoad(policyManager);

        if (handlerMapping != null) {
            routePolicyIndex.declareAll(handlerMapping.getHandlerMethods().values());
        }

        log.info("PolicyFrame initialized in {} ms, policies: {}",
                System.currentTimeMillis() - start, policyManager.getPolicyNames().size());
    }
}
