package com.policyframe.starter.configuration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.policyframe.api.policy.Policy;
import com.policyframe.core.config.PolicyFrameConfig;
import com.policyframe.core.loader.PolicyDiscoveryService;
import com.policyframe.core.manager.PolicyManager;
import com.policyframe.starter.config.PolicyFrameProperties;
import com.policyframe.starter.web.PolicyWebFilter;
import com.policyframe.starter.web.RoutePolicyIndex;
import com.policyframe.starter.web.SpringPolicyHost;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.web.servlet.WebMvcAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

/**
 * PolicyFrame Spring Boot 3 自动配置
 */
@Slf4j
@AutoConfiguration(after = WebMvcAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnProperty(prefix = "policyframe", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PolicyFrameProperties.class)
public class PolicyFrameAutoConfiguration {

    private static final String HANDLER_MAPPING = "requestMappingHandlerMapping";

    // 非法的默认挂载点在这里让启动失败
    @Bean
    @ConditionalOnMissingBean
    public PolicyFrameConfig policyFrameConfig(PolicyFrameProperties properties) {
        return PolicyFrameConfig.builder()
                .defaultApplyPointName(properties.getDefaultApplyPoint())
                .policyHome(properties.getPolicyHome())
                .autoScan(properties.isAutoScan())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public SpringPolicyHost springPolicyHost(PolicyFrameProperties properties) {
        return new SpringPolicyHost(properties.getStageTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyManager policyManager(SpringPolicyHost host, PolicyFrameConfig config) {
        return new PolicyManager(host, config);
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyDiscoveryService policyDiscoveryService(PolicyFrameConfig config) {
        return new PolicyDiscoveryService(config);
    }

    @Bean
    @ConditionalOnMissingBean
    public RoutePolicyIndex routePolicyIndex(PolicyManager policyManager, ListableBeanFactory beanFactory) {
        return new RoutePolicyIndex(policyManager, type -> inlinePolicy(beanFactory, type));
    }

    @Bean
    public PolicyFrameInitializer policyFrameInitializer(
            PolicyManager policyManager,
            PolicyDiscoveryService discoveryService,
            RoutePolicyIndex routePolicyIndex,
            ListableBeanFactory beanFactory,
            @Qualifier(HANDLER_MAPPING) ObjectProvider<RequestMappingHandlerMapping> handlerMapping) {
        return new PolicyFrameInitializer(policyManager, discoveryService, routePolicyIndex, beanFactory,
                handlerMapping.getIfAvailable());
    }

    @Bean
    public FilterRegistrationBean<PolicyWebFilter> policyWebFilter(
            SpringPolicyHost host,
            RoutePolicyIndex routePolicyIndex,
            @Qualifier(HANDLER_MAPPING) RequestMappingHandlerMapping handlerMapping,
            ObjectProvider<ObjectMapper> objectMapper,
            PolicyFrameProperties properties) {
        PolicyWebFilter filter = new PolicyWebFilter(host, routePolicyIndex, handlerMapping,
                objectMapper.getIfAvailable(ObjectMapper::new));
        FilterRegistrationBean<PolicyWebFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setName("policyWebFilter");
        registration.addUrlPatterns("/*");
        registration.setOrder(properties.getFilterOrder());
        log.info("PolicyWebFilter registered with order {}", properties.getFilterOrder());
        return registration;
    }

    /**
     * 内联策略优先使用同类型的 Bean
     */
    private static <T extends Policy> Policy inlinePolicy(ListableBeanFactory beanFactory, Class<T> type) {
        return beanFactory.getBeanProvider(type).getIfAvailable(() -> BeanUtils.instantiateClass(type));
    }
}
