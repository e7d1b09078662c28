package com.policyframe.starter.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * PolicyFrame 主配置属性
 *
 * <pre>
 * policyframe:
 *   default-apply-point: onPostAuth
 *   policy-home: /etc/app/policies
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "policyframe")
public class PolicyFrameProperties {

    /**
     * 是否启用 PolicyFrame。
     */
    private boolean enabled = true;

    /**
     * 策略未声明挂载点时使用的默认挂载点。
     * 取值：onRequest, onPreAuth, onPostAuth, onPreHandler, onPostHandler, onPreResponse。
     * 非法值会导致启动失败。
     */
    private String defaultApplyPoint = "onPreHandler";

    /**
     * 策略清单目录 (*.yml / *.yaml)。为空时不扫描。
     */
    private String policyHome;

    /**
     * 启动时是否自动扫描 policyHome。
     */
    private boolean autoScan = true;

    /**
     * 策略过滤器在过滤器链中的顺序。
     */
    private int filterOrder = 0;

    /**
     * 单个挂载点等待策略结果的最长时间，超时按策略执行错误结束请求。
     */
    private Duration stageTimeout = Duration.ofSeconds(30);
}
