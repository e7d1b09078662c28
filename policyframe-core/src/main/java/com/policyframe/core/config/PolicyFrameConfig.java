package com.policyframe.core.config;

import com.policyframe.api.ApplyPoint;
import lombok.Builder;
import lombok.Getter;

/**
 * 全局配置
 * <p>
 * 在启动时构建一次，之后只读。
 */
@Getter
@Builder
public class PolicyFrameConfig {

    /**
     * 策略未声明挂载点时使用的默认挂载点
     */
    @Builder.Default
    private ApplyPoint defaultApplyPoint = ApplyPoint.ON_PRE_HANDLER;

    /**
     * 策略清单目录，为空时不做扫描
     */
    private String policyHome;

    /**
     * 启动时是否自动扫描 policyHome
     */
    @Builder.Default
    private boolean autoScan = true;

    public static PolicyFrameConfig defaults() {
        return PolicyFrameConfig.builder().build();
    }

    public ApplyPoint getDefaultApplyPoint() {
        return defaultApplyPoint != null ? defaultApplyPoint : ApplyPoint.ON_PRE_HANDLER;
    }

    public boolean hasPolicyHome() {
        return policyHome != null && !policyHome.trim().isEmpty();
    }

    public static class PolicyFrameConfigBuilder {

        /**
         * 按名称设置默认挂载点，名称在此处校验，非法值直接让启动失败
         *
         * @param name 挂载点名称，null 表示使用内置默认值
         */
        public PolicyFrameConfigBuilder defaultApplyPointName(String name) {
            return defaultApplyPoint(name == null ? ApplyPoint.ON_PRE_HANDLER : ApplyPoint.of(name));
        }
    }
}
