package com.policyframe.core.loader;

import lombok.Getter;
import lombok.Setter;

/**
 * 策略清单 (一个 yml 文件对应一个策略，文件名即策略名)
 *
 * <pre>
 * class: com.example.policy.IsAdmin
 * applyPoint: onPostAuth    # 可选；false、~ 或空串表示只保留名称
 * description: only admins
 * </pre>
 */
@Getter
@Setter
public class PolicyManifest {

    private String name;

    private String className;

    /**
     * 挂载点属性，仅在 applyPointDeclared 时有意义
     */
    private String applyPoint;

    private boolean applyPointDeclared;

    private String description;

    @Override
    public String toString() {
        return String.format("PolicyManifest{name='%s', class='%s', applyPoint='%s'}", name, className, applyPoint);
    }
}
