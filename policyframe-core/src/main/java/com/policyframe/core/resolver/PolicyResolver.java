package com.policyframe.core.resolver;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.InvalidApplyPointException;
import com.policyframe.api.exception.MissingPolicyException;
import com.policyframe.api.policy.Policy;
import com.policyframe.api.route.RouteDirective;
import com.policyframe.core.registry.ApplyPointBinding;
import com.policyframe.core.registry.PolicyRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 策略解析器
 * <p>
 * 根据路由声明和当前挂载点，计算本请求在本阶段需要执行的策略，保持声明顺序。
 * 属于其它挂载点的引用直接跳过 (它们会在自己的阶段执行)。遇到第一个错误立即停止。
 */
@Slf4j
@RequiredArgsConstructor
public class PolicyResolver {

    private final PolicyRegistry registry;
    private final ApplyPoint defaultApplyPoint;

    /**
     * @param current  当前挂载点
     * @param declared 路由声明的原始引用列表，可以为 null
     * @return 本阶段待执行的策略
     * @throws MissingPolicyException                                  按名称引用的策略未注册
     * @throws InvalidApplyPointException                              内联策略挂载点非法
     * @throws com.policyframe.api.exception.MalformedDirectiveException 引用既不是名称也不是策略
     */
    public List<ResolvedPolicy> resolve(ApplyPoint current, List<?> declared) {
        if (declared == null || declared.isEmpty()) {
            return Collections.emptyList();
        }

        List<ResolvedPolicy> toRun = new ArrayList<>();
        for (Object element : declared) {
            // 逐个转换，保证错误优先级与声明顺序一致
            RouteDirective directive = RouteDirective.of(element);

            if (directive instanceof RouteDirective.ByName byName) {
                String name = byName.getName();
                if (!registry.contains(name)) {
                    throw new MissingPolicyException(name);
                }
                Policy stored = registry.get(current, name);
                if (stored != null) {
                    toRun.add(ResolvedPolicy.named(name, stored));
                }
            } else if (directive instanceof RouteDirective.Inline inline) {
                if (inlineApplyPoint(inline.getPolicy()) == current) {
                    toRun.add(ResolvedPolicy.inline(inline.getPolicy()));
                }
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("[{}] Resolved {} of {} declared policies", current, toRun.size(), declared.size());
        }
        return toRun;
    }

    /**
     * 内联策略的生效挂载点，不绑定时返回 null
     *
     * @throws InvalidApplyPointException 挂载点非法
     */
    public ApplyPoint inlineApplyPoint(Policy policy) {
        String attribute = policy.applyPoint();
        if (!ApplyPointBinding.isAcceptable(attribute)) {
            throw InvalidApplyPointException.forInlinePolicy(attribute);
        }
        return ApplyPointBinding.effective(attribute, defaultApplyPoint);
    }

    public ApplyPoint getDefaultApplyPoint() {
        return defaultApplyPoint;
    }
}
