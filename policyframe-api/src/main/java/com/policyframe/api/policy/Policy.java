package com.policyframe.api.policy;

import java.util.concurrent.CompletionStage;

/**
 * 策略
 * <p>
 * 检查一个请求并给出放行或拒绝的决定。策略可以先执行异步操作 (例如远程鉴权)，
 * 再完成返回的 {@link CompletionStage}；返回的阶段只会被消费一次。
 * <ul>
 *     <li>正常完成且 {@link PolicyDecision#isAllowed()} 为 true：放行，执行下一个策略</li>
 *     <li>正常完成且被拒绝：请求以 "禁止访问" 结束，携带拒绝原因</li>
 *     <li>异常完成或直接抛出异常：异常原样交给宿主</li>
 * </ul>
 */
@FunctionalInterface
public interface Policy {

    /**
     * 挂载点属性值：保留策略名但不绑定任何挂载点，永远不会执行
     */
    String DISABLED = "disabled";

    /**
     * 检查请求
     *
     * @param request 当前请求
     * @return 决策结果
     */
    CompletionStage<PolicyDecision> check(PolicyRequest request);

    /**
     * 声明的挂载点属性
     * <p>
     * 返回 null 表示使用默认挂载点；返回 {@link #DISABLED} 表示不绑定；
     * 其余取值必须是合法的挂载点名称。
     */
    default String applyPoint() {
        return null;
    }
}
