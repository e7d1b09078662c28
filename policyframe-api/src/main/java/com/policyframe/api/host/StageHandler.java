package com.policyframe.api.host;

import com.policyframe.api.policy.PolicyRequest;

/**
 * 挂载点处理器，每个到达该挂载点的请求调用一次
 * <p>
 * 处理器必须 (可能是异步地) 通过 {@link StageReply} 给出结果。
 */
@FunctionalInterface
public interface StageHandler {

    void handle(PolicyRequest request, StageReply reply);
}
