package com.policyframe.core.dispatch;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.PolicyFrameException;
import com.policyframe.api.host.StageHandler;
import com.policyframe.api.host.StageReply;
import com.policyframe.api.policy.PolicyRequest;
import com.policyframe.core.executor.ExecutionOutcome;
import com.policyframe.core.executor.SequentialPolicyExecutor;
import com.policyframe.core.registry.PolicyRegistry;
import com.policyframe.core.resolver.PolicyResolver;
import com.policyframe.core.resolver.ResolvedPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * 挂载点分发器
 * <p>
 * 每个挂载点一个实例，安装到宿主后对每个到达该阶段的请求调用一次：
 * 解析路由声明 -> 顺序执行 -> 把结果交给宿主。
 * 注册表重置后，重置前安装的分发器不再生效，请求原样放行。
 */
@Slf4j
@RequiredArgsConstructor
public class StageDispatcher implements StageHandler {

    private final ApplyPoint applyPoint;
    private final long generation;
    private final PolicyRegistry registry;
    private final PolicyResolver resolver;
    private final SequentialPolicyExecutor executor;

    @Override
    public void handle(PolicyRequest request, StageReply reply) {
        List<?> declared = request.getRoutePolicies();
        if (declared == null || isStale()) {
            reply.proceed();
            return;
        }

        List<ResolvedPolicy> toRun;
        try {
            toRun = resolver.resolve(applyPoint, declared);
        } catch (PolicyFrameException e) {
            // 解析失败不进入执行器，直接结束请求
            log.warn("[{}] Policy resolution failed for {} {}: {}", applyPoint,
                    request.getMethod(), request.getPath(), e.getMessage());
            if (!reply.isFinalized()) {
                reply.finish(e);
            }
            return;
        }

        executor.execute(applyPoint, toRun, request)
                .getOutcome()
                .thenAccept(outcome -> deliver(request, reply, outcome))
                .exceptionally(e -> {
                    log.error("[{}] Host failed to accept policy outcome for {} {}", applyPoint,
                            request.getMethod(), request.getPath(), e);
                    return null;
                });
    }

    private void deliver(PolicyRequest request, StageReply reply, ExecutionOutcome outcome) {
        if (reply.isFinalized()) {
            log.debug("[{}] Request {} {} already finalized, outcome {} dropped", applyPoint,
                    request.getMethod(), request.getPath(), outcome);
            return;
        }
        if (outcome.isCompleted()) {
            reply.proceed();
        } else {
            reply.finish(outcome.toError());
        }
    }

    private boolean isStale() {
        return registry.getGeneration() != generation;
    }

    public ApplyPoint getApplyPoint() {
        return applyPoint;
    }
}
