package com.policyframe.core.executor;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.PolicyExecutionException;
import com.policyframe.api.policy.PolicyDecision;
import com.policyframe.api.policy.PolicyRequest;
import com.policyframe.core.resolver.ResolvedPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 单个请求在单个挂载点上的策略链执行
 * <p>
 * 同一时刻只有一个策略在执行；前一个策略放行后才启动下一个。
 * 结果 future 只完成一次，先到达的终态生效。
 */
@Slf4j
public class PolicyExecution {

    private final ApplyPoint applyPoint;
    private final List<ResolvedPolicy> policies;
    private final PolicyRequest request;

    private final CompletableFuture<ExecutionOutcome> outcome = new CompletableFuture<>();
    private final List<String> started = new CopyOnWriteArrayList<>();

    private volatile ExecutionState state = ExecutionState.PENDING;
    private volatile int index = -1;

    PolicyExecution(ApplyPoint applyPoint, List<ResolvedPolicy> policies, PolicyRequest request) {
        this.applyPoint = applyPoint;
        this.policies = policies;
        this.request = request;
    }

    void start() {
        if (policies.isEmpty()) {
            terminate(ExecutionOutcome.completed());
            return;
        }
        runFrom(0);
    }

    /**
     * 从第 start 个策略开始执行
     * <p>
     * 同步完成的策略在本循环内继续，不递归；异步完成的策略由完成线程重新进入。
     */
    private void runFrom(int start) {
        for (int i = start; i < policies.size(); i++) {
            ResolvedPolicy current = policies.get(i);
            index = i;
            state = ExecutionState.RUNNING;
            started.add(current.label());
            log.debug("[{}] Running policy {} ({}/{})", applyPoint, current.label(), i + 1, policies.size());

            CompletionStage<PolicyDecision> signal;
            try {
                signal = current.getPolicy().check(request);
            } catch (Throwable e) {
                terminate(ExecutionOutcome.errored(current.label(), e));
                return;
            }
            if (signal == null) {
                terminate(ExecutionOutcome.errored(current.label(),
                        new PolicyExecutionException(current.label(), "Policy returned no completion stage: " + current.label())));
                return;
            }

            Step step = new Step(i, current);
            signal.handle((decision, error) -> {
                        step.onSignal(decision, error);
                        return null;
                    })
                    .exceptionally(e -> {
                        terminate(ExecutionOutcome.errored(current.label(), unwrap(e)));
                        return null;
                    });
            if (!step.continueInline()) {
                return;
            }
            state = ExecutionState.CONTINUED;
        }
        terminate(ExecutionOutcome.completed());
    }

    /**
     * 单个策略的完成信号
     */
    private final class Step {

        private static final int REGISTERING = 0;
        private static final int ALLOWED_INLINE = 1;
        private static final int DETACHED = 2;

        private final int position;
        private final ResolvedPolicy policy;
        private final AtomicBoolean signalled = new AtomicBoolean(false);
        private final AtomicInteger phase = new AtomicInteger(REGISTERING);

        private Step(int position, ResolvedPolicy policy) {
            this.position = position;
            this.policy = policy;
        }

        private void onSignal(PolicyDecision decision, Throwable error) {
            if (!signalled.compareAndSet(false, true)) {
                log.warn("[{}] Policy {} signalled completion more than once, ignored", applyPoint, policy.label());
                return;
            }
            if (error != null) {
                terminate(ExecutionOutcome.errored(policy.label(), unwrap(error)));
                return;
            }
            if (decision == null) {
                terminate(ExecutionOutcome.errored(policy.label(),
                        new PolicyExecutionException(policy.label(), "Policy completed without a decision: " + policy.label())));
                return;
            }
            if (!decision.isAllowed()) {
                terminate(ExecutionOutcome.denied(policy.label(), decision.getReason()));
                return;
            }
            // 注册回调期间已同步放行：交回 runFrom 的循环继续
            if (phase.compareAndSet(REGISTERING, ALLOWED_INLINE)) {
                return;
            }
            state = ExecutionState.CONTINUED;
            runFrom(position + 1);
        }

        /**
         * @return 策略已同步放行，调用方应继续下一个策略
         */
        private boolean continueInline() {
            return !phase.compareAndSet(REGISTERING, DETACHED);
        }
    }

    private void terminate(ExecutionOutcome result) {
        if (!outcome.complete(result)) {
            log.warn("[{}] Execution already finished, dropping outcome {}", applyPoint, result);
            return;
        }
        state = result.getState();
        switch (result.getState()) {
            case DENIED:
                log.warn("[{}] Policy {} denied {} {}: {}", applyPoint, result.getDecidedBy(),
                        request.getMethod(), request.getPath(), result.getReason());
                break;
            case ERRORED:
                log.error("[{}] Policy {} failed for {} {}", applyPoint, result.getDecidedBy(),
                        request.getMethod(), request.getPath(), result.getError());
                break;
            default:
                log.debug("[{}] All {} policies passed", applyPoint, policies.size());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * 最终结果，只完成一次，不会异常完成
     */
    public CompletableFuture<ExecutionOutcome> getOutcome() {
        return outcome;
    }

    public ExecutionState getState() {
        return state;
    }

    /**
     * 当前 (或最后) 执行的策略下标，尚未开始时为 -1
     */
    public int getIndex() {
        return index;
    }

    /**
     * 已启动的策略，按启动顺序
     */
    public List<String> getStartedPolicies() {
        return Collections.unmodifiableList(started);
    }

    public ApplyPoint getApplyPoint() {
        return applyPoint;
    }
}
