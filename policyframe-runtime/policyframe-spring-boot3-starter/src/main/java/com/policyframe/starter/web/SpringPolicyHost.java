package com.policyframe.starter.web;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.InvalidArgumentException;
import com.policyframe.api.exception.PolicyExecutionException;
import com.policyframe.api.host.HostLifecycle;
import com.policyframe.api.host.StageHandler;
import com.policyframe.api.host.StageReply;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Servlet 宿主
 * <p>
 * 由 {@link PolicyWebFilter} 在请求线程上驱动：逐个执行挂载点扩展并等待其应答。
 */
@Slf4j
public class SpringPolicyHost implements HostLifecycle {

    private final Map<ApplyPoint, List<StageHandler>> extensions = new EnumMap<>(ApplyPoint.class);
    private final Duration stageTimeout;

    public SpringPolicyHost(Duration stageTimeout) {
        if (stageTimeout == null || stageTimeout.isNegative() || stageTimeout.isZero()) {
            throw new InvalidArgumentException("stageTimeout", "Stage timeout must be positive: " + stageTimeout);
        }
        this.stageTimeout = stageTimeout;
        for (ApplyPoint point : ApplyPoint.ordered()) {
            extensions.put(point, new CopyOnWriteArrayList<>());
        }
    }

    @Override
    public void ext(ApplyPoint applyPoint, StageHandler handler) {
        if (applyPoint == null || handler == null) {
            throw new InvalidArgumentException("Extension needs both applyPoint and handler");
        }
        extensions.get(applyPoint).add(handler);
        log.debug("Extension installed at {}", applyPoint);
    }

    public int getExtensionCount(ApplyPoint applyPoint) {
        return extensions.get(applyPoint).size();
    }

    /**
     * 按顺序执行给定挂载点上的扩展，阻塞直到全部放行或请求被结束
     *
     * @return 结束请求的错误，全部放行时为 null
     */
    public Throwable runStages(List<ApplyPoint> applyPoints, SpringPolicyRequest request) {
        for (ApplyPoint point : applyPoints) {
            for (StageHandler handler : extensions.get(point)) {
                Signal reply = new Signal(point, request);
                try {
                    handler.handle(request, reply);
                } catch (Exception e) {
                    log.error("Extension at {} failed for {} {}", point, request.getMethod(), request.getPath(), e);
                    reply.finish(e);
                }
                Throwable error = reply.await(stageTimeout);
                if (error != null) {
                    return error;
                }
            }
        }
        return null;
    }

    private static final class Signal implements StageReply {

        private final ApplyPoint applyPoint;
        private final SpringPolicyRequest request;
        // 完成值为 null 表示放行
        private final CompletableFuture<Throwable> result = new CompletableFuture<>();

        private Signal(ApplyPoint applyPoint, SpringPolicyRequest request) {
            this.applyPoint = applyPoint;
            this.request = request;
        }

        @Override
        public void proceed() {
            if (!result.complete(null)) {
                log.warn("Extension at {} replied more than once (proceed ignored) for {} {}",
                        applyPoint, request.getMethod(), request.getPath());
            }
        }

        @Override
        public void finish(Throwable error) {
            Throwable cause = error != null
                    ? error
                    : new IllegalStateException("Extension at " + applyPoint + " finished without an error");
            if (result.complete(cause)) {
                request.markFinalized();
            } else {
                log.warn("Extension at {} replied more than once (finish ignored) for {} {}",
                        applyPoint, request.getMethod(), request.getPath());
            }
        }

        @Override
        public boolean isFinalized() {
            return request.isFinalized();
        }

        private Throwable await(Duration timeout) {
            try {
                return result.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                request.markFinalized();
                log.warn("Stage {} timed out after {} for {} {}", applyPoint, timeout,
                        request.getMethod(), request.getPath());
                return new PolicyExecutionException(applyPoint.getName(),
                        "Stage " + applyPoint + " did not complete within " + timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                request.markFinalized();
                return new PolicyExecutionException(applyPoint.getName(),
                        "Interrupted while waiting for stage " + applyPoint, e);
            } catch (ExecutionException e) {
                request.markFinalized();
                return e.getCause();
            }
        }
    }
}
