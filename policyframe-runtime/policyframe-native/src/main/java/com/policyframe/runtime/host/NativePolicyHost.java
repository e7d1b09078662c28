package com.policyframe.runtime.host;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.InvalidArgumentException;
import com.policyframe.api.host.HostLifecycle;
import com.policyframe.api.host.StageHandler;
import com.policyframe.api.host.StageReply;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 进程内参考宿主
 * <p>
 * 请求依次经过：onRequest, onPreAuth, onPostAuth, onPreHandler, 业务处理器, onPostHandler, onPreResponse。
 * 每个挂载点上的扩展按安装顺序执行，必须 (可以异步地) 调用一次 proceed 或 finish。
 * 未匹配的路由直接返回 404，不经过任何挂载点。
 */
@Slf4j
public class NativePolicyHost implements HostLifecycle {

    private final Map<ApplyPoint, List<StageHandler>> extensions = new EnumMap<>(ApplyPoint.class);
    private final Map<String, NativeRoute> routes = new ConcurrentHashMap<>();

    public NativePolicyHost() {
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

    /**
     * 添加路由，同一方法和路径只能定义一次
     */
    public void addRoute(NativeRoute route) {
        NativeRoute existing = routes.putIfAbsent(route.key(), route);
        if (existing != null) {
            throw new InvalidArgumentException("route", "Route already defined: " + route);
        }
        log.info("Route added: {}", route);
    }

    public int getExtensionCount(ApplyPoint applyPoint) {
        return extensions.get(applyPoint).size();
    }

    public List<NativeRoute> getRoutes() {
        return Collections.unmodifiableList(new ArrayList<>(routes.values()));
    }

    /**
     * 处理请求，响应在最后一个阶段完成或请求被提前结束时完成
     */
    public CompletableFuture<NativeResponse> handle(NativeRequest request) {
        NativeRoute route = routes.get(NativeRoute.key(request.getMethod(), request.getPath()));
        if (route == null) {
            log.debug("No route for {} {}", request.getMethod(), request.getPath());
            return CompletableFuture.completedFuture(NativeResponse.notFound(request.getMethod(), request.getPath()));
        }
        request.bindRoute(route);
        Exchange exchange = new Exchange(request, route, snapshotSteps(route));
        exchange.advance(0);
        return exchange.response;
    }

    private List<Step> snapshotSteps(NativeRoute route) {
        List<Step> steps = new ArrayList<>();
        for (ApplyPoint point : ApplyPoint.ordered()) {
            for (StageHandler handler : extensions.get(point)) {
                steps.add(new Step(point, handler, null));
            }
            if (point == ApplyPoint.ON_PRE_HANDLER) {
                steps.add(new Step(null, null, route.getHandler()));
            }
        }
        return steps;
    }

    private record Step(ApplyPoint applyPoint, StageHandler stageHandler, NativeHandler routeHandler) {
    }

    /**
     * 单个请求的执行过程
     */
    private static final class Exchange {

        private final NativeRequest request;
        private final NativeRoute route;
        private final List<Step> steps;
        private final CompletableFuture<NativeResponse> response = new CompletableFuture<>();
        private volatile Object body;

        private Exchange(NativeRequest request, NativeRoute route, List<Step> steps) {
            this.request = request;
            this.route = route;
            this.steps = steps;
        }

        private void advance(int index) {
            if (response.isDone()) {
                return;
            }
            if (index >= steps.size()) {
                response.complete(NativeResponse.ok(body));
                return;
            }

            Step step = steps.get(index);
            request.enter(step.applyPoint());
            if (step.routeHandler() != null) {
                invokeRoute(step.routeHandler(), index);
                return;
            }

            ExchangeReply reply = new ExchangeReply(this, step.applyPoint(), index);
            try {
                step.stageHandler().handle(request, reply);
            } catch (Throwable e) {
                log.error("Extension at {} failed for {}", step.applyPoint(), route, e);
                reply.finish(e);
            }
        }

        private void invokeRoute(NativeHandler handler, int index) {
            try {
                body = handler.handle(request);
            } catch (Exception e) {
                log.error("Route handler failed for {}", route, e);
                fail(e);
                return;
            }
            advance(index + 1);
        }

        private void fail(Throwable error) {
            if (response.complete(NativeResponse.failed(error))) {
                log.debug("Request {} finished with {}", route, error.toString());
            }
        }
    }

    /**
     * 每个扩展调用对应一个应答，只接受第一次信号
     */
    private static final class ExchangeReply implements StageReply {

        private final Exchange exchange;
        private final ApplyPoint applyPoint;
        private final int index;
        private final AtomicBoolean signalled = new AtomicBoolean(false);

        private ExchangeReply(Exchange exchange, ApplyPoint applyPoint, int index) {
            this.exchange = exchange;
            this.applyPoint = applyPoint;
            this.index = index;
        }

        @Override
        public void proceed() {
            if (accept("proceed")) {
                exchange.advance(index + 1);
            }
        }

        @Override
        public void finish(Throwable error) {
            if (accept("finish")) {
                exchange.fail(error != null
                        ? error
                        : new IllegalStateException("Extension at " + applyPoint + " finished without an error"));
            }
        }

        @Override
        public boolean isFinalized() {
            return exchange.response.isDone();
        }

        private boolean accept(String signal) {
            if (signalled.compareAndSet(false, true)) {
                return true;
            }
            log.warn("Extension at {} replied more than once ({} ignored) for {}", applyPoint, signal, exchange.route);
            return false;
        }
    }
}
