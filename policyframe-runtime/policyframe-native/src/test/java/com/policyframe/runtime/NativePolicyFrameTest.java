package com.policyframe.runtime;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.AccessDeniedException;
import com.policyframe.api.exception.InvalidApplyPointException;
import com.policyframe.api.exception.MalformedDirectiveException;
import com.policyframe.api.exception.MissingPolicyException;
import com.policyframe.api.exception.PolicyExecutionException;
import com.policyframe.api.policy.Policies;
import com.policyframe.api.policy.Policy;
import com.policyframe.api.policy.PolicyDecision;
import com.policyframe.core.config.PolicyFrameConfig;
import com.policyframe.runtime.fixture.TokenPolicy;
import com.policyframe.runtime.host.NativeRequest;
import com.policyframe.runtime.host.NativeResponse;
import com.policyframe.runtime.host.NativeRoute;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NativePolicyFrame 端到端测试")
class NativePolicyFrameTest {

    private List<String> journal;
    private ScheduledExecutorService scheduler;

    @BeforeEach
    void setUp() {
        journal = Collections.synchronizedList(new ArrayList<>());
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private Policy recording(String id, PolicyDecision decision) {
        return request -> {
            journal.add(id);
            return decision.asStage();
        };
    }

    private Policy delayed(String id, PolicyDecision decision) {
        return request -> {
            CompletableFuture<PolicyDecision> future = new CompletableFuture<>();
            scheduler.schedule(() -> {
                journal.add(id);
                future.complete(decision);
            }, 20, TimeUnit.MILLISECONDS);
            return future;
        };
    }

    private static NativeResponse call(NativePolicyFrame frame, NativeRequest request) throws Exception {
        return frame.handle(request).get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("路由策略")
    class RouteTests {

        private NativePolicyFrame frame;

        @BeforeEach
        void setUp() {
            frame = NativePolicyFrame.start()
                    .register("A", recording("A", PolicyDecision.allow()))
                    .register("B", recording("B", PolicyDecision.deny("nope")))
                    .register("open", recording("open", PolicyDecision.allow()));
        }

        @Test
        @DisplayName("拒绝时返回 403 和原因，处理器不执行")
        void shouldDenyWithReason() throws Exception {
            frame.route(NativeRoute.get("/ab", request -> journal.add("handler")).policies("A", "B"));

            NativeResponse response = call(frame, NativeRequest.get("/ab"));

            assertEquals(403, response.getStatus());
            assertEquals("nope", ((AccessDeniedException) response.getError()).getReason());
            assertEquals(List.of("A", "B"), journal);
        }

        @Test
        @DisplayName("缺失策略返回 501，其它策略都不执行")
        void shouldReportMissingPolicy() throws Exception {
            frame.route(NativeRoute.get("/cab", request -> "ok").policies("C", "A", "B"));

            NativeResponse response = call(frame, NativeRequest.get("/cab"));

            assertEquals(501, response.getStatus());
            assertEquals("C", ((MissingPolicyException) response.getError()).getPolicyName());
            assertTrue(journal.isEmpty());
        }

        @Test
        @DisplayName("全部放行时执行处理器")
        void shouldRunHandlerWhenAllowed() throws Exception {
            frame.route(NativeRoute.get("/open", request -> "hello").policies("open", "A"));

            NativeResponse response = call(frame, NativeRequest.get("/open"));

            assertTrue(response.isSuccess());
            assertEquals("hello", response.getBody());
            assertEquals(List.of("open", "A"), journal);
        }

        @Test
        @DisplayName("未声明策略的路由不受影响")
        void shouldLeaveUndeclaredRoutesAlone() throws Exception {
            frame.route(NativeRoute.get("/free", request -> "free"));

            assertEquals("free", call(frame, NativeRequest.get("/free")).getBody());
            assertTrue(journal.isEmpty());
        }

        @Test
        @DisplayName("异步策略按声明顺序串行执行")
        void shouldRunAsyncPoliciesSequentially() throws Exception {
            frame.register("slow1", delayed("slow1", PolicyDecision.allow()))
                    .register("slow2", delayed("slow2", PolicyDecision.allow()))
                    .route(NativeRoute.get("/slow", request -> journal.add("handler")).policies("slow2", "A", "slow1"));

            NativeResponse response = call(frame, NativeRequest.get("/slow"));

            assertTrue(response.isSuccess());
            assertEquals(List.of("slow2", "A", "slow1", "handler"), journal);
        }

        @Test
        @DisplayName("策略返回空结果时以执行错误结束")
        void shouldFailOnNullDecision() throws Exception {
            frame.register("broken", request -> CompletableFuture.completedFuture(null))
                    .route(NativeRoute.get("/broken", request -> "never").policies("broken"));

            NativeResponse response = call(frame, NativeRequest.get("/broken"));

            assertEquals(500, response.getStatus());
            assertInstanceOf(PolicyExecutionException.class, response.getError());
        }

        @Test
        @DisplayName("策略自身的错误原样传递")
        void shouldPropagatePolicyError() throws Exception {
            IllegalStateException boom = new IllegalStateException("db down");
            frame.register("failing", request -> CompletableFuture.failedFuture(boom))
                    .route(NativeRoute.get("/failing", request -> "never").policies("failing"));

            NativeResponse response = call(frame, NativeRequest.get("/failing"));

            assertEquals(500, response.getStatus());
            assertSame(boom, response.getError());
        }

        @Test
        @DisplayName("后置挂载点的拒绝发生在处理器之后")
        void shouldDenyAfterHandler() throws Exception {
            frame.register("audit", Policies.at(ApplyPoint.ON_POST_HANDLER, recording("audit", PolicyDecision.deny())))
                    .route(NativeRoute.get("/audited", request -> journal.add("handler")).policies("audit"));

            NativeResponse response = call(frame, NativeRequest.get("/audited"));

            assertEquals(403, response.getStatus());
            assertEquals(List.of("handler", "audit"), journal);
        }
    }

    @Nested
    @DisplayName("内联策略")
    class InlineTests {

        @Test
        @DisplayName("内联策略在默认挂载点执行，即使该挂载点没有注册策略")
        void shouldRunInlineAtDefaultStage() throws Exception {
            NativePolicyFrame frame = NativePolicyFrame.start(PolicyFrameConfig.builder()
                    .defaultApplyPointName("onPostAuth")
                    .build());
            List<ApplyPoint> seenAt = Collections.synchronizedList(new ArrayList<>());
            Policy inline = request -> {
                seenAt.add(((NativeRequest) request).getCurrentApplyPoint());
                return PolicyDecision.allow().asStage();
            };

            frame.route(NativeRoute.get("/inline", request -> "ok").policies(inline));

            assertTrue(call(frame, NativeRequest.get("/inline")).isSuccess());
            assertEquals(List.of(ApplyPoint.ON_POST_AUTH), seenAt);
        }

        @Test
        @DisplayName("路由定义时拒绝非法引用")
        void shouldValidateDirectivesAtDefinition() {
            NativePolicyFrame frame = NativePolicyFrame.start();

            assertThrows(MalformedDirectiveException.class,
                    () -> frame.route(NativeRoute.get("/bad", request -> "x").policies("A", 42)));
            assertThrows(InvalidApplyPointException.class,
                    () -> frame.route(NativeRoute.get("/bad", request -> "x")
                            .policies(Policies.at("onLunch", Policies.allowAll()))));
            assertTrue(frame.getHost().getRoutes().isEmpty());
        }
    }

    @Nested
    @DisplayName("清单启动")
    class BootstrapTests {

        @TempDir
        Path policyHome;

        @Test
        @DisplayName("启动时扫描清单并注册")
        void shouldScanManifestsOnStart() throws Exception {
            Files.write(policyHome.resolve("token.yml"),
                    ("class: " + TokenPolicy.class.getName() + "\n").getBytes(StandardCharsets.UTF_8));

            NativePolicyFrame frame = NativePolicyFrame.start(PolicyFrameConfig.builder()
                    .policyHome(policyHome.toString())
                    .build());
            frame.route(NativeRoute.get("/me", request -> request.getAttribute("token")).policies("token"));

            assertTrue(frame.getPolicyManager().getPolicies(ApplyPoint.ON_PRE_AUTH).containsKey("token"));
            assertEquals(1, frame.getHost().getExtensionCount(ApplyPoint.ON_PRE_AUTH));

            NativeResponse denied = call(frame, NativeRequest.get("/me"));
            assertEquals(403, denied.getStatus());
            assertEquals("token required", denied.getBody());

            NativeResponse allowed = call(frame, NativeRequest.get("/me").header("x-token", "t-1"));
            assertEquals("t-1", allowed.getBody());
        }

        @Test
        @DisplayName("重置后所有请求原样放行")
        void shouldPassThroughAfterReset() throws Exception {
            NativePolicyFrame frame = NativePolicyFrame.start()
                    .register("B", recording("B", PolicyDecision.deny("nope")));
            frame.route(NativeRoute.get("/b", request -> "through").policies("B"));

            assertEquals(403, call(frame, NativeRequest.get("/b")).getStatus());

            frame.getPolicyManager().reset();

            assertTrue(frame.getPolicyManager().getPolicyNames().isEmpty());
            assertEquals("through", call(frame, NativeRequest.get("/b")).getBody());
        }
    }
}
