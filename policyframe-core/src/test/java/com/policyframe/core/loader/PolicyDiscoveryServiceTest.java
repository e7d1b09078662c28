package com.policyframe.core.loader;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.DuplicatePolicyException;
import com.policyframe.api.exception.InvalidApplyPointException;
import com.policyframe.api.exception.PolicyDefinitionException;
import com.policyframe.api.policy.Policy;
import com.policyframe.core.config.PolicyFrameConfig;
import com.policyframe.core.loader.fixture.AdminOnlyPolicy;
import com.policyframe.core.loader.fixture.AllowPolicy;
import com.policyframe.core.loader.fixture.NotAPolicy;
import com.policyframe.core.manager.PolicyManager;
import com.policyframe.core.support.RecordingHost;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PolicyDiscoveryService 测试")
class PolicyDiscoveryServiceTest {

    @TempDir
    Path policyHome;

    private PolicyManager manager;

    @BeforeEach
    void setUp() {
        manager = new PolicyManager(new RecordingHost(), PolicyFrameConfig.defaults());
    }

    private void manifest(String fileName, String content) throws IOException {
        Files.write(policyHome.resolve(fileName), content.getBytes(StandardCharsets.UTF_8));
    }

    private PolicyDiscoveryService discovery() {
        return new PolicyDiscoveryService(PolicyFrameConfig.builder()
                .policyHome(policyHome.toString())
                .build());
    }

    @Nested
    @DisplayName("清单解析")
    class ManifestTests {

        @Test
        @DisplayName("文件名即策略名，按文件名排序")
        void shouldNameByFileAndSort() throws IOException {
            manifest("zeta.yml", "class: " + AllowPolicy.class.getName());
            manifest("alpha.yaml", "class: " + AllowPolicy.class.getName());
            manifest("README.md", "not a manifest");

            List<PolicySource.Entry> entries = discovery().load();

            assertEquals(Arrays.asList("alpha", "zeta"),
                    entries.stream().map(PolicySource.Entry::getName).collect(Collectors.toList()));
            assertInstanceOf(AllowPolicy.class, entries.get(0).getPolicy());
        }

        @Test
        @DisplayName("清单中的挂载点优先于策略自身声明")
        void shouldOverrideApplyPointFromManifest() throws IOException {
            manifest("admin.yml", "class: " + AdminOnlyPolicy.class.getName() + "\napplyPoint: onRequest\n");
            manifest("own.yml", "class: " + AdminOnlyPolicy.class.getName() + "\n");

            List<PolicySource.Entry> entries = discovery().load();

            assertEquals("onRequest", entries.get(0).getPolicy().applyPoint());
            assertEquals("onPostAuth", entries.get(1).getPolicy().applyPoint());
        }

        @Test
        @DisplayName("applyPoint: false 表示只保留名称")
        void shouldMapFalseToDisabled() throws IOException {
            manifest("reserved.yml", "class: " + AllowPolicy.class.getName() + "\napplyPoint: false\n");

            Policy policy = discovery().load().get(0).getPolicy();

            assertEquals(Policy.DISABLED, policy.applyPoint());
        }

        @Test
        @DisplayName("显式的空值或空串同样只保留名称")
        void shouldMapExplicitEmptyToDisabled() throws IOException {
            manifest("blank.yml", "class: " + AllowPolicy.class.getName() + "\napplyPoint: \"\"\n");
            manifest("tilde.yml", "class: " + AllowPolicy.class.getName() + "\napplyPoint: ~\n");

            List<PolicySource.Entry> entries = discovery().load();

            assertEquals(Policy.DISABLED, entries.get(0).getPolicy().applyPoint());
            assertEquals(Policy.DISABLED, entries.get(1).getPolicy().applyPoint());
        }

        @Test
        @DisplayName("读取清单中的描述")
        void shouldReadDescription() throws IOException {
            manifest("admin.yml", "class: " + AdminOnlyPolicy.class.getName() + "\ndescription: only admins\n");
            manifest("plain.yml", "class: " + AllowPolicy.class.getName() + "\n");

            assertEquals("only admins", PolicyManifestLoader.parse(policyHome.resolve("admin.yml").toFile()).getDescription());
            assertNull(PolicyManifestLoader.parse(policyHome.resolve("plain.yml").toFile()).getDescription());
            assertFalse(PolicyManifestLoader.parse(policyHome.resolve("plain.yml").toFile()).isApplyPointDeclared());
        }

        @Test
        @DisplayName("缺少 class 的清单应报错")
        void shouldRejectManifestWithoutClass() throws IOException {
            manifest("broken.yml", "applyPoint: onRequest\n");

            assertThrows(PolicyDefinitionException.class, () -> discovery().load());
        }

        @Test
        @DisplayName("未实现 Policy 的类应报错")
        void shouldRejectNonPolicyClass() throws IOException {
            manifest("odd.yml", "class: " + NotAPolicy.class.getName());

            PolicyDefinitionException ex = assertThrows(PolicyDefinitionException.class, () -> discovery().load());
            assertTrue(ex.getMessage().contains(NotAPolicy.class.getName()));
        }

        @Test
        @DisplayName("找不到的类应报错")
        void shouldRejectUnknownClass() throws IOException {
            manifest("ghost.yml", "class: com.example.DoesNotExist");

            assertThrows(PolicyDefinitionException.class, () -> discovery().load());
        }

        @Test
        @DisplayName("目录不存在应报错")
        void shouldRejectMissingDirectory() {
            PolicyDiscoveryService service = new PolicyDiscoveryService(PolicyFrameConfig.builder()
                    .policyHome(policyHome.resolve("missing").toString())
                    .build());

            assertThrows(PolicyDefinitionException.class, service::load);
        }
    }

    @Nested
    @DisplayName("扫描并注册")
    class ScanAndLoadTests {

        @Test
        @DisplayName("扫描结果注册到各自挂载点")
        void shouldRegisterDiscoveredPolicies() throws IOException {
            manifest("admin.yml", "class: " + AdminOnlyPolicy.class.getName());
            manifest("open.yml", "class: " + AllowPolicy.class.getName());
            manifest("reserved.yml", "class: " + AllowPolicy.class.getName() + "\napplyPoint: false\n");

            discovery().scanAndLoad(manager);

            assertEquals(Set.of("admin", "open", "reserved"), manager.getPolicyNames());
            assertTrue(manager.getPolicies(ApplyPoint.ON_POST_AUTH).containsKey("admin"));
            assertTrue(manager.getPolicies(ApplyPoint.ON_PRE_HANDLER).containsKey("open"));
            assertTrue(manager.isDispatcherInstalled(ApplyPoint.ON_POST_AUTH));
            assertTrue(manager.isDispatcherInstalled(ApplyPoint.ON_PRE_HANDLER));
        }

        @Test
        @DisplayName("同名清单导致重复错误，之前的策略保留")
        void shouldFailOnDuplicateName() throws IOException {
            manifest("a.yaml", "class: " + AllowPolicy.class.getName());
            manifest("a.yml", "class: " + AllowPolicy.class.getName());

            assertThrows(DuplicatePolicyException.class, () -> discovery().scanAndLoad(manager));
            assertEquals(Set.of("a"), manager.getPolicyNames());
        }

        @Test
        @DisplayName("非法挂载点中止加载")
        void shouldFailOnInvalidApplyPoint() throws IOException {
            manifest("a.yml", "class: " + AllowPolicy.class.getName());
            manifest("b.yml", "class: " + AllowPolicy.class.getName() + "\napplyPoint: onBreakfast\n");
            manifest("c.yml", "class: " + AllowPolicy.class.getName());

            assertThrows(InvalidApplyPointException.class, () -> discovery().scanAndLoad(manager));
            assertEquals(Set.of("a"), manager.getPolicyNames());
        }

        @Test
        @DisplayName("显式空挂载点只保留名称，不安装分发器")
        void shouldReserveNameForExplicitEmptyApplyPoint() throws IOException {
            manifest("blank.yml", "class: " + AllowPolicy.class.getName() + "\napplyPoint: \"\"\n");
            manifest("tilde.yml", "class: " + AllowPolicy.class.getName() + "\napplyPoint: ~\n");

            discovery().scanAndLoad(manager);

            assertEquals(Set.of("blank", "tilde"), manager.getPolicyNames());
            assertTrue(manager.getPolicies(ApplyPoint.ON_PRE_HANDLER).isEmpty());
            assertFalse(manager.isDispatcherInstalled(ApplyPoint.ON_PRE_HANDLER));
        }

        @Test
        @DisplayName("后面的清单类不存在时，前面的策略已注册")
        void shouldKeepEarlierPoliciesWhenLaterClassIsMissing() throws IOException {
            manifest("a.yml", "class: " + AllowPolicy.class.getName());
            manifest("b.yml", "class: com.example.DoesNotExist");
            manifest("c.yml", "class: " + AllowPolicy.class.getName());

            assertThrows(PolicyDefinitionException.class, () -> discovery().scanAndLoad(manager));
            assertEquals(Set.of("a"), manager.getPolicyNames());
            assertTrue(manager.isDispatcherInstalled(ApplyPoint.ON_PRE_HANDLER));
        }

        @Test
        @DisplayName("关闭自动扫描或未配置目录时不做任何事")
        void shouldSkipWhenDisabled() throws IOException {
            manifest("a.yml", "class: " + AllowPolicy.class.getName());

            new PolicyDiscoveryService(PolicyFrameConfig.builder()
                    .policyHome(policyHome.toString())
                    .autoScan(false)
                    .build()).scanAndLoad(manager);
            new PolicyDiscoveryService(PolicyFrameConfig.defaults()).scanAndLoad(manager);

            assertTrue(manager.getPolicyNames().isEmpty());
        }
    }
}
