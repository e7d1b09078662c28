package com.policyframe.api.route;

import com.policyframe.api.exception.ErrorKind;
import com.policyframe.api.exception.MalformedDirectiveException;
import com.policyframe.api.policy.Policies;
import com.policyframe.api.policy.Policy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RouteDirective 测试")
class RouteDirectiveTest {

    @Test
    @DisplayName("字符串转换为按名称引用，策略转换为内联引用")
    void shouldConvertDeclaredElements() {
        Policy policy = Policies.allowAll();

        RouteDirective byName = RouteDirective.of("auth");
        RouteDirective inline = RouteDirective.of(policy);

        assertEquals(RouteDirective.byName("auth"), byName);
        assertSame(policy, ((RouteDirective.Inline) inline).getPolicy());
        assertSame(byName, RouteDirective.of(byName));
    }

    @Test
    @DisplayName("其它形态的元素被拒绝")
    void shouldRejectMalformedElements() {
        MalformedDirectiveException ex = assertThrows(MalformedDirectiveException.class, () -> RouteDirective.of(42));

        assertEquals(ErrorKind.MALFORMED_DIRECTIVE, ex.getKind());
        assertEquals(42, ex.getDirective());
        assertThrows(MalformedDirectiveException.class, () -> RouteDirective.of(null));
    }

    @Test
    @DisplayName("批量转换保持顺序，第一个非法元素即失败")
    void shouldConvertListInOrder() {
        Policy policy = Policies.allowAll();

        List<RouteDirective> directives = RouteDirective.listOf(Arrays.asList("a", policy, "b"));

        assertEquals(3, directives.size());
        assertEquals(RouteDirective.byName("a"), directives.get(0));
        assertInstanceOf(RouteDirective.Inline.class, directives.get(1));
        assertEquals(RouteDirective.byName("b"), directives.get(2));
        assertTrue(RouteDirective.listOf(null).isEmpty());
        assertThrows(MalformedDirectiveException.class,
                () -> RouteDirective.listOf(Arrays.asList("a", new Object(), "b")));
    }
}
