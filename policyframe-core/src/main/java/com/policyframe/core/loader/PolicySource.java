package com.policyframe.core.loader;

import com.policyframe.api.policy.Policy;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 策略来源：按顺序产出 (名称, 策略) 对
 * <p>
 * 目录扫描、Spring Bean、手工列表都只是不同的来源实现。
 */
@FunctionalInterface
public interface PolicySource {

    List<Entry> load();

    @Value
    class Entry {
        String name;
        Policy policy;
    }

    static PolicySource of(List<Entry> entries) {
        List<Entry> copy = Collections.unmodifiableList(new ArrayList<>(entries));
        return () -> copy;
    }

    /**
     * 按 Map 的迭代顺序产出
     */
    static PolicySource of(Map<String, ? extends Policy> policies) {
        List<Entry> entries = new ArrayList<>(policies.size());
        policies.forEach((name, policy) -> entries.add(new Entry(name, policy)));
        return of(entries);
    }

    static PolicySource empty() {
        return Collections::emptyList;
    }
}
