package com.policyframe.core.registry;

import com.policyframe.api.ApplyPoint;
import com.policyframe.api.exception.DuplicatePolicyException;
import com.policyframe.api.policy.Policy;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 策略注册表
 * <p>
 * 两阶段使用：加载阶段单线程写入，服务阶段并发只读。
 * 名称在整个注册表内唯一，每个名称最多出现在一个挂载点下。
 */
@Slf4j
public class PolicyRegistry {

    // 全部已占用的名称 (包括未绑定挂载点的)
    private final Map<String, RegisteredPolicy> names = new ConcurrentHashMap<>();

    private final Map<ApplyPoint, Map<String, Policy>> byApplyPoint = new EnumMap<>(ApplyPoint.class);

    // 每个挂载点只安装一次分发器，重置前不会复位
    private final Map<ApplyPoint, AtomicBoolean> dispatcherInstalled = new EnumMap<>(ApplyPoint.class);

    // 每次重置递增，用于识别重置前安装的分发器
    private final AtomicLong generation = new AtomicLong();

    public PolicyRegistry() {
        for (ApplyPoint point : ApplyPoint.ordered()) {
            byApplyPoint.put(point, new ConcurrentHashMap<>());
            dispatcherInstalled.put(point, new AtomicBoolean(false));
        }
    }

    /**
     * 添加策略
     *
     * @param applyPoint 生效挂载点，null 表示只占用名称
     * @throws DuplicatePolicyException 名称已被占用，注册表保持不变
     */
    public synchronized void add(String name, ApplyPoint applyPoint, Policy policy) {
        RegisteredPolicy entry = new RegisteredPolicy(name, applyPoint, policy);
        if (names.putIfAbsent(name, entry) != null) {
            throw new DuplicatePolicyException(name);
        }
        if (applyPoint != null) {
            byApplyPoint.get(applyPoint).put(name, policy);
        }
    }

    public boolean contains(String name) {
        return name != null && names.containsKey(name);
    }

    /**
     * 查询名称登记信息，未注册返回 null
     */
    public RegisteredPolicy lookup(String name) {
        return name == null ? null : names.get(name);
    }

    /**
     * 获取绑定在指定挂载点上的策略，不存在返回 null
     */
    public Policy get(ApplyPoint applyPoint, String name) {
        return byApplyPoint.get(applyPoint).get(name);
    }

    /**
     * 标记分发器已安装
     *
     * @return 仅在第一次标记时返回 true
     */
    public boolean markDispatcherInstalled(ApplyPoint applyPoint) {
        return dispatcherInstalled.get(applyPoint).compareAndSet(false, true);
    }

    public boolean isDispatcherInstalled(ApplyPoint applyPoint) {
        return dispatcherInstalled.get(applyPoint).get();
    }

    public long getGeneration() {
        return generation.get();
    }

    public Set<String> getNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(names.keySet()));
    }

    public Map<String, Policy> getPolicies(ApplyPoint applyPoint) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(byApplyPoint.get(applyPoint)));
    }

    public int size() {
        return names.size();
    }

    /**
     * 清空全部状态
     */
    public synchronized void clear() {
        names.clear();
        byApplyPoint.values().forEach(Map::clear);
        dispatcherInstalled.values().forEach(flag -> flag.set(false));
        long next = generation.incrementAndGet();
        log.debug("Policy registry cleared, generation={}", next);
    }
}
