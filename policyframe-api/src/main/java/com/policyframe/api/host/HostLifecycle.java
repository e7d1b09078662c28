package com.policyframe.api.host;

import com.policyframe.api.ApplyPoint;

/**
 * 宿主生命周期扩展点
 * <p>
 * 宿主负责在请求到达每个挂载点时调用已注册的处理器。同一挂载点可以注册多个处理器，
 * 宿主按注册顺序依次调用。宿主不需要支持注销。
 */
public interface HostLifecycle {

    /**
     * 在挂载点上注册处理器
     */
    void ext(ApplyPoint applyPoint, StageHandler handler);
}
