package com.policyframe.api.policy;

/**
 * 回调式完成信号
 * <p>
 * 每次策略调用应当只发出一次信号；多余的信号会被忽略。
 */
@FunctionalInterface
public interface PolicyCallback {

    /**
     * @param error       策略内部错误，非 null 时忽略其余参数
     * @param canContinue 是否放行
     * @param message     拒绝原因
     */
    void done(Throwable error, boolean canContinue, String message);

    default void allow() {
        done(null, true, null);
    }

    default void deny(String message) {
        done(null, false, message);
    }

    default void fail(Throwable error) {
        done(error, false, null);
    }
}
