package com.policyframe.api.host;

/**
 * 宿主交给处理器的应答工具
 */
public interface StageReply {

    /**
     * 继续生命周期的下一个阶段
     */
    void proceed();

    /**
     * 以错误结束请求
     * <p>
     * {@link com.policyframe.api.exception.PolicyFrameException} 携带建议的状态码，
     * 其余异常由宿主按内部错误处理。
     */
    void finish(Throwable error);

    /**
     * 请求是否已经结束 (可能由其它路径结束)
     */
    boolean isFinalized();
}
