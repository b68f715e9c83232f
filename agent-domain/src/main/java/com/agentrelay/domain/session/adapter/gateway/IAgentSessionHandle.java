package com.agentrelay.domain.session.adapter.gateway;

/**
 * 会话句柄：与 Agent 运行时中一个会话的长连接。
 * <p>
 * 同一时刻只会被一个请求持有，实现无需支持并发的 send/stream 调用。
 * </p>
 */
public interface IAgentSessionHandle {

    /**
     * 本地句柄标识，仅用于日志。
     */
    String getHandleId();

    /**
     * 打开一个新的事件流。必须在 {@link #send(String)} 之前调用，
     * 否则 send 之后、开始消费之前产生的事件可能丢失。
     *
     * @return 事件流
     */
    IAgentEventStream stream();

    /**
     * 向会话发送一条用户输入。
     *
     * @param prompt 用户输入
     * @throws com.agentrelay.types.exception.AppException 发送失败时抛出，code 为 CAPABILITY_UNAVAILABLE
     */
    void send(String prompt);

    /**
     * 关闭句柄并释放运行时资源。仅在空闲淘汰或进程退出时调用。
     */
    void close();
}
