package com.agentrelay.domain.session.adapter.gateway;

/**
 * Agent 运行时端口：创建新的会话句柄。
 * <p>
 * 创建可能很慢（建立连接、加载运行时），调用方不得在持有会话池锁时调用。
 * </p>
 */
public interface IAgentRuntimeGateway {

    /**
     * 创建一个尚未发送任何消息的会话句柄。
     *
     * @return 会话句柄
     * @throws com.agentrelay.types.exception.AppException 运行时不可用时抛出，code 为 CAPABILITY_UNAVAILABLE
     */
    IAgentSessionHandle openSession();
}
