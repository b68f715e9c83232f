package com.agentrelay.domain.session.adapter.gateway;

import java.util.concurrent.TimeUnit;

/**
 * 会话事件流：按产生顺序逐帧读取运行时事件。
 */
public interface IAgentEventStream extends AutoCloseable {

    /**
     * 等待下一帧原始事件。
     *
     * @param timeout 最长等待时间
     * @param unit 时间单位
     * @return 原始事件帧；等待超时返回 null
     * @throws InterruptedException 等待被中断
     * @throws com.agentrelay.types.exception.AppException 上游失败或流在终态事件前结束，code 为 CAPABILITY_UNAVAILABLE
     */
    String poll(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * 停止消费。不关闭句柄本身。
     */
    @Override
    void close();
}
