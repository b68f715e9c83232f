package com.agentrelay.trigger.application.relay;

import com.agentrelay.api.dto.RelayMessageDTO;

import java.io.IOException;

/**
 * 中继线路消息的输出端，与具体传输方式无关。
 */
@FunctionalInterface
public interface RelayMessageSink {

    /**
     * 输出一条线路消息。
     *
     * @throws IOException 传输已断开
     */
    void emit(RelayMessageDTO message) throws IOException;
}
