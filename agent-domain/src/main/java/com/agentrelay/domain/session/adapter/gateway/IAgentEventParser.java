package com.agentrelay.domain.session.adapter.gateway;

import com.agentrelay.domain.session.model.valobj.AgentEvent;

/**
 * 原始事件帧解析端口。
 */
public interface IAgentEventParser {

    /**
     * 解析一帧原始事件。
     *
     * @param frame 原始事件帧
     * @return 解析后的事件
     * @throws com.agentrelay.types.exception.AppException 帧无法解析时抛出，code 为 MALFORMED_EVENT
     */
    AgentEvent parse(String frame);
}
