package com.agentrelay.trigger.application.relay;

import com.agentrelay.types.enums.RelayOutcomeEnum;

/**
 * 单次中继请求的结果摘要。
 *
 * @param outcome 结束方式
 * @param sessionKey 会话最终的 key，未借到会话时为 null
 * @param response 累积的完整文本
 * @param emittedMessages 已输出的线路消息数
 */
public record RelayResult(RelayOutcomeEnum outcome, String sessionKey, String response, int emittedMessages) {

    public boolean isCompleted() {
        return outcome == RelayOutcomeEnum.COMPLETED;
    }
}
