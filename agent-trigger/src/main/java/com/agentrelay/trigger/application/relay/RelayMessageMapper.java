package com.agentrelay.trigger.application.relay;

import com.agentrelay.api.dto.RelayMessageDTO;
import com.agentrelay.domain.session.model.valobj.AgentEvent;
import com.agentrelay.types.enums.WireMessageTypeEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

/**
 * 中继线路消息映射器。
 */
@Component
public class RelayMessageMapper {

    private static final String DEFAULT_ERROR_MESSAGE = "Agent request failed";

    public RelayMessageDTO sessionCreated(String sessionKey) {
        RelayMessageDTO message = newMessage(WireMessageTypeEnum.SESSION_CREATED);
        message.setSessionKey(sessionKey);
        return message;
    }

    public RelayMessageDTO passthrough(AgentEvent event) {
        RelayMessageDTO message = newMessage(WireMessageTypeEnum.MESSAGE);
        message.setMessageType(event.getRawType());
        message.setData(event.getPayload());
        return message;
    }

    public RelayMessageDTO textChunk(String content) {
        RelayMessageDTO message = newMessage(WireMessageTypeEnum.TEXT_CHUNK);
        message.setContent(content);
        return message;
    }

    public RelayMessageDTO complete(String response, String sessionKey) {
        RelayMessageDTO message = newMessage(WireMessageTypeEnum.COMPLETE);
        message.setResponse(response == null ? "" : response);
        message.setSessionKey(sessionKey);
        return message;
    }

    public RelayMessageDTO error(String errorMessage) {
        RelayMessageDTO message = newMessage(WireMessageTypeEnum.ERROR);
        message.setMessage(StringUtils.defaultIfBlank(errorMessage, DEFAULT_ERROR_MESSAGE));
        return message;
    }

    private RelayMessageDTO newMessage(WireMessageTypeEnum type) {
        RelayMessageDTO message = new RelayMessageDTO();
        message.setType(type.getWireName());
        return message;
    }
}
