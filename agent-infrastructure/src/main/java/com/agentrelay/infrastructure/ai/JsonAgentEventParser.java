package com.agentrelay.infrastructure.ai;

import com.agentrelay.domain.session.adapter.gateway.IAgentEventParser;
import com.agentrelay.domain.session.model.valobj.AgentEvent;
import com.agentrelay.infrastructure.util.JsonCodec;
import com.agentrelay.types.enums.AgentEventTypeEnum;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 将运行时 JSON 事件帧解析为 {@link AgentEvent}。
 */
@Component
public class JsonAgentEventParser implements IAgentEventParser {

    private final JsonCodec jsonCodec;

    public JsonAgentEventParser(JsonCodec jsonCodec) {
        this.jsonCodec = jsonCodec;
    }

    @Override
    public AgentEvent parse(String frame) {
        if (StringUtils.isBlank(frame)) {
            throw new AppException(ResponseCode.MALFORMED_EVENT, "Empty agent event frame");
        }
        Map<String, Object> payload;
        try {
            payload = jsonCodec.readMap(frame);
        } catch (AppException ex) {
            throw new AppException(ResponseCode.MALFORMED_EVENT, "Malformed agent event: " + StringUtils.abbreviate(frame, 120), ex);
        }
        if (payload == null) {
            throw new AppException(ResponseCode.MALFORMED_EVENT, "Malformed agent event: " + StringUtils.abbreviate(frame, 120));
        }
        String rawType = stringValue(payload.get("type"));
        if (StringUtils.isBlank(rawType)) {
            throw new AppException(ResponseCode.MALFORMED_EVENT, "Agent event has no type");
        }
        AgentEventTypeEnum type = AgentEventTypeEnum.fromValue(rawType);
        String sessionId = stringValue(payload.get("session_id"));
        if (StringUtils.isBlank(sessionId)) {
            sessionId = stringValue(payload.get("sessionId"));
        }
        return AgentEvent.builder()
                .type(type)
                .rawType(rawType)
                .subtype(stringValue(payload.get("subtype")))
                .sessionId(sessionId)
                .textBlocks(type == AgentEventTypeEnum.ASSISTANT ? resolveTextBlocks(payload) : Collections.emptyList())
                .payload(payload)
                .build();
    }

    private List<String> resolveTextBlocks(Map<String, Object> payload) {
        Object message = payload.get("message");
        if (!(message instanceof Map<?, ?> messageMap)) {
            return Collections.emptyList();
        }
        Object content = messageMap.get("content");
        if (content instanceof String text) {
            return StringUtils.isEmpty(text) ? Collections.emptyList() : List.of(text);
        }
        if (!(content instanceof List<?> blocks)) {
            return Collections.emptyList();
        }
        List<String> texts = new ArrayList<>();
        for (Object block : blocks) {
            if (!(block instanceof Map<?, ?> blockMap)) {
                continue;
            }
            if (!"text".equals(blockMap.get("type"))) {
                continue;
            }
            Object text = blockMap.get("text");
            if (text instanceof String value && !value.isEmpty()) {
                texts.add(value);
            }
        }
        return texts;
    }

    private String stringValue(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
