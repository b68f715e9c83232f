package com.agentrelay.domain.session.model.valobj;

import com.agentrelay.types.enums.AgentEventTypeEnum;
import lombok.Builder;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 解析后的 Agent 运行时事件。
 */
@Getter
@Builder
public class AgentEvent {

    private static final String SUBTYPE_INIT = "init";

    /**
     * 事件类型
     */
    private final AgentEventTypeEnum type;

    /**
     * 原始 type 字段，未知类型时原样透传
     */
    private final String rawType;

    /**
     * 子类型，如 system/init、result/success
     */
    private final String subtype;

    /**
     * 运行时下发的会话 ID，可空
     */
    private final String sessionId;

    /**
     * assistant 事件中的文本块，按出现顺序
     */
    private final List<String> textBlocks;

    /**
     * 原始事件内容
     */
    private final Map<String, Object> payload;

    /**
     * 是否为携带权威会话 ID 的初始化事件。
     */
    public boolean isInit() {
        return type == AgentEventTypeEnum.SYSTEM
                && SUBTYPE_INIT.equals(subtype)
                && StringUtils.isNotBlank(sessionId);
    }

    /**
     * 是否为终态事件。
     */
    public boolean isTerminal() {
        return type == AgentEventTypeEnum.RESULT;
    }

    public List<String> getTextBlocks() {
        return textBlocks == null ? Collections.emptyList() : textBlocks;
    }

    public Map<String, Object> getPayload() {
        return payload == null ? Collections.emptyMap() : payload;
    }

    public String getRawType() {
        return StringUtils.defaultIfBlank(rawType, type == null ? AgentEventTypeEnum.UNKNOWN.getValue() : type.getValue());
    }
}
