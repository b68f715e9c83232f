package com.agentrelay.types.enums;

/**
 * Agent 运行时事件类型。
 */
public enum AgentEventTypeEnum {
    SYSTEM("system"),
    ASSISTANT("assistant"),
    USER("user"),
    RESULT("result"),
    UNKNOWN("unknown");

    private final String value;

    AgentEventTypeEnum(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static AgentEventTypeEnum fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (AgentEventTypeEnum type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
