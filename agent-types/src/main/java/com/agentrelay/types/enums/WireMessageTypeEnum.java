package com.agentrelay.types.enums;

import lombok.Getter;

/**
 * 中继输出的线路消息类型。
 */
@Getter
public enum WireMessageTypeEnum {
    SESSION_CREATED("session_created"),
    MESSAGE("message"),
    TEXT_CHUNK("text_chunk"),
    COMPLETE("complete"),
    ERROR("error");

    private final String wireName;

    WireMessageTypeEnum(String wireName) {
        this.wireName = wireName;
    }
}
