package com.agentrelay.types.enums;

import lombok.Getter;

/**
 * 统一响应码枚举。
 * <p>
 * 00xx 为通用响应码，01xx 为会话池与流中继专用响应码。
 * </p>
 *
 * @author agentrelay
 * @since 2026-10-19
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** Agent 运行时不可用：会话创建或消息发送失败 */
    CAPABILITY_UNAVAILABLE("0100", "Agent 运行时不可用"),

    /** 单个事件帧无法解析 */
    MALFORMED_EVENT("0101", "事件格式错误"),

    /** 请求超过硬超时 */
    REQUEST_TIMEOUT("0102", "请求超时");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
