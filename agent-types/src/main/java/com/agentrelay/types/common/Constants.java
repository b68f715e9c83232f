package com.agentrelay.types.common;

/**
 * 全局常量定义类。
 *
 * @author agentrelay
 * @since 2026-10-19
 */
public class Constants {

    /** 预热会话占位 key 前缀，收到运行时下发的会话 ID 后被替换 */
    public final static String PREWARM_KEY_PREFIX = "prewarm-";

    /** 逐行 JSON 流的媒体类型 */
    public final static String NDJSON_MEDIA_TYPE = "application/x-ndjson";

}
