package com.agentrelay.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Data;

import java.util.Map;

/**
 * 中继线路消息，每条序列化为 NDJSON 的一行。
 * <p>
 * 按 type 使用不同字段：
 * <ul>
 *   <li>session_created：sessionKey</li>
 *   <li>message：messageType、data（原始事件透传）</li>
 *   <li>text_chunk：content</li>
 *   <li>complete：response、sessionKey</li>
 *   <li>error：message</li>
 * </ul>
 * </p>
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RelayMessageDTO {

    private String type;
    private String sessionKey;
    private String messageType;
    private Map<String, Object> data;
    private String content;
    private String response;
    private String message;
}
