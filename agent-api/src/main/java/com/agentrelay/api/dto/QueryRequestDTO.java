package com.agentrelay.api.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.Data;

/**
 * 流式查询请求。
 */
@Data
public class QueryRequestDTO {

    /** 用户输入，必填 */
    @JsonAlias({"query"})
    private String prompt;

    /** 上一轮返回的权威会话 key，可空 */
    @JsonAlias({"sessionId"})
    private String sessionKey;
}
