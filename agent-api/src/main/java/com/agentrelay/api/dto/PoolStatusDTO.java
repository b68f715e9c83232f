package com.agentrelay.api.dto;

import lombok.Data;

/**
 * 会话池就绪状态。
 */
@Data
public class PoolStatusDTO {

    private boolean ready;
    private long uptimeMs;
    private int poolSize;
    private int available;
    private int inUse;
}
