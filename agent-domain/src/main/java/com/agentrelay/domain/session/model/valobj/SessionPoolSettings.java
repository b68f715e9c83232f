package com.agentrelay.domain.session.model.valobj;

/**
 * 会话池参数。
 *
 * @param targetSize 空闲会话目标数量
 * @param idleTimeoutMs 空闲淘汰阈值
 * @param maxSize 会话总数上限，0 表示不限制
 */
public record SessionPoolSettings(int targetSize, long idleTimeoutMs, int maxSize) {

    public SessionPoolSettings {
        if (targetSize < 0) {
            throw new IllegalArgumentException("targetSize must not be negative");
        }
        if (idleTimeoutMs <= 0L) {
            throw new IllegalArgumentException("idleTimeoutMs must be positive");
        }
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must not be negative");
        }
    }

    public boolean isBounded() {
        return maxSize > 0;
    }
}
