package com.agentrelay.domain.session.model.entity;

import com.agentrelay.domain.session.adapter.gateway.IAgentSessionHandle;
import com.agentrelay.types.common.Constants;
import lombok.Getter;

import java.util.UUID;

/**
 * 会话池条目。
 * <p>
 * 状态字段只由 {@link com.agentrelay.domain.session.service.AgentSessionPool} 在池锁内修改。
 * </p>
 *
 * @author agentrelay
 * @since 2026-10-19
 */
@Getter
public class PooledSessionEntity {

    /**
     * 会话句柄，空闲时归池所有，借出后归持有请求独占
     */
    private final IAgentSessionHandle handle;

    /**
     * 池中索引 key：先是占位 key，首轮对话后替换为运行时下发的权威会话 ID
     */
    private volatile String key;

    /**
     * 创建时间（毫秒）
     */
    private final long createdAt;

    /**
     * 最近一次借出或归还的时间（毫秒）
     */
    private volatile long lastUsedAt;

    /**
     * 是否被请求持有
     */
    private volatile boolean inUse;

    private PooledSessionEntity(IAgentSessionHandle handle, String key, long now) {
        this.handle = handle;
        this.key = key;
        this.createdAt = now;
        this.lastUsedAt = now;
        this.inUse = false;
    }

    /**
     * 以占位 key 创建空闲条目。
     */
    public static PooledSessionEntity prewarmed(IAgentSessionHandle handle, long now) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        return new PooledSessionEntity(handle, newPlaceholderKey(), now);
    }

    public static String newPlaceholderKey() {
        return Constants.PREWARM_KEY_PREFIX + UUID.randomUUID();
    }

    /**
     * 借出条目。
     */
    public void claim(long now) {
        if (inUse) {
            throw new IllegalStateException("Session already in use: " + key);
        }
        this.inUse = true;
        this.lastUsedAt = now;
    }

    /**
     * 归还条目。
     *
     * @return 条目原本被持有时返回 true；已空闲时返回 false 且不做任何修改
     */
    public boolean release(long now) {
        if (!inUse) {
            return false;
        }
        this.inUse = false;
        this.lastUsedAt = now;
        return true;
    }

    public void rekey(String newKey) {
        if (newKey == null || newKey.isBlank()) {
            throw new IllegalArgumentException("newKey cannot be blank");
        }
        this.key = newKey;
    }

    public long idleMillis(long now) {
        return Math.max(now - lastUsedAt, 0L);
    }

    public boolean isPlaceholderKey() {
        return key != null && key.startsWith(Constants.PREWARM_KEY_PREFIX);
    }
}
