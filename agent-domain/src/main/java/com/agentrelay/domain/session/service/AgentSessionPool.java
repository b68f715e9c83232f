package com.agentrelay.domain.session.service;

import com.agentrelay.domain.session.adapter.gateway.IAgentRuntimeGateway;
import com.agentrelay.domain.session.adapter.gateway.IAgentSessionHandle;
import com.agentrelay.domain.session.model.entity.PooledSessionEntity;
import com.agentrelay.domain.session.model.valobj.SessionPoolSettings;
import com.agentrelay.domain.session.model.valobj.SessionPoolSnapshot;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Agent 会话池：会话池映射的唯一修改者。
 * <p>
 * 借用、归还、重新索引、淘汰与插入都在同一把池锁内完成，外部无法拿到原始映射。
 * 句柄创建（按需创建与后台补足）在锁外进行，只有插入映射这一步持锁。
 * 空闲条目的选择顺序不做保证。
 * </p>
 */
@Slf4j
public class AgentSessionPool {

    private final IAgentRuntimeGateway runtimeGateway;
    private final SessionPoolSettings settings;
    private final Executor prewarmExecutor;
    private final Clock clock;

    private final Object monitor = new Object();
    private final Map<String, PooledSessionEntity> entries = new HashMap<>();

    /** 正在后台补足的条目数，受 monitor 保护 */
    private int pendingPrewarms;

    /** 正在创建（按需 + 补足）的条目数，受 monitor 保护，用于容量上限 */
    private int pendingCreations;

    /** 受 monitor 保护 */
    private boolean shutdown;

    public AgentSessionPool(IAgentRuntimeGateway runtimeGateway,
                            SessionPoolSettings settings,
                            Executor prewarmExecutor,
                            Clock clock) {
        if (runtimeGateway == null || settings == null || prewarmExecutor == null || clock == null) {
            throw new IllegalArgumentException("AgentSessionPool dependencies cannot be null");
        }
        this.runtimeGateway = runtimeGateway;
        this.settings = settings;
        this.prewarmExecutor = prewarmExecutor;
        this.clock = clock;
    }

    /**
     * 借用一个会话。
     * <p>
     * 优先复用 preferredKey 对应的空闲条目以保留会话上下文；否则借出任意空闲条目；
     * 都没有时同步创建新句柄并以借出状态插入池中。
     * </p>
     *
     * @param preferredKey 调用方上一轮拿到的会话 key，可空
     * @return 已借出的条目
     * @throws AppException 按需创建失败或达到容量上限，code 为 CAPABILITY_UNAVAILABLE
     */
    public PooledSessionEntity acquire(String preferredKey) {
        synchronized (monitor) {
            ensureOpen();
            PooledSessionEntity claimed = claimFree(preferredKey);
            if (claimed != null) {
                return claimed;
            }
            if (settings.isBounded() && entries.size() + pendingCreations >= settings.maxSize()) {
                log.warn("SESSION_POOL_EXHAUSTED size={}, pending={}, maxSize={}",
                        entries.size(), pendingCreations, settings.maxSize());
                throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE,
                        "Session pool exhausted: maxSize=" + settings.maxSize());
            }
            pendingCreations++;
        }

        log.info("SESSION_POOL_NO_FREE_SESSION preferredKey={}, creating on demand", preferredKey);
        long startMs = clock.millis();
        IAgentSessionHandle handle;
        try {
            handle = openHandle();
        } catch (AppException ex) {
            synchronized (monitor) {
                pendingCreations--;
            }
            throw ex;
        }

        long now = clock.millis();
        PooledSessionEntity entry = PooledSessionEntity.prewarmed(handle, now);
        entry.claim(now);
        boolean inserted;
        int size;
        synchronized (monitor) {
            pendingCreations--;
            inserted = !shutdown;
            if (inserted) {
                entries.put(entry.getKey(), entry);
            }
            size = entries.size();
        }
        if (!inserted) {
            closeQuietly(entry, "shutdown");
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "Session pool is shut down");
        }
        log.info("SESSION_POOL_ON_DEMAND_CREATED key={}, handleId={}, costMs={}, size={}",
                entry.getKey(), handle.getHandleId(), now - startMs, size);
        return entry;
    }

    /**
     * 归还会话。对已空闲的条目重复归还不产生任何效果。
     */
    public void release(PooledSessionEntity entry) {
        if (entry == null) {
            return;
        }
        synchronized (monitor) {
            if (!entry.release(clock.millis())) {
                log.debug("SESSION_POOL_RELEASE_IGNORED key={}, already free", entry.getKey());
                return;
            }
        }
        log.info("SESSION_POOL_RELEASED key={}", entry.getKey());
    }

    /**
     * 将条目从当前 key 原子地移到 newKey。
     * <p>
     * newKey 与当前 key 相同或为空时不做任何修改。若 newKey 已被另一条目占用，
     * 被占用的条目改挂到新的占位 key 下，保证不丢失任何句柄。
     * </p>
     */
    public void rekey(PooledSessionEntity entry, String newKey) {
        if (entry == null || StringUtils.isBlank(newKey)) {
            return;
        }
        String oldKey;
        synchronized (monitor) {
            oldKey = entry.getKey();
            if (newKey.equals(oldKey)) {
                return;
            }
            if (shutdown) {
                entry.rekey(newKey);
                return;
            }
            if (entries.get(oldKey) == entry) {
                entries.remove(oldKey);
            }
            PooledSessionEntity displaced = entries.get(newKey);
            if (displaced != null && displaced != entry) {
                displaced.rekey(PooledSessionEntity.newPlaceholderKey());
                entries.put(displaced.getKey(), displaced);
                log.warn("SESSION_POOL_KEY_CONFLICT key={}, displacedTo={}", newKey, displaced.getKey());
            }
            entry.rekey(newKey);
            entries.put(newKey, entry);
        }
        log.info("SESSION_POOL_REKEYED oldKey={}, newKey={}", oldKey, newKey);
    }

    /**
     * 淘汰空闲超过阈值的条目。被持有的条目不会被淘汰。
     *
     * @param thresholdMs 空闲阈值（毫秒）
     * @return 淘汰的条目数
     */
    public int evictIdle(long thresholdMs) {
        List<PooledSessionEntity> victims = new ArrayList<>();
        synchronized (monitor) {
            long now = clock.millis();
            Iterator<PooledSessionEntity> iterator = entries.values().iterator();
            while (iterator.hasNext()) {
                PooledSessionEntity entry = iterator.next();
                if (!entry.isInUse() && entry.idleMillis(now) > thresholdMs) {
                    iterator.remove();
                    victims.add(entry);
                }
            }
        }
        for (PooledSessionEntity victim : victims) {
            closeQuietly(victim, "idle");
        }
        if (!victims.isEmpty()) {
            log.info("SESSION_POOL_EVICTED count={}, thresholdMs={}", victims.size(), thresholdMs);
        }
        return victims.size();
    }

    /**
     * 后台补足空闲条目到 target。
     * <p>
     * 缺口 = target - 空闲数 - 正在补足数，每个缺口单位在预热线程池上异步创建，
     * 创建失败只记录日志，由下一轮补足。
     * </p>
     *
     * @param target 空闲条目目标数量
     * @return 全部创建结束后完成，值为实际插入的条目数
     */
    public CompletableFuture<Integer> topUp(int target) {
        int deficit;
        int available;
        synchronized (monitor) {
            if (shutdown) {
                return CompletableFuture.completedFuture(0);
            }
            available = countFree();
            deficit = target - available - pendingPrewarms;
            if (settings.isBounded()) {
                deficit = Math.min(deficit, settings.maxSize() - entries.size() - pendingCreations);
            }
            if (deficit <= 0) {
                return CompletableFuture.completedFuture(0);
            }
            pendingPrewarms += deficit;
            pendingCreations += deficit;
        }
        log.info("SESSION_POOL_TOP_UP available={}, target={}, prewarming={}", available, target, deficit);

        List<CompletableFuture<Boolean>> futures = new ArrayList<>(deficit);
        for (int i = 0; i < deficit; i++) {
            futures.add(submitPrewarm());
        }
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> (int) futures.stream().filter(CompletableFuture::join).count());
    }

    public SessionPoolSnapshot snapshot() {
        synchronized (monitor) {
            int available = countFree();
            return new SessionPoolSnapshot(entries.size(), available, entries.size() - available, pendingCreations);
        }
    }

    /**
     * 判断 key 当前是否在池中。
     */
    public boolean containsKey(String key) {
        if (key == null) {
            return false;
        }
        synchronized (monitor) {
            return entries.containsKey(key);
        }
    }

    /**
     * 进程退出时关闭全部句柄并清空会话池。
     */
    public void shutdown() {
        List<PooledSessionEntity> all;
        synchronized (monitor) {
            if (shutdown) {
                return;
            }
            shutdown = true;
            all = new ArrayList<>(entries.values());
            entries.clear();
        }
        for (PooledSessionEntity entry : all) {
            closeQuietly(entry, "shutdown");
        }
        log.info("SESSION_POOL_SHUTDOWN closed={}", all.size());
    }

    public SessionPoolSettings getSettings() {
        return settings;
    }

    private PooledSessionEntity claimFree(String preferredKey) {
        long now = clock.millis();
        if (StringUtils.isNotBlank(preferredKey)) {
            PooledSessionEntity preferred = entries.get(preferredKey);
            if (preferred != null && !preferred.isInUse()) {
                preferred.claim(now);
                log.info("SESSION_POOL_REUSED key={}", preferredKey);
                return preferred;
            }
            if (preferred != null) {
                log.info("SESSION_POOL_PREFERRED_BUSY key={}, falling back to any free session", preferredKey);
            }
        }
        for (PooledSessionEntity entry : entries.values()) {
            if (!entry.isInUse()) {
                entry.claim(now);
                log.info("SESSION_POOL_ASSIGNED key={}", entry.getKey());
                return entry;
            }
        }
        return null;
    }

    private CompletableFuture<Boolean> submitPrewarm() {
        try {
            return CompletableFuture.supplyAsync(this::prewarmOne, prewarmExecutor);
        } catch (RejectedExecutionException ex) {
            synchronized (monitor) {
                pendingPrewarms--;
                pendingCreations--;
            }
            log.warn("SESSION_POOL_PREWARM_REJECTED error={}", ex.getMessage());
            return CompletableFuture.completedFuture(false);
        }
    }

    private boolean prewarmOne() {
        long startMs = clock.millis();
        IAgentSessionHandle handle;
        try {
            handle = openHandle();
        } catch (AppException ex) {
            synchronized (monitor) {
                pendingPrewarms--;
                pendingCreations--;
            }
            log.warn("SESSION_POOL_PREWARM_FAILED error={}", ex.getMessage());
            return false;
        }

        PooledSessionEntity entry = PooledSessionEntity.prewarmed(handle, clock.millis());
        boolean inserted;
        int size;
        synchronized (monitor) {
            pendingPrewarms--;
            pendingCreations--;
            inserted = !shutdown;
            if (inserted) {
                entries.put(entry.getKey(), entry);
            }
            size = entries.size();
        }
        if (!inserted) {
            closeQuietly(entry, "shutdown");
            return false;
        }
        log.info("SESSION_POOL_PREWARMED key={}, handleId={}, costMs={}, size={}",
                entry.getKey(), handle.getHandleId(), clock.millis() - startMs, size);
        return true;
    }

    private IAgentSessionHandle openHandle() {
        IAgentSessionHandle handle;
        try {
            handle = runtimeGateway.openSession();
        } catch (AppException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE,
                    "Failed to create agent session: " + ex.getMessage(), ex);
        }
        if (handle == null) {
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "Agent runtime returned no session");
        }
        return handle;
    }

    private int countFree() {
        int free = 0;
        for (PooledSessionEntity entry : entries.values()) {
            if (!entry.isInUse()) {
                free++;
            }
        }
        return free;
    }

    private void ensureOpen() {
        if (shutdown) {
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "Session pool is shut down");
        }
    }

    private void closeQuietly(PooledSessionEntity entry, String reason) {
        try {
            entry.getHandle().close();
            log.info("SESSION_POOL_CLOSED key={}, reason={}", entry.getKey(), reason);
        } catch (RuntimeException ex) {
            log.warn("SESSION_POOL_CLOSE_FAILED key={}, reason={}, error={}", entry.getKey(), reason, ex.getMessage());
        }
    }
}
