package com.agentrelay.trigger.job;

import com.agentrelay.domain.session.model.valobj.SessionPoolSettings;
import com.agentrelay.domain.session.model.valobj.SessionPoolSnapshot;
import com.agentrelay.domain.session.service.AgentSessionPool;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * 会话池维护守护任务：先淘汰空闲会话，再补足到目标数量。
 * <p>
 * 池容量只由这里维护，请求路径只修改借出状态。
 * </p>
 */
@Slf4j
@Component
public class SessionPoolMaintenanceDaemon {

    private final AgentSessionPool sessionPool;

    public SessionPoolMaintenanceDaemon(AgentSessionPool sessionPool) {
        this.sessionPool = sessionPool;
    }

    /**
     * 启动后的首次预热。
     *
     * @return 全部预热结束后完成，值为插入的会话数
     */
    public CompletableFuture<Integer> warmUp() {
        int target = sessionPool.getSettings().targetSize();
        log.info("SESSION_POOL_WARM_UP_STARTED target={}", target);
        return sessionPool.topUp(target).whenComplete((created, error) -> {
            if (error != null) {
                log.warn("SESSION_POOL_WARM_UP_FAILED target={}, error={}", target, error.getMessage());
                return;
            }
            log.info("SESSION_POOL_WARM_UP_FINISHED target={}, created={}", target, created);
        });
    }

    @Scheduled(fixedDelayString = "${session.pool.cleanup-interval-ms:300000}",
            initialDelayString = "${session.pool.cleanup-interval-ms:300000}",
            scheduler = "daemonScheduler")
    public void maintain() {
        SessionPoolSettings settings = sessionPool.getSettings();
        int evicted = sessionPool.evictIdle(settings.idleTimeoutMs());
        CompletableFuture<Integer> topUp = sessionPool.topUp(settings.targetSize());
        SessionPoolSnapshot snapshot = sessionPool.snapshot();
        log.info("SESSION_POOL_MAINTAINED evicted={}, size={}, available={}, inUse={}, pending={}",
                evicted, snapshot.size(), snapshot.available(), snapshot.inUse(), snapshot.pending());
        topUp.whenComplete((created, error) -> {
            if (error != null) {
                log.warn("SESSION_POOL_TOP_UP_FAILED error={}", error.getMessage());
            }
        });
    }

    @Scheduled(fixedDelayString = "${session.pool.keepalive-interval-ms:60000}", scheduler = "daemonScheduler")
    public void reportPoolStatus() {
        SessionPoolSnapshot snapshot = sessionPool.snapshot();
        log.info("SESSION_POOL_KEEPALIVE size={}, available={}, inUse={}, pending={}",
                snapshot.size(), snapshot.available(), snapshot.inUse(), snapshot.pending());
    }
}
