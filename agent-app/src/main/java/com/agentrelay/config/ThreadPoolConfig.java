package com.agentrelay.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * <ul>
 *   <li>relayWorker：承载流中继，每个在途请求占用一个线程直到会话归还</li>
 *   <li>sessionPrewarmWorker：承载会话预热，句柄创建较慢，与请求线程隔离</li>
 * </ul>
 * 拒绝策略支持 AbortPolicy、DiscardPolicy、DiscardOldestPolicy、CallerRunsPolicy。
 * </p>
 *
 * @author agentrelay
 * @since 2026-10-19
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    /**
     * 流中继线程池：默认 queue-capacity=0，繁忙时直接拒绝而不是让请求排队等到超时。
     */
    @Bean(name = "relayWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "relayWorker")
    public ThreadPoolExecutor relayWorker(
            @Value("${executor.relay.core-size:16}") int coreSize,
            @Value("${executor.relay.max-size:64}") int maxSize,
            @Value("${executor.relay.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.relay.queue-capacity:0}") int queueCapacity,
            @Value("${executor.relay.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.relay.thread-name-prefix:relay-worker-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    @Bean(name = "sessionPrewarmWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "sessionPrewarmWorker")
    public ThreadPoolExecutor sessionPrewarmWorker(
            @Value("${executor.prewarm.core-size:2}") int coreSize,
            @Value("${executor.prewarm.max-size:4}") int maxSize,
            @Value("${executor.prewarm.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${executor.prewarm.queue-capacity:64}") int queueCapacity,
            @Value("${executor.prewarm.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${executor.prewarm.thread-name-prefix:session-prewarm-}") String threadNamePrefix) {
        return buildExecutor(coreSize, maxSize, keepAliveSeconds, queueCapacity, rejectionPolicy, threadNamePrefix);
    }

    private ThreadPoolExecutor buildExecutor(int coreSize,
                                             int maxSize,
                                             long keepAliveSeconds,
                                             int queueCapacity,
                                             String rejectionPolicy,
                                             String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        long normalizedKeepAliveSeconds = Math.max(keepAliveSeconds, 0L);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        };
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                normalizedKeepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
        executor.allowCoreThreadTimeOut(false);
        log.info("THREAD_POOL_CREATED name={}, coreSize={}, maxSize={}, queueCapacity={}",
                threadNamePrefix, normalizedCoreSize, normalizedMaxSize, normalizedQueueCapacity);
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
