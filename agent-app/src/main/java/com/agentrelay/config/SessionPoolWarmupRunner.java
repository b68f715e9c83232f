package com.agentrelay.config;

import com.agentrelay.trigger.job.SessionPoolMaintenanceDaemon;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * 启动后延迟预热会话池，避免与应用启动争抢资源。
 */
@Slf4j
@Component
public class SessionPoolWarmupRunner implements ApplicationRunner {

    private final SessionPoolMaintenanceDaemon maintenanceDaemon;
    private final SessionPoolProperties properties;
    private final TaskScheduler daemonScheduler;
    private final Clock clock;

    public SessionPoolWarmupRunner(SessionPoolMaintenanceDaemon maintenanceDaemon,
                                   SessionPoolProperties properties,
                                   @Qualifier("daemonScheduler") TaskScheduler daemonScheduler,
                                   Clock clock) {
        this.maintenanceDaemon = maintenanceDaemon;
        this.properties = properties;
        this.daemonScheduler = daemonScheduler;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        long delayMs = Math.max(properties.getPrewarmDelayMs(), 0L);
        log.info("SESSION_POOL_WARM_UP_SCHEDULED delayMs={}, target={}", delayMs, properties.getTargetSize());
        daemonScheduler.schedule(maintenanceDaemon::warmUp, clock.instant().plusMillis(delayMs));
    }
}
