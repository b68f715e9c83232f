package com.agentrelay.config;

import com.agentrelay.domain.session.adapter.gateway.IAgentRuntimeGateway;
import com.agentrelay.domain.session.model.valobj.SessionPoolSettings;
import com.agentrelay.domain.session.service.AgentSessionPool;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.Executor;

/**
 * 会话池装配：池本身不依赖 Spring，在这里按配置创建并注册指标。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(SessionPoolProperties.class)
public class SessionPoolConfig {

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock systemClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdown")
    public AgentSessionPool agentSessionPool(IAgentRuntimeGateway agentRuntimeGateway,
                                             SessionPoolProperties properties,
                                             @Qualifier("sessionPrewarmWorker") Executor sessionPrewarmWorker,
                                             Clock clock,
                                             ObjectProvider<MeterRegistry> meterRegistryProvider) {
        SessionPoolSettings settings = new SessionPoolSettings(
                Math.max(properties.getTargetSize(), 0),
                Math.max(properties.getIdleTimeoutMs(), 1L),
                Math.max(properties.getMaxSize(), 0));
        AgentSessionPool pool = new AgentSessionPool(agentRuntimeGateway, settings, sessionPrewarmWorker, clock);
        registerGauges(pool, meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new));
        log.info("SESSION_POOL_CONFIGURED targetSize={}, idleTimeoutMs={}, maxSize={}, prewarmDelayMs={}, cleanupIntervalMs={}",
                settings.targetSize(), settings.idleTimeoutMs(), settings.maxSize(),
                properties.getPrewarmDelayMs(), properties.getCleanupIntervalMs());
        return pool;
    }

    private void registerGauges(AgentSessionPool pool, MeterRegistry meterRegistry) {
        Gauge.builder("agent.session.pool.size", pool, p -> p.snapshot().size())
                .register(meterRegistry);
        Gauge.builder("agent.session.pool.available", pool, p -> p.snapshot().available())
                .register(meterRegistry);
        Gauge.builder("agent.session.pool.in_use", pool, p -> p.snapshot().inUse())
                .register(meterRegistry);
    }
}
