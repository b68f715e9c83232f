package com.agentrelay.trigger.application.relay;

import com.agentrelay.api.dto.RelayMessageDTO;
import com.agentrelay.domain.session.adapter.gateway.IAgentEventParser;
import com.agentrelay.domain.session.adapter.gateway.IAgentEventStream;
import com.agentrelay.domain.session.model.entity.PooledSessionEntity;
import com.agentrelay.domain.session.model.valobj.AgentEvent;
import com.agentrelay.domain.session.service.AgentSessionPool;
import com.agentrelay.types.enums.RelayOutcomeEnum;
import com.agentrelay.types.enums.RelayStateEnum;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * 流中继应用服务。
 * <p>
 * 每个请求按 ACQUIRING → SENDING → DRAINING → FINALIZING → RELEASED 推进：
 * 借出会话、先取事件流再发送输入、逐帧转成线路消息、输出 complete，
 * 最后在唯一的 finally 出口归还会话。任何失败都直接跳到 RELEASED，
 * 能力失败与超时在此之前输出一条 error；传输断开与客户端取消不再输出。
 * 超时与取消只放弃本次消费，不关闭会话句柄，句柄仍可被后续请求复用。
 * </p>
 */
@Slf4j
@Service
public class StreamRelayApplicationService {

    private static final String METRIC_RELAY_REQUESTS = "agent.relay.requests";
    private static final String METRIC_RELAY_DURATION = "agent.relay.duration";
    private static final String METRIC_MALFORMED_EVENTS = "agent.relay.malformed.events";

    private final AgentSessionPool sessionPool;
    private final IAgentEventParser eventParser;
    private final RelayMessageMapper messageMapper;
    private final Clock clock;
    private final long requestTimeoutMs;
    private final long pollSliceMs;

    private final MeterRegistry meterRegistry;
    private final Counter malformedEventCounter;
    private final Timer relayTimer;

    @Autowired
    public StreamRelayApplicationService(AgentSessionPool sessionPool,
                                         IAgentEventParser eventParser,
                                         RelayMessageMapper messageMapper,
                                         ObjectProvider<MeterRegistry> meterRegistryProvider,
                                         Clock clock,
                                         @Value("${relay.request-timeout-ms:300000}") long requestTimeoutMs,
                                         @Value("${relay.poll-slice-ms:1000}") long pollSliceMs) {
        this(sessionPool, eventParser, messageMapper,
                meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new),
                clock, requestTimeoutMs, pollSliceMs);
    }

    public StreamRelayApplicationService(AgentSessionPool sessionPool,
                                         IAgentEventParser eventParser,
                                         RelayMessageMapper messageMapper,
                                         MeterRegistry meterRegistry,
                                         Clock clock,
                                         long requestTimeoutMs,
                                         long pollSliceMs) {
        if (requestTimeoutMs <= 0L || pollSliceMs <= 0L) {
            throw new IllegalArgumentException("relay timeouts must be positive");
        }
        this.sessionPool = sessionPool;
        this.eventParser = eventParser;
        this.messageMapper = messageMapper;
        this.clock = clock;
        this.requestTimeoutMs = requestTimeoutMs;
        this.pollSliceMs = pollSliceMs;
        this.meterRegistry = meterRegistry == null ? new SimpleMeterRegistry() : meterRegistry;
        this.malformedEventCounter = Counter.builder(METRIC_MALFORMED_EVENTS).register(this.meterRegistry);
        this.relayTimer = Timer.builder(METRIC_RELAY_DURATION).register(this.meterRegistry);
    }

    /**
     * 执行一次中继。
     *
     * @param prompt 用户输入，非空
     * @param sessionKey 调用方上一轮拿到的会话 key，可空
     * @param sink 线路消息输出端
     * @param cancelled 客户端是否已断开，每次等待事件后检查
     * @return 中继结果摘要
     */
    public RelayResult relay(String prompt, String sessionKey, RelayMessageSink sink, BooleanSupplier cancelled) {
        if (StringUtils.isBlank(prompt)) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "prompt cannot be blank");
        }
        RelayRun run = new RelayRun(sessionKey, sink, cancelled == null ? () -> false : cancelled);
        long startMs = clock.millis();
        log.info("RELAY_STARTED sessionKey={}, promptLength={}", sessionKey, prompt.length());
        try {
            run.execute(prompt, startMs + requestTimeoutMs);
        } finally {
            long costMs = clock.millis() - startMs;
            relayTimer.record(costMs, TimeUnit.MILLISECONDS);
            counter(run.outcome).increment();
            log.info("RELAY_FINISHED outcome={}, sessionKey={}, messages={}, costMs={}",
                    run.outcome, run.currentKey, run.emitted, costMs);
        }
        return new RelayResult(run.outcome, run.currentKey, run.fullText.toString(), run.emitted);
    }

    private Counter counter(RelayOutcomeEnum outcome) {
        return Counter.builder(METRIC_RELAY_REQUESTS)
                .tag("outcome", outcome.name().toLowerCase())
                .register(meterRegistry);
    }

    /**
     * 单次请求的状态机，仅由执行请求的线程访问。
     */
    private final class RelayRun {

        private final String requestedKey;
        private final RelayMessageSink sink;
        private final BooleanSupplier cancelled;

        private final StringBuilder fullText = new StringBuilder();
        private RelayStateEnum state = RelayStateEnum.ACQUIRING;
        private RelayOutcomeEnum outcome = RelayOutcomeEnum.FAILED;
        private PooledSessionEntity entry;
        private String currentKey;
        private boolean sessionAnnounced;
        private int emitted;

        private RelayRun(String requestedKey, RelayMessageSink sink, BooleanSupplier cancelled) {
            this.requestedKey = StringUtils.trimToNull(requestedKey);
            this.sink = sink;
            this.cancelled = cancelled;
        }

        private void execute(String prompt, long deadlineMs) {
            IAgentEventStream stream = null;
            try {
                entry = sessionPool.acquire(requestedKey);
                currentKey = entry.getKey();
                ensureWithinDeadline(deadlineMs);

                transition(RelayStateEnum.SENDING);
                stream = entry.getHandle().stream();
                entry.getHandle().send(prompt);

                transition(RelayStateEnum.DRAINING);
                drain(stream, deadlineMs);

                transition(RelayStateEnum.FINALIZING);
                emit(messageMapper.complete(fullText.toString(), currentKey));
                outcome = RelayOutcomeEnum.COMPLETED;
            } catch (RelayTransportException ex) {
                outcome = RelayOutcomeEnum.CANCELLED;
                log.warn("RELAY_TRANSPORT_ABANDONED state={}, sessionKey={}, reason={}", state, currentKey, ex.getMessage());
            } catch (AppException ex) {
                outcome = ex.is(ResponseCode.REQUEST_TIMEOUT) ? RelayOutcomeEnum.TIMED_OUT : RelayOutcomeEnum.FAILED;
                log.warn("RELAY_FAILED state={}, sessionKey={}, code={}, error={}", state, currentKey, ex.getCode(), ex.getInfo());
                emitErrorQuietly(ex.getInfo());
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                outcome = RelayOutcomeEnum.CANCELLED;
                log.warn("RELAY_INTERRUPTED state={}, sessionKey={}", state, currentKey);
            } catch (RuntimeException ex) {
                outcome = RelayOutcomeEnum.FAILED;
                log.error("RELAY_FAILED state={}, sessionKey={}, error={}", state, currentKey, ex.getMessage(), ex);
                emitErrorQuietly(ex.getMessage());
            } finally {
                if (stream != null) {
                    stream.close();
                }
                transition(RelayStateEnum.RELEASED);
                sessionPool.release(entry);
            }
        }

        private void drain(IAgentEventStream stream, long deadlineMs) throws InterruptedException {
            while (true) {
                ensureNotCancelled();
                long remainingMs = ensureWithinDeadline(deadlineMs);
                String frame = stream.poll(Math.min(remainingMs, pollSliceMs), TimeUnit.MILLISECONDS);
                if (frame == null) {
                    continue;
                }
                AgentEvent event = parseQuietly(frame);
                if (event == null) {
                    continue;
                }
                if (handleEvent(event)) {
                    return;
                }
            }
        }

        /**
         * @return 是否为终态事件
         */
        private boolean handleEvent(AgentEvent event) {
            if (event.isInit()) {
                adoptSessionKey(event.getSessionId());
            }
            emit(messageMapper.passthrough(event));
            for (String text : event.getTextBlocks()) {
                fullText.append(text);
                emit(messageMapper.textChunk(text));
            }
            return event.isTerminal();
        }

        private void adoptSessionKey(String authoritativeKey) {
            if (!authoritativeKey.equals(entry.getKey())) {
                sessionPool.rekey(entry, authoritativeKey);
            }
            currentKey = authoritativeKey;
            if (!sessionAnnounced && !authoritativeKey.equals(requestedKey)) {
                sessionAnnounced = true;
                emit(messageMapper.sessionCreated(authoritativeKey));
            }
        }

        private AgentEvent parseQuietly(String frame) {
            try {
                return eventParser.parse(frame);
            } catch (AppException ex) {
                if (!ex.is(ResponseCode.MALFORMED_EVENT)) {
                    throw ex;
                }
                malformedEventCounter.increment();
                log.warn("RELAY_MALFORMED_EVENT_SKIPPED sessionKey={}, error={}", currentKey, ex.getInfo());
                return null;
            }
        }

        private void emit(RelayMessageDTO message) {
            ensureNotCancelled();
            try {
                sink.emit(message);
                emitted++;
            } catch (IOException | RuntimeException ex) {
                // 已完成或超时的 emitter 会抛 IllegalStateException，同样视为连接失效
                throw new RelayTransportException("sink closed: " + ex.getMessage(), ex);
            }
        }

        private void emitErrorQuietly(String errorMessage) {
            try {
                emit(messageMapper.error(errorMessage));
            } catch (RelayTransportException ex) {
                log.warn("RELAY_ERROR_NOT_DELIVERED sessionKey={}, reason={}", currentKey, ex.getMessage());
            }
        }

        /**
         * 超时从请求开始计算，包括按需建会话的耗时。
         *
         * @return 剩余毫秒数
         */
        private long ensureWithinDeadline(long deadlineMs) {
            long remainingMs = deadlineMs - clock.millis();
            if (remainingMs <= 0L) {
                throw new AppException(ResponseCode.REQUEST_TIMEOUT,
                        "Request timed out after " + requestTimeoutMs + "ms");
            }
            return remainingMs;
        }

        private void ensureNotCancelled() {
            if (cancelled.getAsBoolean()) {
                throw new RelayTransportException("client disconnected", null);
            }
        }

        private void transition(RelayStateEnum next) {
            log.debug("RELAY_STATE sessionKey={}, from={}, to={}", currentKey, state, next);
            state = next;
        }
    }

    /**
     * 客户端断开或输出端失败：放弃本次消费，不再输出 error。
     */
    private static final class RelayTransportException extends RuntimeException {

        private RelayTransportException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
