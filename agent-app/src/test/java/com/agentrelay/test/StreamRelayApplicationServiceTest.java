package com.agentrelay.test;

import com.agentrelay.api.dto.RelayMessageDTO;
import com.agentrelay.domain.session.model.entity.PooledSessionEntity;
import com.agentrelay.domain.session.model.valobj.SessionPoolSettings;
import com.agentrelay.domain.session.service.AgentSessionPool;
import com.agentrelay.infrastructure.ai.JsonAgentEventParser;
import com.agentrelay.infrastructure.util.JsonCodec;
import com.agentrelay.test.support.FakeAgentRuntimeGateway;
import com.agentrelay.test.support.FakeAgentSessionHandle;
import com.agentrelay.test.support.MutableClock;
import com.agentrelay.trigger.application.relay.RelayMessageMapper;
import com.agentrelay.trigger.application.relay.RelayResult;
import com.agentrelay.trigger.application.relay.StreamRelayApplicationService;
import com.agentrelay.types.enums.RelayOutcomeEnum;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StreamRelayApplicationServiceTest {

    private FakeAgentRuntimeGateway gateway;
    private AgentSessionPool pool;
    private SimpleMeterRegistry meterRegistry;
    private StreamRelayApplicationService service;
    private List<RelayMessageDTO> messages;

    @BeforeEach
    public void setUp() {
        gateway = new FakeAgentRuntimeGateway();
        pool = new AgentSessionPool(gateway, new SessionPoolSettings(2, 60_000L, 0), Runnable::run, Clock.systemUTC());
        meterRegistry = new SimpleMeterRegistry();
        service = newService(5_000L);
        messages = new ArrayList<>();
    }

    @Test
    public void shouldRelayEventsInOrderAndAnnounceNewSession() {
        RelayResult result = service.relay("hi", null, messages::add, () -> false);

        assertEquals(List.of("session_created", "message", "message", "text_chunk", "message", "complete"), types());
        assertEquals("sess-1", messages.get(0).getSessionKey());
        assertEquals("system", messages.get(1).getMessageType());
        assertEquals("init", messages.get(1).getData().get("subtype"));
        assertEquals("assistant", messages.get(2).getMessageType());
        assertEquals("echo:hi", messages.get(3).getContent());
        assertEquals("result", messages.get(4).getMessageType());
        RelayMessageDTO complete = messages.get(5);
        assertEquals("echo:hi", complete.getResponse());
        assertEquals("sess-1", complete.getSessionKey());

        assertEquals(RelayOutcomeEnum.COMPLETED, result.outcome());
        assertEquals("sess-1", result.sessionKey());
        assertTrue(pool.containsKey("sess-1"));
        assertEquals(0, pool.snapshot().inUse());
        assertEquals(1.0D, meterRegistry.counter("agent.relay.requests", "outcome", "completed").count());
    }

    @Test
    public void shouldReuseSessionWithoutAnnouncingItAgain() {
        service.relay("hi", null, message -> { }, () -> false);

        RelayResult result = service.relay("again", "sess-1", messages::add, () -> false);

        assertFalse(types().contains("session_created"));
        assertEquals("sess-1", result.sessionKey());
        assertEquals(1, gateway.openedCount());
        assertEquals(List.of("hi", "again"), gateway.getOpened().get(0).getPrompts());
    }

    @Test
    public void shouldReportActualKeyWhenPreferredSessionIsBusy() {
        pool.topUp(2).join();
        PooledSessionEntity holder = pool.acquire(null);
        String holderSessionId = ((FakeAgentSessionHandle) holder.getHandle()).getRuntimeSessionId();
        pool.rekey(holder, "abc");

        RelayResult result = service.relay("hi", "abc", messages::add, () -> false);

        assertEquals("session_created", messages.get(0).getType());
        String actualKey = messages.get(0).getSessionKey();
        assertNotEquals("abc", actualKey);
        assertNotEquals(holderSessionId, actualKey);
        assertEquals(actualKey, messages.get(messages.size() - 1).getSessionKey());
        assertEquals(actualKey, result.sessionKey());
        assertTrue(holder.isInUse());
    }

    @Test
    public void shouldEmitSingleErrorWhenRuntimeFailsMidStream() {
        pool.topUp(1).join();
        FakeAgentSessionHandle handle = gateway.getOpened().get(0);
        handle.setScript((prompt, stream) -> {
            stream.offer(FakeAgentSessionHandle.initFrame("sess-1"));
            stream.offer(FakeAgentSessionHandle.assistantFrame("a"));
            stream.offer(FakeAgentSessionHandle.assistantFrame("b"));
            stream.fail(new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "upstream reset"));
        });

        RelayResult result = service.relay("hi", null, messages::add, () -> false);

        List<String> types = types();
        assertEquals(2, types.stream().filter("text_chunk"::equals).count());
        assertEquals(1, types.stream().filter("error"::equals).count());
        assertFalse(types.contains("complete"));
        assertEquals("error", types.get(types.size() - 1));
        assertEquals("upstream reset", messages.get(messages.size() - 1).getMessage());
        assertEquals(RelayOutcomeEnum.FAILED, result.outcome());
        assertEquals("ab", result.response());
        assertEquals(0, pool.snapshot().inUse());
        assertFalse(handle.isClosed());
    }

    @Test
    public void shouldReleaseWithoutClosingHandleOnTimeout() {
        StreamRelayApplicationService shortTimeout = newService(200L);
        pool.topUp(1).join();
        FakeAgentSessionHandle handle = gateway.getOpened().get(0);
        handle.setScript((prompt, stream) -> { });

        RelayResult result = shortTimeout.relay("hi", null, messages::add, () -> false);

        assertEquals(RelayOutcomeEnum.TIMED_OUT, result.outcome());
        assertEquals(List.of("error"), types());
        assertEquals(0, pool.snapshot().inUse());
        assertFalse(handle.isClosed());
        PooledSessionEntity reused = pool.acquire(null);
        assertSame(handle, reused.getHandle());
        assertEquals(1, gateway.openedCount());
    }

    @Test
    public void shouldSkipMalformedFramesAndKeepDraining() {
        pool.topUp(1).join();
        gateway.getOpened().get(0).setScript((prompt, stream) -> {
            stream.offer(FakeAgentSessionHandle.initFrame("sess-1"));
            stream.offer("not-json");
            stream.offer("{\"subtype\":\"orphan\"}");
            stream.offer(FakeAgentSessionHandle.assistantFrame("ok"));
            stream.offer(FakeAgentSessionHandle.resultFrame("ok"));
            stream.complete();
        });

        RelayResult result = service.relay("hi", null, messages::add, () -> false);

        assertEquals(RelayOutcomeEnum.COMPLETED, result.outcome());
        assertEquals(List.of("session_created", "message", "message", "text_chunk", "message", "complete"), types());
        assertEquals("ok", result.response());
        assertEquals(2.0D, meterRegistry.counter("agent.relay.malformed.events").count());
    }

    @Test
    public void shouldReleaseEntryWhenClientConnectionBreaks() {
        AtomicInteger calls = new AtomicInteger();

        RelayResult result = service.relay("hi", null, message -> {
            if (calls.incrementAndGet() == 2) {
                throw new IOException("broken pipe");
            }
        }, () -> false);

        assertEquals(RelayOutcomeEnum.CANCELLED, result.outcome());
        assertEquals(2, calls.get());
        assertEquals(0, pool.snapshot().inUse());
        assertFalse(gateway.getOpened().get(0).isClosed());
    }

    @Test
    public void shouldTreatCompletedEmitterAsClientDisconnect() {
        AtomicInteger calls = new AtomicInteger();

        RelayResult result = service.relay("hi", null, message -> {
            calls.incrementAndGet();
            throw new IllegalStateException("ResponseBodyEmitter has already completed");
        }, () -> false);

        assertEquals(RelayOutcomeEnum.CANCELLED, result.outcome());
        assertEquals(1, calls.get());
        assertEquals(0, pool.snapshot().inUse());
        assertFalse(gateway.getOpened().get(0).isClosed());
        assertEquals(1.0D, meterRegistry.counter("agent.relay.requests", "outcome", "cancelled").count());
    }

    @Test
    public void shouldCountSessionCreationAgainstRequestTimeout() {
        MutableClock clock = new MutableClock(1_000_000L);
        gateway.setOnOpen(() -> clock.advance(2_000L));
        JsonAgentEventParser parser = new JsonAgentEventParser(new JsonCodec(new ObjectMapper()));
        StreamRelayApplicationService slowStart = new StreamRelayApplicationService(pool, parser,
                new RelayMessageMapper(), meterRegistry, clock, 1_000L, 50L);

        RelayResult result = slowStart.relay("hi", null, messages::add, () -> false);

        assertEquals(RelayOutcomeEnum.TIMED_OUT, result.outcome());
        assertEquals(List.of("error"), types());
        assertEquals(0, pool.snapshot().inUse());
        assertTrue(gateway.openedCount() >= 1);
        for (FakeAgentSessionHandle handle : gateway.getOpened()) {
            assertTrue(handle.getPrompts().isEmpty());
            assertFalse(handle.isClosed());
        }
    }

    @Test
    public void shouldStopWithoutMessagesWhenRequestIsCancelled() {
        RelayResult result = service.relay("hi", null, messages::add, () -> true);

        assertEquals(RelayOutcomeEnum.CANCELLED, result.outcome());
        assertTrue(messages.isEmpty());
        assertEquals(0, pool.snapshot().inUse());
        assertEquals(1, pool.snapshot().size());
    }

    @Test
    public void shouldEmitErrorWhenNoSessionCanBeCreated() {
        gateway.setUnavailable(true);

        RelayResult result = service.relay("hi", null, messages::add, () -> false);

        assertEquals(RelayOutcomeEnum.FAILED, result.outcome());
        assertEquals(List.of("error"), types());
        assertEquals(0, pool.snapshot().size());
    }

    @Test
    public void shouldRejectBlankPrompt() {
        AppException ex = assertThrows(AppException.class, () -> service.relay("  ", null, messages::add, () -> false));

        assertTrue(ex.is(ResponseCode.ILLEGAL_PARAMETER));
        assertEquals(0, gateway.openedCount());
    }

    private StreamRelayApplicationService newService(long requestTimeoutMs) {
        JsonAgentEventParser parser = new JsonAgentEventParser(new JsonCodec(new ObjectMapper()));
        return new StreamRelayApplicationService(pool, parser, new RelayMessageMapper(), meterRegistry,
                Clock.systemUTC(), requestTimeoutMs, 50L);
    }

    private List<String> types() {
        return messages.stream().map(RelayMessageDTO::getType).collect(Collectors.toList());
    }
}
