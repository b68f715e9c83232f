package com.agentrelay.test;

import com.agentrelay.domain.session.adapter.gateway.IAgentEventStream;
import com.agentrelay.domain.session.model.valobj.AgentEvent;
import com.agentrelay.infrastructure.ai.JsonAgentEventParser;
import com.agentrelay.infrastructure.ai.SpringAiAgentSessionHandle;
import com.agentrelay.infrastructure.util.JsonCodec;
import com.agentrelay.test.support.ScriptedChatModel;
import com.agentrelay.types.enums.AgentEventTypeEnum;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.Message;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SpringAiAgentSessionHandleTest {

    private ScriptedChatModel chatModel;
    private JsonAgentEventParser parser;
    private SpringAiAgentSessionHandle handle;

    @BeforeEach
    public void setUp() {
        chatModel = new ScriptedChatModel("Hello", " world");
        JsonCodec jsonCodec = new JsonCodec(new ObjectMapper());
        parser = new JsonAgentEventParser(jsonCodec);
        handle = new SpringAiAgentSessionHandle("handle-1", ChatClient.builder(chatModel).build(), jsonCodec, "test-model");
    }

    @Test
    public void shouldProduceInitAssistantAndResultFrames() throws Exception {
        IAgentEventStream stream = handle.stream();
        handle.send("hi");

        List<AgentEvent> events = drain(stream);

        assertEquals(4, events.size());
        AgentEvent init = events.get(0);
        assertTrue(init.isInit());
        assertEquals(handle.getRuntimeSessionId(), init.getSessionId());
        assertEquals("test-model", init.getPayload().get("model"));
        assertEquals(List.of("Hello"), events.get(1).getTextBlocks());
        assertEquals(List.of(" world"), events.get(2).getTextBlocks());
        AgentEvent result = events.get(3);
        assertTrue(result.isTerminal());
        assertEquals("Hello world", result.getPayload().get("result"));
    }

    @Test
    public void shouldKeepConversationHistoryAcrossSends() throws Exception {
        IAgentEventStream first = handle.stream();
        handle.send("first");
        drain(first);

        IAgentEventStream second = handle.stream();
        handle.send("second");
        List<AgentEvent> events = drain(second);

        assertEquals(handle.getRuntimeSessionId(), events.get(0).getSessionId());
        assertEquals(2, chatModel.getPrompts().size());
        assertEquals(3, chatModel.getPrompts().get(1).getInstructions().size());
    }

    @Test
    public void shouldFailStreamWhenUpstreamErrors() throws Exception {
        chatModel.setScript(prompt -> Flux.error(new IllegalStateException("quota exceeded")));
        IAgentEventStream stream = handle.stream();
        handle.send("hi");

        String init = stream.poll(5, TimeUnit.SECONDS);
        assertNotNull(init);
        assertEquals(AgentEventTypeEnum.SYSTEM, parser.parse(init).getType());
        AppException ex = assertThrows(AppException.class, () -> stream.poll(5, TimeUnit.SECONDS));
        assertTrue(ex.is(ResponseCode.CAPABILITY_UNAVAILABLE));
    }

    @Test
    public void shouldDropUnansweredPromptWhenSendIsSuperseded() throws Exception {
        chatModel.setScript(prompt -> Flux.never());
        handle.stream();
        handle.send("abandoned");

        chatModel.setScript(prompt -> Flux.just(ScriptedChatModel.chunk("ok")));
        IAgentEventStream second = handle.stream();
        handle.send("second");
        drain(second);

        assertEquals(2, chatModel.getPrompts().size());
        List<Message> instructions = chatModel.getPrompts().get(1).getInstructions();
        assertEquals(1, instructions.size());
        assertEquals("second", instructions.get(0).getText());
    }

    @Test
    public void shouldNotKeepFailedPromptInHistory() throws Exception {
        chatModel.setScript(prompt -> Flux.error(new IllegalStateException("quota exceeded")));
        IAgentEventStream first = handle.stream();
        handle.send("failed");
        first.poll(5, TimeUnit.SECONDS);
        assertThrows(AppException.class, () -> first.poll(5, TimeUnit.SECONDS));

        chatModel.setScript(prompt -> Flux.just(ScriptedChatModel.chunk("ok")));
        IAgentEventStream second = handle.stream();
        handle.send("retry");
        drain(second);

        List<Message> instructions = chatModel.getPrompts().get(1).getInstructions();
        assertEquals(1, instructions.size());
        assertEquals("retry", instructions.get(0).getText());
    }

    @Test
    public void shouldRequireStreamBeforeSend() {
        assertThrows(IllegalStateException.class, () -> handle.send("hi"));
    }

    @Test
    public void shouldRejectUseAfterClose() {
        handle.close();

        AppException ex = assertThrows(AppException.class, () -> handle.stream());
        assertTrue(ex.is(ResponseCode.CAPABILITY_UNAVAILABLE));
    }

    private List<AgentEvent> drain(IAgentEventStream stream) throws InterruptedException {
        List<AgentEvent> events = new ArrayList<>();
        while (true) {
            String frame = stream.poll(5, TimeUnit.SECONDS);
            assertNotNull(frame, "timed out waiting for frame");
            AgentEvent event = parser.parse(frame);
            events.add(event);
            if (event.isTerminal()) {
                return events;
            }
        }
    }
}
