package com.agentrelay.infrastructure.ai;

import com.agentrelay.domain.session.adapter.gateway.IAgentEventStream;
import com.agentrelay.domain.session.adapter.gateway.IAgentSessionHandle;
import com.agentrelay.infrastructure.util.JsonCodec;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatResponse;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * 基于 Spring AI ChatClient 的会话句柄。
 * <p>
 * 句柄内保存对话历史，因此复用同一句柄即可延续上下文。
 * 每次 send 在当前事件流上依次产出 system/init、若干 assistant 文本帧和一个 result 帧。
 * </p>
 */
@Slf4j
public class SpringAiAgentSessionHandle implements IAgentSessionHandle {

    private final String handleId;
    private final String runtimeSessionId;
    private final ChatClient chatClient;
    private final JsonCodec jsonCodec;
    private final String model;

    /** 受 this 保护 */
    private final List<Message> history = new ArrayList<>();

    private volatile QueueAgentEventStream currentStream;
    private volatile InFlightCall inFlight;
    private volatile boolean closed;

    public SpringAiAgentSessionHandle(String handleId, ChatClient chatClient, JsonCodec jsonCodec, String model) {
        this.handleId = handleId;
        this.runtimeSessionId = UUID.randomUUID().toString();
        this.chatClient = chatClient;
        this.jsonCodec = jsonCodec;
        this.model = model;
    }

    @Override
    public String getHandleId() {
        return handleId;
    }

    public String getRuntimeSessionId() {
        return runtimeSessionId;
    }

    @Override
    public IAgentEventStream stream() {
        ensureOpen();
        QueueAgentEventStream stream = new QueueAgentEventStream();
        QueueAgentEventStream previous = currentStream;
        currentStream = stream;
        if (previous != null) {
            previous.close();
        }
        return stream;
    }

    @Override
    public void send(String prompt) {
        ensureOpen();
        QueueAgentEventStream target = currentStream;
        if (target == null || target.isClosed()) {
            throw new IllegalStateException("stream() must be called before send()");
        }
        if (StringUtils.isBlank(prompt)) {
            throw new IllegalArgumentException("prompt cannot be blank");
        }
        cancelInFlight();

        UserMessage userMessage = new UserMessage(prompt);
        InFlightCall call = new InFlightCall(userMessage);
        List<Message> messages;
        synchronized (this) {
            history.add(userMessage);
            messages = new ArrayList<>(history);
        }
        inFlight = call;
        long startMs = System.currentTimeMillis();
        target.offer(initFrame());

        StringBuilder fullText = new StringBuilder();
        try {
            call.disposable = chatClient.prompt()
                    .messages(messages)
                    .stream()
                    .chatResponse()
                    .subscribe(
                            response -> {
                                String chunk = extractText(response);
                                if (StringUtils.isNotEmpty(chunk)) {
                                    fullText.append(chunk);
                                    target.offer(assistantFrame(chunk));
                                }
                            },
                            error -> {
                                log.warn("AGENT_RUNTIME_STREAM_FAILED handleId={}, sessionId={}, error={}",
                                        handleId, runtimeSessionId, error.getMessage());
                                abandon(call);
                                target.fail(new AppException(ResponseCode.CAPABILITY_UNAVAILABLE,
                                        "Agent runtime failed: " + error.getMessage(), error));
                            },
                            () -> {
                                synchronized (this) {
                                    if (call.cancelled) {
                                        return;
                                    }
                                    call.finished = true;
                                    history.add(new AssistantMessage(fullText.toString()));
                                }
                                target.offer(resultFrame(fullText.toString(), System.currentTimeMillis() - startMs));
                                target.complete();
                            });
        } catch (RuntimeException ex) {
            abandon(call);
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "Failed to send prompt: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        cancelInFlight();
        QueueAgentEventStream stream = currentStream;
        if (stream != null) {
            stream.close();
        }
        synchronized (this) {
            history.clear();
        }
        log.debug("AGENT_RUNTIME_SESSION_CLOSED handleId={}, sessionId={}", handleId, runtimeSessionId);
    }

    /**
     * 取消上一次未完成的调用，并撤回它没有得到回答的用户消息，
     * 晚到的回复不会再写入历史。
     */
    private void cancelInFlight() {
        InFlightCall previous = inFlight;
        if (previous == null) {
            return;
        }
        abandon(previous);
        Disposable disposable = previous.disposable;
        if (disposable != null && !disposable.isDisposed()) {
            disposable.dispose();
        }
    }

    private void abandon(InFlightCall call) {
        synchronized (this) {
            if (call.finished || call.cancelled) {
                return;
            }
            call.cancelled = true;
            history.removeIf(message -> message == call.userMessage);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "Agent session is closed: " + handleId);
        }
    }

    private String extractText(ChatResponse response) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return null;
        }
        return response.getResult().getOutput().getText();
    }

    private String initFrame() {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "system");
        frame.put("subtype", "init");
        frame.put("session_id", runtimeSessionId);
        if (StringUtils.isNotBlank(model)) {
            frame.put("model", model);
        }
        return jsonCodec.writeValue(frame);
    }

    private String assistantFrame(String text) {
        Map<String, Object> block = new LinkedHashMap<>();
        block.put("type", "text");
        block.put("text", text);
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", "assistant");
        message.put("content", List.of(block));
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "assistant");
        frame.put("session_id", runtimeSessionId);
        frame.put("message", message);
        return jsonCodec.writeValue(frame);
    }

    private String resultFrame(String result, long durationMs) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", "result");
        frame.put("subtype", "success");
        frame.put("session_id", runtimeSessionId);
        frame.put("is_error", false);
        frame.put("duration_ms", durationMs);
        frame.put("result", result);
        return jsonCodec.writeValue(frame);
    }

    /**
     * 单次模型调用；finished/cancelled 受外部句柄的 this 保护。
     */
    private static final class InFlightCall {

        private final UserMessage userMessage;
        private volatile Disposable disposable;
        private boolean finished;
        private boolean cancelled;

        private InFlightCall(UserMessage userMessage) {
            this.userMessage = userMessage;
        }
    }
}
