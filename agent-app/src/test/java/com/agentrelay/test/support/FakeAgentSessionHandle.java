package com.agentrelay.test.support;

import com.agentrelay.domain.session.adapter.gateway.IAgentEventStream;
import com.agentrelay.domain.session.adapter.gateway.IAgentSessionHandle;
import com.agentrelay.infrastructure.ai.QueueAgentEventStream;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BiConsumer;

/**
 * 按脚本产出事件帧的会话句柄。默认脚本：init、一段 echo 文本、result。
 */
public class FakeAgentSessionHandle implements IAgentSessionHandle {

    private final String handleId;
    private final String runtimeSessionId;
    private final List<String> prompts = new CopyOnWriteArrayList<>();

    private volatile BiConsumer<String, QueueAgentEventStream> script;
    private volatile QueueAgentEventStream currentStream;
    private volatile boolean closed;
    private volatile boolean failOnClose;
    private volatile int streamCount;

    public FakeAgentSessionHandle(String handleId, String runtimeSessionId) {
        this.handleId = handleId;
        this.runtimeSessionId = runtimeSessionId;
        this.script = (prompt, stream) -> {
            stream.offer(initFrame(runtimeSessionId));
            stream.offer(assistantFrame("echo:" + prompt));
            stream.offer(resultFrame("echo:" + prompt));
            stream.complete();
        };
    }

    public static String initFrame(String sessionId) {
        return "{\"type\":\"system\",\"subtype\":\"init\",\"session_id\":\"" + sessionId + "\"}";
    }

    public static String assistantFrame(String text) {
        return "{\"type\":\"assistant\",\"message\":{\"role\":\"assistant\",\"content\":[{\"type\":\"text\",\"text\":\""
                + text + "\"}]}}";
    }

    public static String resultFrame(String result) {
        return "{\"type\":\"result\",\"subtype\":\"success\",\"is_error\":false,\"result\":\"" + result + "\"}";
    }

    public void setScript(BiConsumer<String, QueueAgentEventStream> script) {
        this.script = script;
    }

    public void setFailOnClose(boolean failOnClose) {
        this.failOnClose = failOnClose;
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
        QueueAgentEventStream stream = new QueueAgentEventStream();
        currentStream = stream;
        streamCount++;
        return stream;
    }

    @Override
    public void send(String prompt) {
        if (closed) {
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "closed");
        }
        QueueAgentEventStream stream = currentStream;
        if (stream == null) {
            throw new IllegalStateException("stream() must be called before send()");
        }
        prompts.add(prompt);
        script.accept(prompt, stream);
    }

    @Override
    public void close() {
        closed = true;
        if (failOnClose) {
            throw new IllegalStateException("close failed: " + handleId);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public List<String> getPrompts() {
        return prompts;
    }

    public int getStreamCount() {
        return streamCount;
    }
}
