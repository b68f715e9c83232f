package com.agentrelay.test.support;

import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.model.Generation;
import org.springframework.ai.chat.prompt.Prompt;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * 按脚本返回流式响应的 ChatModel，并记录收到的 Prompt。
 */
public class ScriptedChatModel implements ChatModel {

    private final List<Prompt> prompts = new CopyOnWriteArrayList<>();
    private volatile Function<Prompt, Flux<ChatResponse>> script;

    public ScriptedChatModel(String... chunks) {
        this.script = prompt -> Flux.fromArray(chunks).map(ScriptedChatModel::chunk);
    }

    public static ChatResponse chunk(String text) {
        return new ChatResponse(List.of(new Generation(new AssistantMessage(text))));
    }

    public void setScript(Function<Prompt, Flux<ChatResponse>> script) {
        this.script = script;
    }

    @Override
    public ChatResponse call(Prompt prompt) {
        prompts.add(prompt);
        return script.apply(prompt).blockLast();
    }

    @Override
    public Flux<ChatResponse> stream(Prompt prompt) {
        prompts.add(prompt);
        return script.apply(prompt);
    }

    public List<Prompt> getPrompts() {
        return prompts;
    }
}
