package com.agentrelay.infrastructure.ai;

import com.agentrelay.domain.session.adapter.gateway.IAgentRuntimeGateway;
import com.agentrelay.domain.session.adapter.gateway.IAgentSessionHandle;
import com.agentrelay.infrastructure.util.JsonCodec;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Agent 运行时网关实现。
 * <p>
 * 每个会话句柄持有独立的 ChatClient，模型与系统提示词来自配置：
 * <ul>
 *   <li>agent.runtime.model：模型名称，为空时使用 ChatModel 默认配置</li>
 *   <li>agent.runtime.system-prompt：系统提示词，可空</li>
 * </ul>
 * </p>
 */
@Slf4j
@Component
public class SpringAiAgentRuntimeGateway implements IAgentRuntimeGateway {

    private final ObjectProvider<ChatModel> chatModelProvider;
    private final JsonCodec jsonCodec;
    private final String model;
    private final String systemPrompt;
    private final AtomicLong handleSequence = new AtomicLong(0L);

    public SpringAiAgentRuntimeGateway(ObjectProvider<ChatModel> chatModelProvider,
                                       JsonCodec jsonCodec,
                                       @Value("${agent.runtime.model:}") String model,
                                       @Value("${agent.runtime.system-prompt:}") String systemPrompt) {
        this.chatModelProvider = chatModelProvider;
        this.jsonCodec = jsonCodec;
        this.model = StringUtils.trimToNull(model);
        this.systemPrompt = StringUtils.trimToNull(systemPrompt);
    }

    @Override
    public IAgentSessionHandle openSession() {
        ChatModel chatModel = resolveChatModel();
        ChatClient.Builder builder = ChatClient.builder(chatModel);
        if (systemPrompt != null) {
            builder.defaultSystem(systemPrompt);
        }
        if (model != null) {
            builder.defaultOptions(ChatOptions.builder().model(model).build());
        }
        String handleId = "handle-" + handleSequence.incrementAndGet();
        SpringAiAgentSessionHandle handle = new SpringAiAgentSessionHandle(handleId, builder.build(), jsonCodec, model);
        log.debug("AGENT_RUNTIME_SESSION_OPENED handleId={}, sessionId={}, model={}",
                handleId, handle.getRuntimeSessionId(), model);
        return handle;
    }

    private ChatModel resolveChatModel() {
        ChatModel chatModel;
        try {
            chatModel = chatModelProvider.getIfAvailable();
        } catch (RuntimeException ex) {
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "ChatModel bean cannot be created: " + ex.getMessage(), ex);
        }
        if (chatModel == null) {
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "ChatModel bean not found");
        }
        return chatModel;
    }
}
