package com.agentrelay.trigger.http;

import com.agentrelay.api.dto.QueryRequestDTO;
import com.agentrelay.api.dto.RelayMessageDTO;
import com.agentrelay.trigger.application.relay.RelayResult;
import com.agentrelay.trigger.application.relay.StreamRelayApplicationService;
import com.agentrelay.types.common.Constants;
import com.agentrelay.types.enums.ResponseCode;
import com.agentrelay.types.exception.AppException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 流式查询入口：把一次中继的线路消息逐行写成 NDJSON。
 */
@Slf4j
@RestController
public class QueryStreamController {

    private static final MediaType NDJSON = MediaType.parseMediaType(Constants.NDJSON_MEDIA_TYPE);
    private static final long EMITTER_GRACE_MS = 10_000L;

    private final StreamRelayApplicationService streamRelayApplicationService;
    private final ObjectMapper objectMapper;
    private final Executor relayWorker;
    private final long emitterTimeoutMs;

    public QueryStreamController(StreamRelayApplicationService streamRelayApplicationService,
                                 ObjectMapper objectMapper,
                                 @Qualifier("relayWorker") Executor relayWorker,
                                 @Value("${relay.request-timeout-ms:300000}") long requestTimeoutMs) {
        this.streamRelayApplicationService = streamRelayApplicationService;
        this.objectMapper = objectMapper;
        this.relayWorker = relayWorker;
        this.emitterTimeoutMs = requestTimeoutMs + EMITTER_GRACE_MS;
    }

    @PostMapping(value = "/query", consumes = MediaType.APPLICATION_JSON_VALUE, produces = Constants.NDJSON_MEDIA_TYPE)
    public ResponseBodyEmitter query(@RequestBody QueryRequestDTO request, HttpServletResponse response) {
        if (request == null || StringUtils.isBlank(request.getPrompt())) {
            throw new AppException(ResponseCode.ILLEGAL_PARAMETER, "prompt is required");
        }
        String prompt = request.getPrompt();
        String sessionKey = StringUtils.trimToNull(request.getSessionKey());

        applyStreamResponseHeaders(response);
        ResponseBodyEmitter emitter = new ResponseBodyEmitter(emitterTimeoutMs);
        AtomicBoolean cancelled = new AtomicBoolean(false);
        emitter.onTimeout(() -> cancelled.set(true));
        emitter.onCompletion(() -> cancelled.set(true));
        emitter.onError(ex -> {
            log.debug("QUERY_STREAM_EMITTER_ERROR sessionKey={}, error={}", sessionKey, ex == null ? "unknown" : ex.getMessage());
            cancelled.set(true);
        });

        Map<String, String> mdcContext = MDC.getCopyOfContextMap();
        try {
            relayWorker.execute(() -> runRelay(prompt, sessionKey, emitter, cancelled, mdcContext));
        } catch (RejectedExecutionException ex) {
            log.warn("QUERY_STREAM_REJECTED sessionKey={}, error={}", sessionKey, ex.getMessage());
            throw new AppException(ResponseCode.CAPABILITY_UNAVAILABLE, "Relay worker is saturated", ex);
        }
        return emitter;
    }

    private void runRelay(String prompt,
                          String sessionKey,
                          ResponseBodyEmitter emitter,
                          AtomicBoolean cancelled,
                          Map<String, String> mdcContext) {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        if (mdcContext != null) {
            MDC.setContextMap(mdcContext);
        }
        try {
            RelayResult result = streamRelayApplicationService.relay(prompt, sessionKey,
                    message -> emitter.send(toLine(message), NDJSON),
                    cancelled::get);
            log.debug("QUERY_STREAM_FINISHED outcome={}, sessionKey={}", result.outcome(), result.sessionKey());
            emitter.complete();
        } catch (RuntimeException ex) {
            log.warn("QUERY_STREAM_FAILED sessionKey={}, error={}", sessionKey, ex.getMessage());
            emitter.completeWithError(ex);
        } finally {
            if (previous != null) {
                MDC.setContextMap(previous);
            } else {
                MDC.clear();
            }
        }
    }

    private String toLine(RelayMessageDTO message) throws IOException {
        try {
            return objectMapper.writeValueAsString(message) + "\n";
        } catch (JsonProcessingException ex) {
            throw new IOException("Failed to serialize relay message: " + ex.getOriginalMessage(), ex);
        }
    }

    private void applyStreamResponseHeaders(HttpServletResponse response) {
        if (response == null) {
            return;
        }
        response.setHeader("Cache-Control", "no-cache, no-transform");
        response.setHeader("X-Accel-Buffering", "no");
    }
}
