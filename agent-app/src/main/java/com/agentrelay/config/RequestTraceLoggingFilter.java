package com.agentrelay.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * 统一 HTTP 链路日志过滤器。
 * <p>
 * 只记录请求行与耗时，不缓存请求/响应体，流式响应不受影响。
 * 探针路径不打日志。
 * </p>
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestTraceLoggingFilter extends OncePerRequestFilter {

    private static final String HEADER_TRACE_ID = "X-Trace-Id";
    private static final String HEADER_REQUEST_ID = "X-Request-Id";
    private static final String MDC_TRACE_ID = "traceId";
    private static final String MDC_REQUEST_ID = "requestId";

    private final boolean enabled;
    private final long slowRequestThresholdMs;

    public RequestTraceLoggingFilter(@Value("${observability.http-log.enabled:true}") boolean enabled,
                                     @Value("${observability.http-log.slow-request-threshold-ms:3000}") long slowRequestThresholdMs) {
        this.enabled = enabled;
        this.slowRequestThresholdMs = slowRequestThresholdMs;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        if (request == null || !enabled) {
            return true;
        }
        String path = normalizePath(request.getRequestURI());
        return "/healthz".equals(path) || "/ready".equals(path) || path.startsWith("/actuator");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String traceId = resolveOrCreateHeader(request.getHeader(HEADER_TRACE_ID));
        String requestId = resolveOrCreateHeader(request.getHeader(HEADER_REQUEST_ID));
        String path = normalizePath(request.getRequestURI());
        String method = request.getMethod();

        response.setHeader(HEADER_TRACE_ID, traceId);
        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_TRACE_ID, traceId);
        MDC.put(MDC_REQUEST_ID, requestId);

        long startNs = System.nanoTime();
        log.info("HTTP_IN method={}, path={}, clientIp={}", method, path, resolveClientIp(request));
        Throwable error = null;
        try {
            filterChain.doFilter(request, response);
        } catch (IOException | ServletException | RuntimeException ex) {
            error = ex;
            throw ex;
        } finally {
            long costMs = (System.nanoTime() - startNs) / 1_000_000L;
            boolean async = request.isAsyncStarted();
            if (error != null) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=error, errorType={}, errorMessage={}",
                        method, path, response.getStatus(), costMs,
                        error.getClass().getSimpleName(), truncate(error.getMessage(), 200));
            } else if (costMs >= Math.max(slowRequestThresholdMs, 0L)) {
                log.warn("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=slow, async={}",
                        method, path, response.getStatus(), costMs, async);
            } else {
                log.info("HTTP_OUT method={}, path={}, status={}, costMs={}, outcome=success, async={}",
                        method, path, response.getStatus(), costMs, async);
            }
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_TRACE_ID);
        }
    }

    private String resolveOrCreateHeader(String value) {
        if (StringUtils.isNotBlank(value)) {
            return value.trim();
        }
        return UUID.randomUUID().toString().replace("-", "");
    }

    private String resolveClientIp(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (StringUtils.isNotBlank(forwarded)) {
            String[] segments = forwarded.split(",");
            if (segments.length > 0 && StringUtils.isNotBlank(segments[0])) {
                return segments[0].trim();
            }
        }
        return StringUtils.defaultIfBlank(request.getRemoteAddr(), "unknown");
    }

    private String normalizePath(String path) {
        return StringUtils.defaultIfBlank(path, "/").trim();
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
