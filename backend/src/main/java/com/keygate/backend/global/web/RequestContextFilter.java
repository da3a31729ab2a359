package com.keygate.backend.global.web;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

import com.keygate.backend.global.common.CallContext;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags every request with a request id (MDC {@code requestId}, echoed in {@code X-Request-Id})
 * and attaches the {@link CallContext} the request's auth operations run under.
 * <p>
 * The deadline is the configured request timeout, or {@code X-Request-Timeout-Ms} when the
 * caller sends a shorter positive value.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestContextFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";
    public static final String REQUEST_TIMEOUT_HEADER = "X-Request-Timeout-Ms";
    public static final String CALL_CONTEXT_ATTRIBUTE = RequestContextFilter.class.getName() + ".callContext";
    private static final String REQUEST_ID_MDC_KEY = "requestId";

    private final Clock clock;
    private final Duration requestTimeout;

    public RequestContextFilter(Clock clock,
                                @Value("${keygate.transport.request-timeout:PT10S}") Duration requestTimeout) {
        this.clock = clock;
        this.requestTimeout = requestTimeout;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String requestId = resolveRequestId(request);
        MDC.put(REQUEST_ID_MDC_KEY, requestId);
        request.setAttribute(REQUEST_ID_HEADER, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        CallContext callContext = CallContext.withTimeout(clock, resolveTimeout(request));
        request.setAttribute(CALL_CONTEXT_ATTRIBUTE, callContext);
        try {
            filterChain.doFilter(request, response);
        } finally {
            callContext.cancel();
            MDC.remove(REQUEST_ID_MDC_KEY);
        }
    }

    /**
     * @return the context attached by this filter, or a background context when the request
     *         did not pass through it
     */
    public static CallContext callContext(HttpServletRequest request) {
        Object attribute = request.getAttribute(CALL_CONTEXT_ATTRIBUTE);
        if (attribute instanceof CallContext callContext) {
            return callContext;
        }
        return CallContext.background();
    }

    private String resolveRequestId(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        if (StringUtils.hasText(header)) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }

    private Duration resolveTimeout(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_TIMEOUT_HEADER);
        if (!StringUtils.hasText(header)) {
            return requestTimeout;
        }
        try {
            long millis = Long.parseLong(header.trim());
            if (millis > 0 && millis < requestTimeout.toMillis()) {
                return Duration.ofMillis(millis);
            }
        } catch (NumberFormatException ignored) {
            // unparsable hint, fall back to the configured timeout
        }
        return requestTimeout;
    }
}
