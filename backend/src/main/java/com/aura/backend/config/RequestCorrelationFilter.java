package com.aura.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every request with a request id and a correlation id, echoed back as headers and kept in the MDC so
 * pipeline log lines for one upload or run can be grouped. Caller supplied ids are only trusted when they are
 * short tokens; anything else is replaced.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestCorrelationFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-Id";
    static final String CORRELATION_ID_HEADER = "X-Correlation-Id";
    static final String REQUEST_ID_KEY = "requestId";
    static final String CORRELATION_ID_KEY = "correlationId";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestId = accept(request.getHeader(REQUEST_ID_HEADER)).orElse(UUID.randomUUID().toString());
        // a client that sends no correlation id is correlated by its request id
        String correlationId = accept(request.getHeader(CORRELATION_ID_HEADER)).orElse(requestId);
        MDC.put(REQUEST_ID_KEY, requestId);
        MDC.put(CORRELATION_ID_KEY, correlationId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID_KEY);
            MDC.remove(CORRELATION_ID_KEY);
        }
    }

    private static Optional<String> accept(String header) {
        if (header == null) {
            return Optional.empty();
        }
        String trimmed = header.trim();
        return SAFE_ID.matcher(trimmed).matches() ? Optional.of(trimmed) : Optional.empty();
    }
}
