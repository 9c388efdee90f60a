package com.aura.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * One access line per API call. Uploads also log their payload size, and responses that carry predictions log
 * which scorer produced them.
 */
@Component
@Slf4j
@Order(Ordered.LOWEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

    static final String PREDICTION_SOURCE_HEADER = "X-Prediction-Source";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            int status = response.getStatus();
            String payload = request.getContentLengthLong() > 0 ? " in=" + request.getContentLengthLong() + "B" : "";
            String source = response.getHeader(PREDICTION_SOURCE_HEADER);
            String produced = source == null ? "" : " source=" + source;
            if (status >= 500) {
                log.warn("HTTP {} {}{} -> {} ({} ms){}", request.getMethod(), request.getRequestURI(), payload, status, durationMs, produced);
            } else {
                log.info("HTTP {} {}{} -> {} ({} ms){}", request.getMethod(), request.getRequestURI(), payload, status, durationMs, produced);
            }
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/actuator") || path.startsWith("/swagger-ui") || path.startsWith("/v3/api-docs");
    }
}
