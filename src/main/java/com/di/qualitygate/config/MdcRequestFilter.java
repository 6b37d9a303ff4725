package com.di.qualitygate.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Puts {@code requestId} and {@code requestPath} into the MDC for every HTTP
 * request and removes them afterwards. A batch triggered over REST logs both
 * the request keys and its {@code runId}.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String REQUEST_ID = "requestId";
    static final String REQUEST_PATH = "requestPath";

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        MDC.put(REQUEST_ID, "req-" + UUID.randomUUID().toString().substring(0, 8));
        MDC.put(REQUEST_PATH, request.getRequestURI() != null ? request.getRequestURI() : "");
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
        }
    }
}
