package com.di.awardscope.config;

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
 * Puts {@code requestId} and {@code requestPath} into the MDC for every HTTP request and removes
 * them afterwards. {@link com.di.awardscope.util.MdcPropagation} carries them into query workers;
 * {@code GlobalExceptionHandler} reads {@code requestPath} for error responses.
 * A caller-supplied {@code X-Request-Id} header is reused as the request id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcRequestFilter extends OncePerRequestFilter {

    static final String REQUEST_ID = "requestId";
    static final String REQUEST_PATH = "requestPath";
    static final String REQUEST_ID_HEADER = "X-Request-Id";

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String incoming = request.getHeader(REQUEST_ID_HEADER);
        String requestId = incoming != null && !incoming.isBlank() && incoming.length() <= 64
                ? incoming.trim()
                : "req-" + UUID.randomUUID().toString().substring(0, 8);
        String path = request.getRequestURI();
        MDC.put(REQUEST_ID, requestId);
        MDC.put(REQUEST_PATH, path != null ? path : "");
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(REQUEST_ID);
            MDC.remove(REQUEST_PATH);
        }
    }
}
