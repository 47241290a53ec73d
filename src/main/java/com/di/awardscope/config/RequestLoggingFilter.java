package com.di.awardscope.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Enumeration;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Logs method, URI, body (truncated) and response status of each request. Response bodies are
 * never buffered so that exports stream straight to the client.
 * Enable with awardscope.request-logging.enabled=true in application.yml.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
public class RequestLoggingFilter extends OncePerRequestFilter {

    @Value("${awardscope.request-logging.enabled:true}")
    private boolean enabled;

    @Value("${awardscope.request-logging.max-body-length:2048}")
    private int maxBodyLength;

    /** Header names that contain credentials; never log their values. */
    private static final Pattern SENSITIVE_HEADER = Pattern.compile(
            "^(authorization|proxy-authorization|x-api-key|cookie)$", Pattern.CASE_INSENSITIVE);

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return true;
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (!enabled || isActuatorPath(request.getRequestURI())) {
            filterChain.doFilter(request, response);
            return;
        }
        ContentCachingRequestWrapper wrappedRequest = new ContentCachingRequestWrapper(request, 65536);
        long start = System.currentTimeMillis();
        try {
            filterChain.doFilter(wrappedRequest, response);
        } finally {
            logRequest(wrappedRequest);
            log.info("[RESPONSE] status={} path={} took={}ms", response.getStatus(),
                    request.getRequestURI(), System.currentTimeMillis() - start);
        }
    }

    private static boolean isActuatorPath(String uri) {
        return uri != null && uri.contains("/actuator");
    }

    private void logRequest(ContentCachingRequestWrapper request) {
        try {
            String uri = request.getRequestURI();
            String query = request.getQueryString();
            log.info("[REQUEST] {} {}", request.getMethod(), query != null && !query.isBlank() ? uri + "?" + query : uri);
            if (log.isDebugEnabled()) {
                Enumeration<String> headerNames = request.getHeaderNames();
                if (headerNames != null) {
                    String headers = Collections.list(headerNames).stream()
                            .filter(name -> !SENSITIVE_HEADER.matcher(name.trim()).matches())
                            .map(name -> name + "=" + request.getHeader(name))
                            .collect(Collectors.joining(", "));
                    if (!headers.isBlank()) {
                        log.debug("[REQUEST] Headers: {}", headers);
                    }
                }
            }
            byte[] buf = request.getContentAsByteArray();
            if (buf.length > 0) {
                log.info("[REQUEST] Body: {}", truncate(new String(buf, StandardCharsets.UTF_8), buf.length, maxBodyLength));
            }
        } catch (RuntimeException e) {
            log.warn("[REQUEST] Could not log request: {}", e.getMessage());
        }
    }

    static String truncate(String body, int totalBytes, int maxLength) {
        if (body.length() <= maxLength) {
            return body;
        }
        return body.substring(0, maxLength) + "... [truncated, total " + totalBytes + " bytes]";
    }
}
