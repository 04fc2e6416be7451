package com.di.dataqc.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Logs method, path, status and duration of every request, plus JSON request bodies with credentials redacted.
 * Multipart bodies are never logged. Toggled by {@code dataqc.request-logging.enabled}.
 */
@Slf4j
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@RequiredArgsConstructor
public class RequestLoggingFilter extends OncePerRequestFilter {

    private static final int MAX_CACHED_BODY = 65536;

    /** Redacts JSON "password" (and similar) field values. */
    private static final Pattern JSON_PASSWORD_VALUE = Pattern.compile(
            "(\"(?:password|passwd|pwd|secret|token)\"\\s*:\\s*)\"[^\"]*\"", Pattern.CASE_INSENSITIVE);

    private final QcProperties properties;

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request,
                                    @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        if (!properties.getRequestLogging().isEnabled()) {
            filterChain.doFilter(request, response);
            return;
        }
        ContentCachingRequestWrapper wrappedRequest = new ContentCachingRequestWrapper(request, MAX_CACHED_BODY);
        long start = System.currentTimeMillis();
        try {
            filterChain.doFilter(wrappedRequest, response);
        } finally {
            logRequest(wrappedRequest);
            log.info("[RESPONSE] status={} path={} durationMs={}", response.getStatus(),
                    request.getRequestURI(), System.currentTimeMillis() - start);
        }
    }

    private void logRequest(ContentCachingRequestWrapper request) {
        String query = request.getQueryString();
        String uri = request.getRequestURI();
        log.info("[REQUEST] {} {}", request.getMethod(), query != null && !query.isBlank() ? uri + "?" + query : uri);

        String contentType = request.getContentType();
        if (contentType == null || !contentType.toLowerCase(java.util.Locale.ROOT).contains("json")) {
            return;
        }
        byte[] buf = request.getContentAsByteArray();
        if (buf.length > 0) {
            int maxBodyLength = properties.getRequestLogging().getMaxBodyLength();
            String body = redactPasswords(new String(buf, StandardCharsets.UTF_8));
            if (body.length() > maxBodyLength) {
                body = body.substring(0, maxBodyLength) + "... [truncated, total " + buf.length + " bytes]";
            }
            log.info("[REQUEST] Body: {}", body);
        }
    }

    static String redactPasswords(String body) {
        if (body == null || body.isBlank()) {
            return body;
        }
        return JSON_PASSWORD_VALUE.matcher(body).replaceAll("$1\"***\"");
    }
}
