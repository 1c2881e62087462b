package com.github.dimitryivaniuta.keygateway.web;

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
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every gateway request with a correlation id: the caller's X-Correlation-Id when it is a
 * plain token, otherwise a fresh UUID. The id goes into MDC (log pattern and error bodies) and
 * is echoed on the response. The caller's header itself is forwarded upstream untouched.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class CorrelationIdFilter extends OncePerRequestFilter {

    // printable, no spaces or separators that could break a log line or a header
    private static final Pattern ACCEPTED = Pattern.compile("[A-Za-z0-9._:\\-]{1,128}");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {

        String correlationId = resolve(request.getHeader(RequestContextKeys.CORRELATION_ID_HEADER));

        MDC.put(RequestContextKeys.CORRELATION_ID_MDC_KEY, correlationId);
        response.setHeader(RequestContextKeys.CORRELATION_ID_HEADER, correlationId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestContextKeys.CORRELATION_ID_MDC_KEY);
        }
    }

    static String resolve(String supplied) {
        if (supplied != null) {
            String trimmed = supplied.trim();
            if (ACCEPTED.matcher(trimmed).matches()) return trimmed;
        }
        return UUID.randomUUID().toString();
    }
}
