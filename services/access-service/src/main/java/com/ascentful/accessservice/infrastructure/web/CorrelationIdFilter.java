package com.ascentful.accessservice.infrastructure.web;

import com.ascentful.observability.CorrelationContext;
import com.ascentful.observability.CorrelationContextHolder;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds a correlation ID to every request so access decisions and impersonation audit records
 * can be joined with the gateway's logs.
 *
 * <p>A client-supplied {@code X-Correlation-ID} is kept only if it is at most
 * {@value #MAX_LENGTH} characters of letters, digits, {@code -} or {@code _}. Anything else
 * would end up verbatim in the audit log, so it is replaced with a fresh UUID. The resolved ID
 * is echoed on the response.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final int MAX_LENGTH = 64;

    private static final Pattern ALLOWED = Pattern.compile("[A-Za-z0-9_-]+");

    private static final Logger log = LoggerFactory.getLogger(CorrelationIdFilter.class);

    /**
     * Returns {@code header} if it is a usable correlation ID, otherwise a new random one.
     */
    static String resolveCorrelationId(String header) {
        if (header == null || header.isBlank()) {
            return UUID.randomUUID().toString();
        }
        String candidate = header.strip();
        if (candidate.length() > MAX_LENGTH || !ALLOWED.matcher(candidate).matches()) {
            String replacement = UUID.randomUUID().toString();
            log.debug("Replaced unusable correlation ID (length={}) with {}", header.length(), replacement);
            return replacement;
        }
        return candidate;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        CorrelationContextHolder.set(CorrelationContext.of(correlationId));
        try {
            filterChain.doFilter(request, response);
        } finally {
            CorrelationContextHolder.clear();
        }
    }
}
