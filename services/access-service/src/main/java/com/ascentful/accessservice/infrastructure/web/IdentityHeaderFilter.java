package com.ascentful.accessservice.infrastructure.web;

import com.ascentful.access.IdentitySnapshot;
import com.ascentful.observability.CorrelationContextHolder;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller described by the identity headers to the request thread.
 *
 * <p>Runs right after {@link CorrelationIdFilter}. Malformed headers end the request with a 400
 * problem response; the request never reaches a controller with a half-read identity.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class IdentityHeaderFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(IdentityHeaderFilter.class);

    private final ObjectMapper objectMapper;

    public IdentityHeaderFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        RequestIdentity identity;
        try {
            identity = IdentityHeaders.parse(request);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected request with malformed identity headers: {}", e.getMessage());
            writeBadRequest(response, e.getMessage());
            return;
        }

        RequestIdentityHolder.set(identity);
        IdentitySnapshot snapshot = identity.snapshot();
        if (snapshot.isReady()) {
            CorrelationContextHolder.update(ctx -> ctx.withSubject(snapshot.subjectId(), snapshot.organizationId()));
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            RequestIdentityHolder.clear();
        }
    }

    private void writeBadRequest(HttpServletResponse response, String detail) throws IOException {
        Map<String, Object> problem = new LinkedHashMap<>();
        problem.put("type", GlobalExceptionHandler.ERROR_TYPE_BASE + "invalid-identity");
        problem.put("title", "Bad Request");
        problem.put("status", HttpStatus.BAD_REQUEST.value());
        problem.put("detail", detail);
        problem.put("timestamp", Instant.now().toString());
        CorrelationContextHolder.get().ifPresent(ctx -> problem.put("correlationId", ctx.correlationId()));

        response.setStatus(HttpStatus.BAD_REQUEST.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), problem);
    }
}
