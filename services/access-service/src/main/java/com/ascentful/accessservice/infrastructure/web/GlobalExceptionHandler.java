package com.ascentful.accessservice.infrastructure.web;

import com.ascentful.access.SourceUnavailableException;
import com.ascentful.access.impersonation.ImpersonationException;
import com.ascentful.accessservice.api.OperationNotPermittedException;
import com.ascentful.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://ascentful.com/errors/impersonation-already-active",
 *   "title": "Conflict",
 *   "status": 409,
 *   "detail": "An impersonation is already active for this session; stop it first",
 *   "error": "ALREADY_ACTIVE",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every error response carries the correlation ID and a timestamp.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String ERROR_TYPE_BASE = "https://ascentful.com/errors/";

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ImpersonationException.class)
    public ProblemDetail handleImpersonation(ImpersonationException ex) {
        HttpStatus status = switch (ex.error()) {
            case UNAUTHORIZED -> HttpStatus.FORBIDDEN;
            case ALREADY_ACTIVE -> HttpStatus.CONFLICT;
            case INVALID_TARGET -> HttpStatus.BAD_REQUEST;
        };
        log.warn("Impersonation rejected ({}): {}", ex.error(), ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, ex.getMessage());
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + "impersonation-"
                + ex.error().name().toLowerCase(Locale.ROOT).replace('_', '-')));
        problem.setProperty("error", ex.error().name());
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(OperationNotPermittedException.class)
    public ProblemDetail handleNotPermitted(OperationNotPermittedException ex) {
        log.warn("Operation not permitted: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.FORBIDDEN, ex.getMessage());
        problem.setTitle("Forbidden");
        problem.setType(URI.create(ERROR_TYPE_BASE + "forbidden"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public ProblemDetail handleSourceUnavailable(SourceUnavailableException ex) {
        log.warn("Collaborator unavailable: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.SERVICE_UNAVAILABLE, ex.source() + " is temporarily unavailable");
        problem.setTitle("Service Unavailable");
        problem.setType(URI.create(ERROR_TYPE_BASE + "source-unavailable"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
        problem.setTitle("Bad Request");
        problem.setType(URI.create(ERROR_TYPE_BASE + "bad-request"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .reduce((a, b) -> a + "; " + b)
                .orElse("Validation failed");
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
        problem.setTitle("Validation Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "validation"));
        enrichWithCorrelation(problem);
        return problem;
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(
                HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred");
        problem.setTitle("Internal Server Error");
        problem.setType(URI.create(ERROR_TYPE_BASE + "internal"));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
