package com.ascentful.observability;

/**
 * Immutable correlation context that flows with a request through the access engine.
 * <p>
 * Every incoming request establishes a {@code CorrelationContext}. Its identifiers are
 * injected into SLF4J MDC so that every guard decision and impersonation event logged on
 * the request thread can be traced back to the caller.
 *
 * @param correlationId  unique ID for the request flow (propagated from {@code X-Correlation-ID})
 * @param subjectId      real authenticated subject (nullable before identity resolution)
 * @param actingAdminId  administrator driving an impersonation overlay (nullable)
 * @param organizationId effective organization of the caller (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String subjectId,
        String actingAdminId,
        String organizationId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the real subject ID. */
    public static final String MDC_SUBJECT_ID = "subjectId";

    /** MDC key for the impersonating administrator. */
    public static final String MDC_ACTING_ADMIN_ID = "actingAdminId";

    /** MDC key for the effective organization. */
    public static final String MDC_ORGANIZATION_ID = "organizationId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context carrying only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Returns a copy bound to the given subject.
     */
    public CorrelationContext withSubject(String subjectId, String organizationId) {
        return new CorrelationContext(correlationId, subjectId, actingAdminId, organizationId);
    }

    /**
     * Returns a copy that records the administrator behind an active impersonation.
     */
    public CorrelationContext withActingAdmin(String actingAdminId) {
        return new CorrelationContext(correlationId, subjectId, actingAdminId, organizationId);
    }
}
