package com.ascentful.access.impersonation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes impersonation lifecycle events as single-line JSON to the {@code ACCESS_AUDIT}
 * logger. Rejections are logged at warn, everything else at info.
 */
public class ImpersonationAuditLogger {

    /** Name of the dedicated audit logger; route it to its own appender in production. */
    public static final String AUDIT_LOGGER_NAME = "ACCESS_AUDIT";

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger(AUDIT_LOGGER_NAME);

    private final ObjectMapper mapper;

    public ImpersonationAuditLogger() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS));
    }

    public ImpersonationAuditLogger(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public void record(ImpersonationAuditEvent event) {
        String line = toJson(event);
        if (event.outcome() == ImpersonationAuditEvent.Outcome.REJECTED) {
            AUDIT_LOG.warn(line);
        } else {
            AUDIT_LOG.info(line);
        }
    }

    /**
     * Serializes the event. Falls back to a flat key=value line if Jackson fails, so an
     * audit record is never lost.
     */
    String toJson(ImpersonationAuditEvent event) {
        try {
            return mapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize impersonation audit event: {}", e.getMessage());
            return "event=%s outcome=%s actingAdminId=%s role=%s reason=%s"
                    .formatted(event.event(), event.outcome(), event.actingAdminId(), event.role(), event.reason());
        }
    }
}
