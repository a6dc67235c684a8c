package com.ascentful.access.impersonation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("ImpersonationAuditLogger")
class ImpersonationAuditLoggerTest {

    private static final ImpersonationAuditEvent EVENT = new ImpersonationAuditEvent(
            ImpersonationAuditEvent.Event.START,
            ImpersonationAuditEvent.Outcome.COMMITTED,
            "admin-1", "student", "uni-1", "university", null,
            Instant.parse("2025-03-01T12:00:00Z"));

    @Test
    @DisplayName("serializes the event as JSON with an ISO timestamp")
    void json() throws Exception {
        String line = new ImpersonationAuditLogger().toJson(EVENT);

        JsonNode node = new ObjectMapper().readTree(line);
        assertThat(node.get("event").asText()).isEqualTo("START");
        assertThat(node.get("actingAdminId").asText()).isEqualTo("admin-1");
        assertThat(node.get("organizationId").asText()).isEqualTo("uni-1");
        assertThat(node.get("timestamp").asText()).isEqualTo("2025-03-01T12:00:00Z");
    }

    @Test
    @DisplayName("falls back to key=value when serialization fails")
    void fallback() throws Exception {
        ObjectMapper broken = mock(ObjectMapper.class);
        when(broken.writeValueAsString(any())).thenThrow(new JsonProcessingException("boom") { });

        String line = new ImpersonationAuditLogger(broken).toJson(EVENT);

        assertThat(line).contains("event=START", "outcome=COMMITTED", "actingAdminId=admin-1", "role=student");
    }
}
