package com.ascentful.access.impersonation;

import java.time.Instant;

/**
 * Structured audit record for one impersonation lifecycle event.
 *
 * @param event          lifecycle step
 * @param outcome        committed, rejected or discarded
 * @param actingAdminId  real subject of the administrator (nullable when the caller was not ready)
 * @param role           impersonated role code (nullable)
 * @param organizationId impersonated organization (nullable)
 * @param plan           impersonated plan code (nullable)
 * @param reason         rejection kind (null unless rejected)
 * @param timestamp      when the event happened
 */
public record ImpersonationAuditEvent(
        Event event,
        Outcome outcome,
        String actingAdminId,
        String role,
        String organizationId,
        String plan,
        String reason,
        Instant timestamp
) {

    public enum Event {
        START, STOP, SESSION_END
    }

    public enum Outcome {
        COMMITTED, REJECTED, DISCARDED
    }

    static ImpersonationAuditEvent committed(Event event, ImpersonationOverlay overlay, Instant at) {
        return new ImpersonationAuditEvent(
                event,
                event == Event.SESSION_END ? Outcome.DISCARDED : Outcome.COMMITTED,
                overlay.actingAdminId(),
                overlay.impersonatedRole().value(),
                overlay.impersonatedOrganizationId(),
                overlay.impersonatedPlan() == null ? null : overlay.impersonatedPlan().value(),
                null,
                at);
    }

    static ImpersonationAuditEvent rejected(
            String actingAdminId, ImpersonationTarget target, ImpersonationError error, Instant at) {
        return new ImpersonationAuditEvent(
                Event.START,
                Outcome.REJECTED,
                actingAdminId,
                target == null || target.role() == null ? null : target.role().value(),
                target == null ? null : target.organizationId(),
                target == null || target.plan() == null ? null : target.plan().value(),
                error.name(),
                at);
    }
}
