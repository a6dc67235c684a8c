package com.ascentful.access.impersonation;

import com.ascentful.access.Plan;
import com.ascentful.access.Role;

import java.time.Instant;

/**
 * An active, admin-initiated substitution of role, organization and plan.
 * <p>
 * Held only in memory for the lifetime of the owning session; never persisted.
 *
 * @param active                     always true for overlays handed out by the store
 * @param actingAdminId              real subject of the administrator
 * @param impersonatedRole           role the administrator is treated as
 * @param impersonatedOrganizationId organization override (nullable)
 * @param impersonatedPlan           plan override (nullable)
 * @param startedAt                  when the overlay was committed
 */
public record ImpersonationOverlay(
        boolean active,
        String actingAdminId,
        Role impersonatedRole,
        String impersonatedOrganizationId,
        Plan impersonatedPlan,
        Instant startedAt
) {

    public ImpersonationOverlay {
        if (actingAdminId == null || actingAdminId.isBlank()) {
            throw new IllegalArgumentException("actingAdminId must not be null or blank");
        }
        if (impersonatedRole == null) {
            throw new IllegalArgumentException("impersonatedRole must not be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("startedAt must not be null");
        }
    }

    static ImpersonationOverlay start(String actingAdminId, ImpersonationTarget target, Instant now) {
        return new ImpersonationOverlay(
                true, actingAdminId, target.role(), target.organizationId(), target.plan(), now);
    }
}
