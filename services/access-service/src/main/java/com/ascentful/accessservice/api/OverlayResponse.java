package com.ascentful.accessservice.api;

import com.ascentful.access.impersonation.ImpersonationOverlay;

/**
 * JSON view of an active impersonation.
 */
public record OverlayResponse(
        String actingAdminId, String role, String organizationId, String plan, String startedAt) {

    public static OverlayResponse from(ImpersonationOverlay overlay) {
        return new OverlayResponse(
                overlay.actingAdminId(),
                overlay.impersonatedRole().value(),
                overlay.impersonatedOrganizationId(),
                overlay.impersonatedPlan() == null ? null : overlay.impersonatedPlan().value(),
                overlay.startedAt().toString());
    }
}
