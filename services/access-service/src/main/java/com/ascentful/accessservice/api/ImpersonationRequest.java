package com.ascentful.accessservice.api;

import com.ascentful.access.Plan;
import com.ascentful.access.Role;
import com.ascentful.access.impersonation.ImpersonationError;
import com.ascentful.access.impersonation.ImpersonationException;
import com.ascentful.access.impersonation.ImpersonationTarget;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /api/v1/impersonation}.
 *
 * @param role role code to adopt
 * @param organizationId organization to adopt (optional)
 * @param plan plan code to adopt (optional)
 */
public record ImpersonationRequest(@NotBlank String role, String organizationId, String plan) {

    /**
     * @throws ImpersonationException with {@code INVALID_TARGET} for an unknown role or plan code
     */
    public ImpersonationTarget toTarget() {
        Role target = Role.fromString(role)
                .orElseThrow(() -> new ImpersonationException(
                        ImpersonationError.INVALID_TARGET, "Unknown role: " + role));
        Plan targetPlan = null;
        if (plan != null && !plan.isBlank()) {
            targetPlan = Plan.fromString(plan)
                    .orElseThrow(() -> new ImpersonationException(
                            ImpersonationError.INVALID_TARGET, "Unknown plan: " + plan));
        }
        String org = organizationId == null || organizationId.isBlank() ? null : organizationId.strip();
        return ImpersonationTarget.of(target, org, targetPlan);
    }
}
