package com.ascentful.access;

import java.util.Optional;

/**
 * The role, organization and plan a caller is treated as after any impersonation overlay
 * is applied. Derived on every resolution and never cached.
 *
 * @param subjectId      real subject (the administrator's own id while impersonating)
 * @param role           effective role
 * @param organizationId effective organization (nullable)
 * @param plan           effective plan (nullable when billing had no answer)
 * @param impersonating  true iff an active overlay was applied
 */
public record EffectiveIdentity(
        String subjectId,
        Role role,
        String organizationId,
        Plan plan,
        boolean impersonating
) {

    public Optional<Plan> planIfKnown() {
        return Optional.ofNullable(plan);
    }

    public boolean hasOrganization() {
        return organizationId != null && !organizationId.isBlank();
    }
}
