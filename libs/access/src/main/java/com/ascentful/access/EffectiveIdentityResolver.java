package com.ascentful.access;

import com.ascentful.access.impersonation.ImpersonationOverlay;

/**
 * Merges a ready {@link IdentitySnapshot} with an optional impersonation overlay.
 * <p>
 * Every field the overlay sets fully replaces the snapshot's; fields the overlay leaves
 * null fall back to the snapshot (and, for the plan, to the real billing plan).
 */
public final class EffectiveIdentityResolver {

    private EffectiveIdentityResolver() {
        // utility class
    }

    /**
     * @param snapshot real identity; must be {@link IdentityStatus#READY}
     * @param overlay  active overlay for the session, or null
     * @param realPlan plan reported by billing for the real subject, or null
     * @throws IllegalStateException if the snapshot is not ready
     */
    public static EffectiveIdentity resolve(IdentitySnapshot snapshot, ImpersonationOverlay overlay, Plan realPlan) {
        if (snapshot == null || !snapshot.isReady()) {
            throw new IllegalStateException("Cannot resolve an effective identity for status "
                    + (snapshot == null ? null : snapshot.status()));
        }
        if (overlay == null || !overlay.active()) {
            return new EffectiveIdentity(
                    snapshot.subjectId(), snapshot.role(), snapshot.organizationId(), realPlan, false);
        }
        return new EffectiveIdentity(
                snapshot.subjectId(),
                overlay.impersonatedRole(),
                overlay.impersonatedOrganizationId() != null
                        ? overlay.impersonatedOrganizationId()
                        : snapshot.organizationId(),
                overlay.impersonatedPlan() != null ? overlay.impersonatedPlan() : realPlan,
                true);
    }

    /**
     * Resolves without billing data; the plan is the overlay's, if any.
     */
    public static EffectiveIdentity resolve(IdentitySnapshot snapshot, ImpersonationOverlay overlay) {
        return resolve(snapshot, overlay, null);
    }
}
