package com.ascentful.access;

/**
 * Role checks about what a caller may do to the platform itself. Both take the real
 * snapshot, so an active overlay never widens them.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Whether the real caller may start an impersonation.
     */
    public static boolean canImpersonate(IdentitySnapshot realIdentity) {
        return realIdentity != null && realIdentity.isReady() && realIdentity.role().isAdministrative();
    }

    /**
     * Whether the real caller is a super admin. Overlays never grant this.
     */
    public static boolean isSuperAdmin(IdentitySnapshot realIdentity) {
        return realIdentity != null && realIdentity.isReady() && realIdentity.role() == Role.SUPER_ADMIN;
    }
}
