package com.ascentful.access.impersonation;

import com.ascentful.access.Plan;
import com.ascentful.access.Role;

/**
 * What an administrator asks to be treated as.
 *
 * @param role           role to adopt (required)
 * @param organizationId organization to adopt (nullable: falls back to the real one)
 * @param plan           plan to adopt (nullable: falls back to the real one)
 */
public record ImpersonationTarget(Role role, String organizationId, Plan plan) {

    public static ImpersonationTarget of(Role role) {
        return new ImpersonationTarget(role, null, null);
    }

    public static ImpersonationTarget of(Role role, String organizationId, Plan plan) {
        return new ImpersonationTarget(role, organizationId, plan);
    }
}
