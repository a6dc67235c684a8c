package com.ascentful.access;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Access requirement declared by a protected view.
 *
 * @param allowedRoles            effective roles admitted (non-empty)
 * @param requiredFlag            feature flag that must be enabled (nullable)
 * @param requiresOnboardingCheck whether callers still onboarding are bounced to onboarding
 * @param roleMismatchRedirect    where a caller with a non-admitted role is sent (nullable:
 *                                the role's home from {@link RedirectTargetResolver})
 */
public record RouteGuardSpec(
        Set<Role> allowedRoles,
        String requiredFlag,
        boolean requiresOnboardingCheck,
        String roleMismatchRedirect
) {

    public RouteGuardSpec {
        if (allowedRoles == null || allowedRoles.isEmpty()) {
            throw new IllegalArgumentException("allowedRoles must contain at least one role");
        }
        allowedRoles = Collections.unmodifiableSet(EnumSet.copyOf(allowedRoles));
        if (requiredFlag != null && requiredFlag.isBlank()) {
            requiredFlag = null;
        }
        if (roleMismatchRedirect != null && !roleMismatchRedirect.startsWith("/")) {
            throw new IllegalArgumentException("roleMismatchRedirect must be an absolute path");
        }
    }

    public RouteGuardSpec(Set<Role> allowedRoles, String requiredFlag, boolean requiresOnboardingCheck) {
        this(allowedRoles, requiredFlag, requiresOnboardingCheck, null);
    }

    /**
     * Guard admitting the given roles, with no flag and no onboarding check.
     */
    public static RouteGuardSpec allowing(Role first, Role... rest) {
        return new RouteGuardSpec(EnumSet.of(first, rest), null, false);
    }

    public static RouteGuardSpec allowing(Set<Role> roles) {
        return new RouteGuardSpec(roles, null, false);
    }

    public RouteGuardSpec withRequiredFlag(String flag) {
        return new RouteGuardSpec(allowedRoles, flag, requiresOnboardingCheck, roleMismatchRedirect);
    }

    public RouteGuardSpec withOnboardingCheck() {
        return new RouteGuardSpec(allowedRoles, requiredFlag, true, roleMismatchRedirect);
    }

    public RouteGuardSpec withRoleMismatchRedirect(String path) {
        return new RouteGuardSpec(allowedRoles, requiredFlag, requiresOnboardingCheck, path);
    }

    public boolean allows(Role role) {
        return role != null && allowedRoles.contains(role);
    }

    public boolean hasRequiredFlag() {
        return requiredFlag != null;
    }
}
