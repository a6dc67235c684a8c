package com.ascentful.access;

/**
 * Canonical navigation targets, and the fallback home for each role after a role mismatch.
 */
public final class RedirectTargetResolver {

    public static final String SIGN_IN = "/sign-in";
    public static final String DASHBOARD = "/dashboard";
    public static final String ONBOARDING = "/onboarding";
    public static final String ADMIN = "/admin";
    public static final String UNIVERSITY = "/university";
    public static final String UNIVERSITY_STUDENT = "/university/student";
    public static final String STAFF = "/staff";

    private RedirectTargetResolver() {
        // utility class
    }

    /**
     * Home path for a role. Total: every role, including null, maps to exactly one path.
     * Students land in the university area only when they have an organization.
     */
    public static String redirectFor(Role role, String organizationId) {
        if (role == null) {
            return DASHBOARD;
        }
        return switch (role) {
            case SUPER_ADMIN, ADMIN -> ADMIN;
            case UNIVERSITY_ADMIN -> UNIVERSITY;
            case STAFF -> STAFF;
            case STUDENT -> organizationId != null && !organizationId.isBlank() ? UNIVERSITY_STUDENT : DASHBOARD;
            default -> DASHBOARD;
        };
    }

    public static String redirectFor(EffectiveIdentity identity) {
        return redirectFor(identity.role(), identity.organizationId());
    }
}
