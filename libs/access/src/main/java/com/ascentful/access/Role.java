package com.ascentful.access;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Platform roles, as issued by the identity provider.
 * <p>
 * Roles are flat: there is no implied hierarchy. A guard that admits several roles lists
 * each of them; the groups below exist for the checks the platform repeats everywhere.
 */
public enum Role {

    INDIVIDUAL("individual"),
    STUDENT("student"),
    ADVISOR("advisor"),
    STAFF("staff"),
    UNIVERSITY_ADMIN("university_admin"),
    ADMIN("admin"),
    SUPER_ADMIN("super_admin");

    /** Roles with platform-level admin access (/admin routes). */
    public static final Set<Role> PLATFORM_ADMIN_ROLES = EnumSet.of(ADMIN, SUPER_ADMIN);

    /** Roles with university-level admin access (/university routes). */
    public static final Set<Role> UNIVERSITY_ADMIN_ROLES = EnumSet.of(UNIVERSITY_ADMIN, SUPER_ADMIN);

    /** Roles that can reach advisor features. */
    public static final Set<Role> ADVISOR_ACCESSIBLE_ROLES = EnumSet.of(ADVISOR, UNIVERSITY_ADMIN, SUPER_ADMIN);

    /** Roles that are meaningless without an organization (university) affiliation. */
    public static final Set<Role> ORGANIZATION_REQUIRED_ROLES = EnumSet.of(STUDENT, ADVISOR, UNIVERSITY_ADMIN);

    /** Legacy code still present on old accounts; treated as {@link #INDIVIDUAL}. */
    private static final String LEGACY_USER_CODE = "user";

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The canonical string code (e.g., "university_admin"). */
    public String value() {
        return value;
    }

    /**
     * Administrative roles are the only ones allowed to start an impersonation, and they
     * are never subject to onboarding.
     */
    public boolean isAdministrative() {
        return PLATFORM_ADMIN_ROLES.contains(this);
    }

    /** Whether an impersonation overlay may adopt this role. */
    public boolean isImpersonatable() {
        return !isAdministrative();
    }

    /** Whether this role needs an organization id to be coherent. */
    public boolean requiresOrganization() {
        return ORGANIZATION_REQUIRED_ROLES.contains(this);
    }

    /**
     * Looks up a Role by its string code, case-insensitively. The legacy code {@code user}
     * maps to {@link #INDIVIDUAL}.
     *
     * @param value the string to match (may be null)
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        if (LEGACY_USER_CODE.equals(normalized)) {
            return Optional.of(INDIVIDUAL);
        }
        for (Role role : values()) {
            if (role.value.equals(normalized)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }

    /**
     * Checks whether a string corresponds to a known role.
     */
    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }
}
