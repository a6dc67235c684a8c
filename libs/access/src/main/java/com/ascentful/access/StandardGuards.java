package com.ascentful.access;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Guards shared by the platform's protected areas.
 */
public final class StandardGuards {

    /** Flag gating the advisor workspace. */
    public static final String ADVISOR_DASHBOARD_FLAG = "advisor.dashboard";

    public static final RouteGuardSpec ADMIN = RouteGuardSpec.allowing(Role.PLATFORM_ADMIN_ROLES);

    public static final RouteGuardSpec UNIVERSITY = RouteGuardSpec.allowing(Role.UNIVERSITY_ADMIN_ROLES);

    /** Callers without an advisor-capable role land on the dashboard, not their role home. */
    public static final RouteGuardSpec ADVISOR = RouteGuardSpec.allowing(Role.ADVISOR_ACCESSIBLE_ROLES)
            .withRequiredFlag(ADVISOR_DASHBOARD_FLAG)
            .withRoleMismatchRedirect(RedirectTargetResolver.DASHBOARD);

    public static final RouteGuardSpec STUDENT = RouteGuardSpec.allowing(Role.STUDENT).withOnboardingCheck();

    public static final RouteGuardSpec DASHBOARD = RouteGuardSpec.allowing(
            Role.INDIVIDUAL, Role.STUDENT, Role.STAFF, Role.ADVISOR, Role.UNIVERSITY_ADMIN)
            .withOnboardingCheck();

    private static final Map<String, RouteGuardSpec> BY_NAME = Map.of(
            "admin", ADMIN,
            "university", UNIVERSITY,
            "advisor", ADVISOR,
            "student", STUDENT,
            "dashboard", DASHBOARD);

    private StandardGuards() {
        // constants
    }

    /**
     * Looks up a standard guard by name (case-insensitive).
     */
    public static Optional<RouteGuardSpec> byName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(name.toLowerCase(Locale.ROOT)));
    }
}
