package com.ascentful.accessservice.api;

import com.ascentful.access.Role;
import com.ascentful.access.RouteGuardSpec;
import jakarta.validation.constraints.NotEmpty;
import java.util.EnumSet;
import java.util.Set;

/**
 * Ad-hoc guard to evaluate, with roles given by their codes.
 */
public record GuardRequest(
        @NotEmpty Set<String> allowedRoles, String requiredFlag, boolean requiresOnboardingCheck) {

    /**
     * @throws IllegalArgumentException if a role code is unknown
     */
    public RouteGuardSpec toSpec() {
        EnumSet<Role> roles = EnumSet.noneOf(Role.class);
        for (String code : allowedRoles) {
            roles.add(Role.fromString(code)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + code)));
        }
        return new RouteGuardSpec(roles, requiredFlag, requiresOnboardingCheck);
    }
}
