package com.ascentful.access;

import java.util.Locale;
import java.util.Optional;

/**
 * Subscription tiers reported by the billing source.
 */
public enum Plan {

    FREE("free"),
    PREMIUM("premium"),
    UNIVERSITY("university");

    private final String value;

    Plan(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * Looks up a Plan by its string code, case-insensitively.
     */
    public static Optional<Plan> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.strip().toLowerCase(Locale.ROOT);
        for (Plan plan : values()) {
            if (plan.value.equals(normalized)) {
                return Optional.of(plan);
            }
        }
        return Optional.empty();
    }
}
