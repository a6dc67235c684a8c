package com.ascentful.access.flags;

/**
 * Tri-state result of resolving a feature flag. {@link #UNKNOWN} means the flag source has
 * not delivered values yet; it is never read as disabled.
 */
public enum FlagState {

    UNKNOWN,
    ENABLED,
    DISABLED;

    public static FlagState of(boolean enabled) {
        return enabled ? ENABLED : DISABLED;
    }
}
