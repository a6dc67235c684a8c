package com.ascentful.access.flags;

/**
 * Read-only view of the flags for one tenant, captured once per decision.
 * <p>
 * The view holds a single immutable {@link FlagValues}, so a flag observed as enabled
 * cannot turn disabled later within the same decision even if the source is updated.
 */
public final class FeatureFlagState {

    private static final FeatureFlagState NOT_LOADED = new FeatureFlagState(null, null, false);
    private static final FeatureFlagState UNAVAILABLE = new FeatureFlagState(null, null, true);

    private final FlagValues values;
    private final String tenantId;
    private final boolean sourceUnavailable;

    private FeatureFlagState(FlagValues values, String tenantId, boolean sourceUnavailable) {
        this.values = values;
        this.tenantId = tenantId;
        this.sourceUnavailable = sourceUnavailable;
    }

    static FeatureFlagState of(FlagValues values, String tenantId) {
        return new FeatureFlagState(values, tenantId, false);
    }

    static FeatureFlagState notLoaded() {
        return NOT_LOADED;
    }

    static FeatureFlagState unavailable() {
        return UNAVAILABLE;
    }

    /**
     * Resolves a flag: tenant override, then platform default, then disabled.
     * {@link FlagState#UNKNOWN} while the source has not loaded or failed.
     */
    public FlagState stateOf(String flag) {
        if (values == null) {
            return FlagState.UNKNOWN;
        }
        return values.tenantOverride(tenantId, flag)
                .or(() -> values.platformDefault(flag))
                .map(FlagState::of)
                .orElse(FlagState.DISABLED);
    }

    /** True when the source threw instead of answering. */
    public boolean isSourceUnavailable() {
        return sourceUnavailable;
    }

    public String tenantId() {
        return tenantId;
    }
}
