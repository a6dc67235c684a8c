package com.ascentful.access.flags;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable set of raw flag values delivered by a {@link FeatureFlagSource}.
 *
 * @param platformDefaults platform-wide values keyed by flag name
 * @param tenantOverrides  per-tenant values keyed by tenant id, then flag name
 */
public record FlagValues(Map<String, Boolean> platformDefaults, Map<String, Map<String, Boolean>> tenantOverrides) {

    public FlagValues {
        platformDefaults = Map.copyOf(platformDefaults);
        Map<String, Map<String, Boolean>> copy = new HashMap<>();
        tenantOverrides.forEach((tenant, flags) -> copy.put(tenant, Map.copyOf(flags)));
        tenantOverrides = Map.copyOf(copy);
    }

    public static FlagValues empty() {
        return new FlagValues(Map.of(), Map.of());
    }

    public Optional<Boolean> platformDefault(String flag) {
        return Optional.ofNullable(platformDefaults.get(flag));
    }

    public Optional<Boolean> tenantOverride(String tenantId, String flag) {
        if (tenantId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tenantOverrides.getOrDefault(tenantId, Map.of()).get(flag));
    }

    /** Returns a copy with one platform default replaced. */
    public FlagValues withPlatformDefault(String flag, boolean enabled) {
        Map<String, Boolean> updated = new HashMap<>(platformDefaults);
        updated.put(flag, enabled);
        return new FlagValues(updated, tenantOverrides);
    }

    /** Returns a copy with one tenant override replaced. */
    public FlagValues withTenantOverride(String tenantId, String flag, boolean enabled) {
        Map<String, Map<String, Boolean>> updated = new HashMap<>(tenantOverrides);
        Map<String, Boolean> tenantFlags = new HashMap<>(updated.getOrDefault(tenantId, Map.of()));
        tenantFlags.put(flag, enabled);
        updated.put(tenantId, tenantFlags);
        return new FlagValues(platformDefaults, updated);
    }

    /** Returns a copy without the tenant's override for {@code flag}. */
    public FlagValues withoutTenantOverride(String tenantId, String flag) {
        if (!tenantOverrides.containsKey(tenantId)) {
            return this;
        }
        Map<String, Map<String, Boolean>> updated = new HashMap<>(tenantOverrides);
        Map<String, Boolean> tenantFlags = new HashMap<>(updated.get(tenantId));
        tenantFlags.remove(flag);
        if (tenantFlags.isEmpty()) {
            updated.remove(tenantId);
        } else {
            updated.put(tenantId, tenantFlags);
        }
        return new FlagValues(platformDefaults, updated);
    }
}
