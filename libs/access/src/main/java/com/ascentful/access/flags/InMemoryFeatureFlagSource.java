package com.ascentful.access.flags;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Push-based flag source: an upstream feed (or an operator) publishes values into it and
 * readers always see the last fully applied set.
 * <p>
 * Until the first {@link #publish(FlagValues)} every lookup yields no values, which the
 * evaluator reports as {@link FlagState#UNKNOWN}.
 */
public class InMemoryFeatureFlagSource implements FeatureFlagSource {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFeatureFlagSource.class);

    private final AtomicReference<FlagValues> values = new AtomicReference<>();

    @Override
    public Optional<FlagValues> currentValues() {
        return Optional.ofNullable(values.get());
    }

    /**
     * Replaces all values at once. The first call marks the source as loaded.
     */
    public void publish(FlagValues snapshot) {
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot must not be null");
        }
        FlagValues previous = values.getAndSet(snapshot);
        if (previous == null) {
            log.info("Feature flags loaded: {} platform defaults, {} tenants with overrides",
                    snapshot.platformDefaults().size(), snapshot.tenantOverrides().size());
        }
    }

    public void setPlatformDefault(String flag, boolean enabled) {
        requireFlag(flag);
        values.updateAndGet(current -> base(current).withPlatformDefault(flag, enabled));
        log.info("Platform flag {} set to {}", flag, enabled);
    }

    public void setTenantOverride(String tenantId, String flag, boolean enabled) {
        requireFlag(flag);
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
        values.updateAndGet(current -> base(current).withTenantOverride(tenantId, flag, enabled));
        log.info("Tenant {} flag {} overridden to {}", tenantId, flag, enabled);
    }

    public void clearTenantOverride(String tenantId, String flag) {
        values.updateAndGet(current -> base(current).withoutTenantOverride(tenantId, flag));
        log.info("Tenant {} override for flag {} cleared", tenantId, flag);
    }

    private static FlagValues base(FlagValues current) {
        return current == null ? FlagValues.empty() : current;
    }

    private static void requireFlag(String flag) {
        if (flag == null || flag.isBlank()) {
            throw new IllegalArgumentException("flag must not be null or blank");
        }
    }
}
