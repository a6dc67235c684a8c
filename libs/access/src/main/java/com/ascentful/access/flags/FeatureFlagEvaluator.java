package com.ascentful.access.flags;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Resolves named flags against a {@link FeatureFlagSource}. Never blocks and never throws:
 * a failing source reads as {@link FlagState#UNKNOWN}.
 */
public class FeatureFlagEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FeatureFlagEvaluator.class);

    private final FeatureFlagSource source;

    public FeatureFlagEvaluator(FeatureFlagSource source) {
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
        this.source = source;
    }

    /**
     * Evaluates a flag at platform level (no tenant override).
     */
    public FlagState evaluate(String flag) {
        return evaluate(flag, null);
    }

    /**
     * Evaluates a flag for a tenant.
     */
    public FlagState evaluate(String flag, String tenantId) {
        return snapshot(tenantId).stateOf(flag);
    }

    /**
     * Captures the source once for the given tenant.
     *
     * @param tenantId effective organization of the caller (nullable)
     */
    public FeatureFlagState snapshot(String tenantId) {
        Optional<FlagValues> values;
        try {
            values = source.currentValues();
        } catch (RuntimeException e) {
            log.warn("Feature flag source failed, flags resolve to UNKNOWN: {}", e.getMessage());
            return FeatureFlagState.unavailable();
        }
        return values.map(v -> FeatureFlagState.of(v, tenantId)).orElse(FeatureFlagState.notLoaded());
    }
}
