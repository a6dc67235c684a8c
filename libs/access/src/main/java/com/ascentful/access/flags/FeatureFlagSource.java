package com.ascentful.access.flags;

import java.util.Optional;

/**
 * External source of raw feature flag values.
 */
public interface FeatureFlagSource {

    /**
     * Returns the latest complete set of values, or empty while the source has not delivered
     * its initial snapshot. Must not block.
     *
     * @throws com.ascentful.access.SourceUnavailableException if the source failed
     */
    Optional<FlagValues> currentValues();
}
