package com.raditha.smells.config;

import static com.raditha.smells.config.InvalidConfigurationException.require;

/**
 * @param enabled            Run the detector
 * @param minForeignAccesses Smallest number of accesses to one foreign object
 *                           that is reported
 * @param foreignAccessRatio Smallest foreign/self access ratio that is reported
 */
public record FeatureEnvyOptions(boolean enabled, int minForeignAccesses, double foreignAccessRatio) {

    public FeatureEnvyOptions {
        require(minForeignAccesses >= 0,
                "FeatureEnvy min_foreign_accesses must be >= 0, got: " + minForeignAccesses);
        require(foreignAccessRatio >= 0.0 && Double.isFinite(foreignAccessRatio),
                "FeatureEnvy foreign_access_ratio must be a finite value >= 0, got: " + foreignAccessRatio);
    }

    public static FeatureEnvyOptions defaults() {
        return new FeatureEnvyOptions(true, 2, 0.5);
    }
}
