package com.raditha.smells.config;

import static com.raditha.smells.config.InvalidConfigurationException.require;

/**
 * @param enabled       Run the detector
 * @param maxParameters Largest explicit parameter count that is not reported
 */
public record LargeParameterListOptions(boolean enabled, int maxParameters) {

    public LargeParameterListOptions {
        require(maxParameters >= 0, "LargeParameterList max_parameters must be >= 0, got: " + maxParameters);
    }

    public static LargeParameterListOptions defaults() {
        return new LargeParameterListOptions(true, 5);
    }
}
