package com.raditha.smells.config;

import static com.raditha.smells.config.InvalidConfigurationException.require;

/**
 * God class thresholds. All three must be positive since severity is derived
 * from measured/threshold ratios.
 *
 * @param enabled    Run the detector
 * @param maxFields  Largest field count that is not reported
 * @param maxMethods Largest method count that is not reported
 * @param maxLines   Largest line count that is not reported
 */
public record GodClassOptions(boolean enabled, int maxFields, int maxMethods, int maxLines) {

    public GodClassOptions {
        require(maxFields >= 1, "GodClass max_fields must be >= 1, got: " + maxFields);
        require(maxMethods >= 1, "GodClass max_methods must be >= 1, got: " + maxMethods);
        require(maxLines >= 1, "GodClass max_lines must be >= 1, got: " + maxLines);
    }

    public static GodClassOptions defaults() {
        return new GodClassOptions(true, 15, 20, 200);
    }
}
