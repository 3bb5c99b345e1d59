package com.raditha.smells.config;

import java.util.List;

import static com.raditha.smells.config.InvalidConfigurationException.require;

/**
 * Magic number filters.
 *
 * @param enabled        Run the detector
 * @param minOccurrences Smallest group size that is reported
 * @param whitelist      Values never reported
 * @param minValue       Lower bound of the reported value range (inclusive)
 * @param maxValue       Upper bound of the reported value range (inclusive)
 */
public record MagicNumbersOptions(
        boolean enabled,
        int minOccurrences,
        List<Double> whitelist,
        double minValue,
        double maxValue) {

    public MagicNumbersOptions {
        require(minOccurrences >= 1, "MagicNumbers min_occurrences must be >= 1, got: " + minOccurrences);
        require(!Double.isNaN(minValue) && !Double.isNaN(maxValue), "MagicNumbers value range must be numeric");
        require(minValue <= maxValue,
                "MagicNumbers min_value (" + minValue + ") must not exceed max_value (" + maxValue + ")");
        require(whitelist != null, "MagicNumbers whitelist cannot be null");
        whitelist = List.copyOf(whitelist);
    }

    public static MagicNumbersOptions defaults() {
        return new MagicNumbersOptions(true, 3, List.of(0.0, 1.0, -1.0), 2, 1000);
    }

    /**
     * True if the value is whitelisted. Compared numerically, so 0 and -0
     * are the same value.
     */
    public boolean isWhitelisted(double value) {
        for (Double allowed : whitelist) {
            if (allowed == value) {
                return true;
            }
        }
        return false;
    }

    public boolean isInRange(double value) {
        return value >= minValue && value <= maxValue;
    }
}
