package com.raditha.smells.detectors;

import com.raditha.smells.config.InvalidConfigurationException;

/**
 * Helpers shared by the threshold-based detectors.
 */
final class Thresholds {

    /**
     * Measured values above this multiple of their threshold are HIGH severity.
     */
    static final double HIGH_SEVERITY_FACTOR = 1.5;

    private Thresholds() {
        /* this is only a utility class */
    }

    static <T> T requireOptions(T options, String detector) {
        if (options == null) {
            throw new InvalidConfigurationException(detector + " options cannot be null");
        }
        return options;
    }

    static double ratio(int measured, int threshold) {
        return (double) measured / threshold;
    }
}
