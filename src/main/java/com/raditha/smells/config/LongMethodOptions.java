package com.raditha.smells.config;

import static com.raditha.smells.config.InvalidConfigurationException.require;

/**
 * Long method thresholds.
 *
 * @param enabled       Run the detector
 * @param maxLines      Largest line count (end - start) that is not reported
 * @param maxComplexity Largest cyclomatic complexity that is not reported
 */
public record LongMethodOptions(boolean enabled, int maxLines, int maxComplexity) {

    public LongMethodOptions {
        require(maxLines >= 1, "LongMethod max_lines must be >= 1, got: " + maxLines);
        require(maxComplexity >= 1, "LongMethod max_complexity must be >= 1, got: " + maxComplexity);
    }

    public static LongMethodOptions defaults() {
        return new LongMethodOptions(true, 30, 10);
    }
}
