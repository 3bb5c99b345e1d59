package com.raditha.smells.config;

import static com.raditha.smells.config.InvalidConfigurationException.require;

/**
 * @param enabled       Run the detector
 * @param minSimilarity Smallest similarity reported (0.0-1.0)
 * @param minChunkSize  Smallest statement count of an eligible function, and
 *                      smallest line count of the shorter function of a pair
 */
public record DuplicatedCodeOptions(boolean enabled, double minSimilarity, int minChunkSize) {

    public DuplicatedCodeOptions {
        require(minSimilarity >= 0.0 && minSimilarity <= 1.0,
                "DuplicatedCode min_similarity must be between 0.0 and 1.0, got: " + minSimilarity);
        require(minChunkSize >= 1, "DuplicatedCode min_chunk_size must be >= 1, got: " + minChunkSize);
    }

    public static DuplicatedCodeOptions defaults() {
        return new DuplicatedCodeOptions(true, 0.8, 3);
    }
}
