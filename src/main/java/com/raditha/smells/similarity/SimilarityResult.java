package com.raditha.smells.similarity;

/**
 * Result of comparing two function bodies.
 *
 * @param tokenScore      Token set similarity (0.0-1.0)
 * @param structuralScore Statement-kind similarity (0.0-1.0)
 */
public record SimilarityResult(double tokenScore, double structuralScore) {

    /**
     * Final similarity: the higher of the two scores.
     */
    public double overallScore() {
        return Math.max(tokenScore, structuralScore);
    }

    /**
     * Check if similarity reaches a threshold.
     */
    public boolean exceedsThreshold(double threshold) {
        return overallScore() >= threshold;
    }
}
