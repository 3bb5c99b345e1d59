package com.raditha.smells.similarity;

import java.util.List;
import java.util.Objects;

/**
 * Calculates similarity using Levenshtein edit distance.
 * Space-optimized dynamic programming implementation.
 */
public class LevenshteinSimilarity {

    /**
     * Calculate Levenshtein-based similarity between two sequences.
     *
     * @param first  First sequence
     * @param second Second sequence
     * @return Similarity score (0.0 to 1.0), {@code 1 - distance / maxLength}
     */
    public <T> double calculate(List<T> first, List<T> second) {
        if (first == null || second == null) {
            return 0.0;
        }

        if (first.isEmpty() && second.isEmpty()) {
            return 1.0;
        }

        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }

        int distance = editDistance(first, second);
        int maxLength = Math.max(first.size(), second.size());
        return 1.0 - ((double) distance / maxLength);
    }

    /**
     * Levenshtein distance using two rolling rows of the shorter length.
     */
    public <T> int editDistance(List<T> first, List<T> second) {
        List<T> shorter = first.size() <= second.size() ? first : second;
        List<T> longer = shorter == first ? second : first;

        int m = shorter.size();
        int n = longer.size();

        int[] prev = new int[m + 1];
        int[] curr = new int[m + 1];
        for (int i = 0; i <= m; i++) {
            prev[i] = i;
        }

        for (int j = 1; j <= n; j++) {
            curr[0] = j;
            for (int i = 1; i <= m; i++) {
                if (Objects.equals(shorter.get(i - 1), longer.get(j - 1))) {
                    curr[i] = prev[i - 1];
                } else {
                    // delete, insert or replace
                    curr[i] = 1 + Math.min(Math.min(prev[i], curr[i - 1]), prev[i - 1]);
                }
            }
            int[] swap = prev;
            prev = curr;
            curr = swap;
        }

        return prev[m];
    }
}
