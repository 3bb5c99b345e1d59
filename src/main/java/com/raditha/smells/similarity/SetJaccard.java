package com.raditha.smells.similarity;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Jaccard index of the distinct values of two sequences. How often a value
 * repeats does not matter, so {@code [a, a, b]} and {@code [a, b]} are equal.
 */
final class SetJaccard {

    private SetJaccard() {
        /* this is only a utility class */
    }

    static <T> double similarity(Collection<T> first, Collection<T> second) {
        Set<T> set1 = new HashSet<>(first);
        Set<T> set2 = new HashSet<>(second);
        if (set1.isEmpty() && set2.isEmpty()) {
            return 1.0;
        }
        if (set1.isEmpty() || set2.isEmpty()) {
            return 0.0;
        }

        Set<T> intersection = new HashSet<>(set1);
        intersection.retainAll(set2);

        Set<T> union = new HashSet<>(set1);
        union.addAll(set2);

        return (double) intersection.size() / union.size();
    }
}
