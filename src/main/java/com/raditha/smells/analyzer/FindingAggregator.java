package com.raditha.smells.analyzer;

import com.raditha.smells.model.Finding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merges detector outputs into one ordered list.
 * Severities are kept as the detectors computed them and nothing is
 * deduplicated across smell kinds.
 */
public class FindingAggregator {

    /**
     * Start line, then smell kind declaration order, then start column and
     * message.
     */
    public static final Comparator<Finding> FILE_ORDER = Comparator
            .comparingInt(Finding::startLine)
            .thenComparing(Finding::kind)
            .thenComparingInt(f -> f.range().startColumn())
            .thenComparing(Finding::message);

    /**
     * Merge and order the findings of several detectors.
     *
     * @param detectorOutputs One list per detector
     * @return New ordered list
     */
    public List<Finding> aggregate(List<List<Finding>> detectorOutputs) {
        List<Finding> all = new ArrayList<>();
        for (List<Finding> output : detectorOutputs) {
            all.addAll(output);
        }
        all.sort(FILE_ORDER);
        return all;
    }
}
