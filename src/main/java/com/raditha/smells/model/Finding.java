package com.raditha.smells.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One detected smell.
 *
 * @param kind      Smell kind
 * @param severity  Severity as computed by the detector
 * @param range     Primary location
 * @param symbol    Function, class or literal the finding is about
 * @param message   Human-readable explanation with measured values and thresholds
 * @param metrics   Values justifying the severity, in insertion order
 * @param locations Related locations (all occurrences, both duplicates); at
 *                  least the primary range
 */
public record Finding(
        SmellKind kind,
        Severity severity,
        Range range,
        String symbol,
        String message,
        Map<String, Number> metrics,
        List<Range> locations) {

    public Finding {
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        locations = locations == null || locations.isEmpty() ? List.of(range) : List.copyOf(locations);
    }

    public Finding(SmellKind kind, Severity severity, Range range, String symbol,
            String message, Map<String, Number> metrics) {
        this(kind, severity, range, symbol, message, metrics, List.of(range));
    }

    public int startLine() {
        return range.startLine();
    }

    public int endLine() {
        return range.endLine();
    }

    /**
     * Numeric metric value, or NaN if the detector did not record it.
     */
    public double metric(String name) {
        Number value = metrics.get(name);
        return value != null ? value.doubleValue() : Double.NaN;
    }
}
