package com.raditha.smells.detectors;

import com.raditha.smells.config.MagicNumbersOptions;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.LiteralOccurrence;
import com.raditha.smells.model.Range;
import com.raditha.smells.model.Severity;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.model.SourceUnit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flags numeric values repeated across a unit. Occurrences are grouped by exact
 * value regardless of the function they appear in.
 */
public class MagicNumbersDetector implements SmellDetector {

    private final MagicNumbersOptions options;

    public MagicNumbersDetector(MagicNumbersOptions options) {
        this.options = Thresholds.requireOptions(options, "MagicNumbers");
    }

    @Override
    public SmellKind kind() {
        return SmellKind.MAGIC_NUMBERS;
    }

    @Override
    public List<Finding> detect(SourceUnit unit) {
        Map<Double, List<LiteralOccurrence>> groups = new LinkedHashMap<>();
        for (LiteralOccurrence literal : unit.literals()) {
            double value = literal.value();
            if (!options.isInRange(value) || options.isWhitelisted(value)) {
                continue;
            }
            // +0.0 folds -0.0 into the same key
            groups.computeIfAbsent(value + 0.0, v -> new ArrayList<>()).add(literal);
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<Double, List<LiteralOccurrence>> group : groups.entrySet()) {
            List<LiteralOccurrence> occurrences = group.getValue();
            if (occurrences.size() >= options.minOccurrences()) {
                findings.add(toFinding(group.getKey(), occurrences));
            }
        }
        return findings;
    }

    private Finding toFinding(double value, List<LiteralOccurrence> occurrences) {
        LiteralOccurrence first = occurrences.get(0);
        LiteralOccurrence last = occurrences.get(occurrences.size() - 1);

        List<Range> locations = occurrences.stream()
                .map(o -> Range.ofLines(o.line(), o.line()))
                .toList();
        String lines = occurrences.stream()
                .map(o -> String.valueOf(o.line()))
                .collect(Collectors.joining(", "));
        String display = formatValue(value);

        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("value", value);
        metrics.put("occurrences", occurrences.size());
        metrics.put("minOccurrences", options.minOccurrences());

        return new Finding(
                kind(),
                Severity.MEDIUM,
                Range.ofLines(first.line(), last.line()),
                display,
                String.format("Magic number '%s' appears %d times (lines %s)", display, occurrences.size(), lines),
                metrics,
                locations);
    }

    /**
     * Integral values without a fractional part, everything else as written by
     * {@link Double#toString(double)}.
     */
    static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
