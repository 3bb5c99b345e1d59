package com.raditha.smells.detectors;

import com.raditha.smells.config.LongMethodOptions;
import com.raditha.smells.metrics.ComplexityAnalyzer;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.FunctionDef;
import com.raditha.smells.model.Severity;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.model.SourceUnit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags functions that are too long or too complex. A function over both
 * thresholds yields a single finding naming both.
 */
public class LongMethodDetector implements SmellDetector {

    private final LongMethodOptions options;
    private final ComplexityAnalyzer complexityAnalyzer;

    public LongMethodDetector(LongMethodOptions options) {
        this(options, new ComplexityAnalyzer());
    }

    public LongMethodDetector(LongMethodOptions options, ComplexityAnalyzer complexityAnalyzer) {
        this.options = Thresholds.requireOptions(options, "LongMethod");
        this.complexityAnalyzer = complexityAnalyzer;
    }

    @Override
    public SmellKind kind() {
        return SmellKind.LONG_METHOD;
    }

    @Override
    public List<Finding> detect(SourceUnit unit) {
        List<Finding> findings = new ArrayList<>();
        for (FunctionDef function : unit.functions()) {
            Finding finding = check(function);
            if (finding != null) {
                findings.add(finding);
            }
        }
        return findings;
    }

    private Finding check(FunctionDef function) {
        int lineCount = function.lineCount();
        int complexity = complexityAnalyzer.complexity(function);
        boolean tooLong = lineCount > options.maxLines();
        boolean tooComplex = complexity > options.maxComplexity();
        if (!tooLong && !tooComplex) {
            return null;
        }

        List<String> reasons = new ArrayList<>();
        if (tooLong) {
            reasons.add(String.format("too long (%d lines, threshold: %d)", lineCount, options.maxLines()));
        }
        if (tooComplex) {
            reasons.add(String.format("too complex (complexity %d, threshold: %d)",
                    complexity, options.maxComplexity()));
        }

        boolean high = Thresholds.ratio(lineCount, options.maxLines()) > Thresholds.HIGH_SEVERITY_FACTOR
                || Thresholds.ratio(complexity, options.maxComplexity()) > Thresholds.HIGH_SEVERITY_FACTOR;

        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("lineCount", lineCount);
        metrics.put("maxLines", options.maxLines());
        metrics.put("complexity", complexity);
        metrics.put("maxComplexity", options.maxComplexity());

        return new Finding(
                kind(),
                high ? Severity.HIGH : Severity.MEDIUM,
                function.range(),
                function.qualifiedName(),
                "Method '" + function.qualifiedName() + "' is " + String.join(" and ", reasons),
                metrics);
    }
}
