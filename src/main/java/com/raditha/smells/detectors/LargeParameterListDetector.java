package com.raditha.smells.detectors;

import com.raditha.smells.config.LargeParameterListOptions;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.FunctionDef;
import com.raditha.smells.model.ParameterDef;
import com.raditha.smells.model.Severity;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.model.SourceUnit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Flags functions declaring more parameters than allowed. A receiver parameter
 * does not count.
 */
public class LargeParameterListDetector implements SmellDetector {

    private final LargeParameterListOptions options;

    public LargeParameterListDetector(LargeParameterListOptions options) {
        this.options = Thresholds.requireOptions(options, "LargeParameterList");
    }

    @Override
    public SmellKind kind() {
        return SmellKind.LARGE_PARAMETER_LIST;
    }

    @Override
    public List<Finding> detect(SourceUnit unit) {
        List<Finding> findings = new ArrayList<>();
        for (FunctionDef function : unit.functions()) {
            int count = function.explicitParameterCount();
            if (count <= options.maxParameters()) {
                continue;
            }

            String names = function.parameters().stream()
                    .filter(p -> !p.implicitReceiver())
                    .map(ParameterDef::name)
                    .collect(Collectors.joining(", "));

            Map<String, Number> metrics = new LinkedHashMap<>();
            metrics.put("parameterCount", count);
            metrics.put("maxParameters", options.maxParameters());

            findings.add(new Finding(
                    kind(),
                    count > 2 * options.maxParameters() ? Severity.HIGH : Severity.MEDIUM,
                    function.range(),
                    function.qualifiedName(),
                    String.format("Method '%s' has too many parameters (%d, threshold: %d): %s",
                            function.qualifiedName(), count, options.maxParameters(), names),
                    metrics));
        }
        return findings;
    }
}
