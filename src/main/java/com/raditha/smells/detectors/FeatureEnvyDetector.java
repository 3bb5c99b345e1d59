package com.raditha.smells.detectors;

import com.raditha.smells.config.FeatureEnvyOptions;
import com.raditha.smells.model.AttributeAccess;
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
 * Flags methods that use another object's members more than their own.
 * <p>
 * Accesses arrive already classified as self or foreign. Foreign accesses are
 * grouped by the object they reach, and each group is judged on its own against
 * the method's total self accesses, so one method may envy several objects.
 */
public class FeatureEnvyDetector implements SmellDetector {

    private final FeatureEnvyOptions options;

    public FeatureEnvyDetector(FeatureEnvyOptions options) {
        this.options = Thresholds.requireOptions(options, "FeatureEnvy");
    }

    @Override
    public SmellKind kind() {
        return SmellKind.FEATURE_ENVY;
    }

    @Override
    public List<Finding> detect(SourceUnit unit) {
        List<Finding> findings = new ArrayList<>();
        for (FunctionDef function : unit.functions()) {
            findings.addAll(check(function));
        }
        return findings;
    }

    private List<Finding> check(FunctionDef function) {
        int selfCount = 0;
        Map<String, Integer> foreignCounts = new LinkedHashMap<>();
        for (AttributeAccess access : function.accesses()) {
            if (access.isSelf()) {
                selfCount++;
            } else {
                foreignCounts.merge(access.target(), 1, Integer::sum);
            }
        }

        List<Finding> findings = new ArrayList<>();
        for (Map.Entry<String, Integer> group : foreignCounts.entrySet()) {
            int foreignCount = group.getValue();
            double ratio = (double) foreignCount / Math.max(selfCount, 1);
            if (foreignCount >= options.minForeignAccesses() && ratio >= options.foreignAccessRatio()) {
                findings.add(toFinding(function, group.getKey(), foreignCount, selfCount, ratio));
            }
        }
        return findings;
    }

    private Finding toFinding(FunctionDef function, String target, int foreignCount, int selfCount, double ratio) {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("foreignAccesses", foreignCount);
        metrics.put("selfAccesses", selfCount);
        metrics.put("ratio", ratio);
        metrics.put("minForeignAccesses", options.minForeignAccesses());
        metrics.put("foreignAccessRatio", options.foreignAccessRatio());

        return new Finding(
                kind(),
                Severity.MEDIUM,
                function.range(),
                function.qualifiedName(),
                String.format("Method '%s' shows feature envy towards '%s' (foreign accesses: %d, self accesses: %d, ratio: %.2f)",
                        function.qualifiedName(), target, foreignCount, selfCount, ratio),
                metrics);
    }
}
