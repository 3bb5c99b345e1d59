package com.raditha.smells.detectors;

import com.raditha.smells.config.GodClassOptions;
import com.raditha.smells.model.ClassDef;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.Severity;
import com.raditha.smells.model.SmellKind;
import com.raditha.smells.model.SourceUnit;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags classes with too many fields, too many methods or too many lines.
 * Severity follows the worst measured/threshold ratio.
 */
public class GodClassDetector implements SmellDetector {

    private final GodClassOptions options;

    public GodClassDetector(GodClassOptions options) {
        this.options = Thresholds.requireOptions(options, "GodClass");
    }

    @Override
    public SmellKind kind() {
        return SmellKind.GOD_CLASS;
    }

    @Override
    public List<Finding> detect(SourceUnit unit) {
        List<Finding> findings = new ArrayList<>();
        for (ClassDef classDef : unit.classes()) {
            Finding finding = check(classDef);
            if (finding != null) {
                findings.add(finding);
            }
        }
        return findings;
    }

    private Finding check(ClassDef classDef) {
        int fieldCount = classDef.fieldCount();
        int methodCount = classDef.methodCount();
        int lineCount = classDef.lineCount();

        List<String> exceeded = new ArrayList<>();
        if (fieldCount > options.maxFields()) {
            exceeded.add(String.format("too many fields (%d, threshold: %d)", fieldCount, options.maxFields()));
        }
        if (methodCount > options.maxMethods()) {
            exceeded.add(String.format("too many methods (%d, threshold: %d)", methodCount, options.maxMethods()));
        }
        if (lineCount > options.maxLines()) {
            exceeded.add(String.format("too many lines (%d, threshold: %d)", lineCount, options.maxLines()));
        }
        if (exceeded.isEmpty()) {
            return null;
        }

        double maxRatio = Math.max(
                Thresholds.ratio(fieldCount, options.maxFields()),
                Math.max(Thresholds.ratio(methodCount, options.maxMethods()),
                        Thresholds.ratio(lineCount, options.maxLines())));

        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("fieldCount", fieldCount);
        metrics.put("maxFields", options.maxFields());
        metrics.put("methodCount", methodCount);
        metrics.put("maxMethods", options.maxMethods());
        metrics.put("lineCount", lineCount);
        metrics.put("maxLines", options.maxLines());
        metrics.put("maxRatio", maxRatio);

        return new Finding(
                kind(),
                maxRatio > Thresholds.HIGH_SEVERITY_FACTOR ? Severity.HIGH : Severity.MEDIUM,
                classDef.range(),
                classDef.name(),
                "Class '" + classDef.name() + "' has " + String.join(", ", exceeded),
                metrics);
    }
}
