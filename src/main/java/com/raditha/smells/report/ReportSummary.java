package com.raditha.smells.report;

import com.raditha.smells.analyzer.FileReport;
import com.raditha.smells.analyzer.ProjectReport;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.Severity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Finding counts of a project report.
 *
 * @param smellsByType      Count per smell display name, in first-seen order
 * @param smellsByFile      Count per file with at least one finding, in file order
 * @param severityBreakdown Count per severity label, every severity present
 */
public record ReportSummary(
        Map<String, Integer> smellsByType,
        Map<String, Integer> smellsByFile,
        Map<String, Integer> severityBreakdown) {

    public ReportSummary {
        smellsByType = Collections.unmodifiableMap(new LinkedHashMap<>(smellsByType));
        smellsByFile = Collections.unmodifiableMap(new LinkedHashMap<>(smellsByFile));
        severityBreakdown = Collections.unmodifiableMap(new LinkedHashMap<>(severityBreakdown));
    }

    public static ReportSummary of(ProjectReport report) {
        Map<String, Integer> byType = new LinkedHashMap<>();
        Map<String, Integer> byFile = new LinkedHashMap<>();
        Map<String, Integer> bySeverity = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            bySeverity.put(severity.label(), 0);
        }

        for (FileReport file : report.files()) {
            for (Finding finding : file.findings()) {
                byType.merge(finding.kind().displayName(), 1, Integer::sum);
                byFile.merge(file.sourceFile().toString(), 1, Integer::sum);
                bySeverity.merge(finding.severity().label(), 1, Integer::sum);
            }
        }
        return new ReportSummary(byType, byFile, bySeverity);
    }

    public int total() {
        return smellsByType.values().stream().mapToInt(Integer::intValue).sum();
    }
}
