package com.raditha.smells.analyzer;

import com.raditha.smells.model.Finding;
import com.raditha.smells.model.SmellKind;

import java.nio.file.Path;
import java.util.List;

/**
 * Findings of one analyzed file.
 *
 * @param sourceFile Analyzed file
 * @param findings   Ordered findings
 */
public record FileReport(Path sourceFile, List<Finding> findings) {

    public FileReport {
        findings = List.copyOf(findings);
    }

    public boolean hasFindings() {
        return !findings.isEmpty();
    }

    public List<Finding> findingsOf(SmellKind kind) {
        return findings.stream()
                .filter(f -> f.kind() == kind)
                .toList();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format("%s: %d smell(s)", sourceFile, findings.size());
    }
}
