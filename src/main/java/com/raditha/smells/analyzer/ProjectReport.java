package com.raditha.smells.analyzer;

import com.raditha.smells.config.SmellConfig;
import com.raditha.smells.model.Finding;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of a multi-file run.
 *
 * @param generatedAt     Time the run finished
 * @param target          File or directory that was analyzed
 * @param activeDetectors Display names of the detectors that ran
 * @param files           Per-file results in path order
 * @param failures        Files that could not be read or parsed
 * @param config          Configuration used
 */
public record ProjectReport(
        LocalDateTime generatedAt,
        Path target,
        List<String> activeDetectors,
        List<FileReport> files,
        List<FileFailure> failures,
        SmellConfig config) {

    public ProjectReport {
        activeDetectors = List.copyOf(activeDetectors);
        files = List.copyOf(files);
        failures = List.copyOf(failures);
    }

    /**
     * All findings, file by file.
     */
    public List<Finding> allFindings() {
        return files.stream()
                .flatMap(f -> f.findings().stream())
                .toList();
    }

    public int totalFindings() {
        return files.stream().mapToInt(f -> f.findings().size()).sum();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
