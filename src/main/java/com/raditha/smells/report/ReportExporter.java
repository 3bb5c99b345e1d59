package com.raditha.smells.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.smells.analyzer.FileFailure;
import com.raditha.smells.analyzer.FileReport;
import com.raditha.smells.analyzer.ProjectReport;
import com.raditha.smells.config.SmellConfig;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.Range;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders project reports as JSON or plain text, and prints the console
 * summary.
 */
public class ReportExporter {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);

    /**
     * Write the report in the given format, creating parent directories.
     */
    public void write(ProjectReport report, Path outputPath, ReportFormat format) throws IOException {
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        switch (format) {
            case JSON -> mapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), toDocument(report));
            case TXT -> Files.writeString(outputPath, toText(report), StandardCharsets.UTF_8);
        }
    }

    /**
     * JSON text of the report.
     */
    public String toJson(ProjectReport report) throws IOException {
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(report));
    }

    /**
     * Serializable view of a report.
     */
    public ReportDocument toDocument(ProjectReport report) {
        List<SmellEntry> smells = new ArrayList<>();
        for (FileReport file : report.files()) {
            for (Finding finding : file.findings()) {
                smells.add(SmellEntry.of(file.sourceFile(), finding));
            }
        }
        List<FailureEntry> failures = report.failures().stream()
                .map(f -> new FailureEntry(f.sourceFile().toString(), f.message(), f.line(), f.column()))
                .toList();

        Metadata metadata = new Metadata(
                report.generatedAt(),
                report.target() != null ? report.target().toString() : null,
                report.files().size(),
                report.totalFindings(),
                report.activeDetectors(),
                report.config());
        return new ReportDocument(metadata, ReportSummary.of(report), smells, failures);
    }

    /**
     * Plain text report.
     */
    public String toText(ProjectReport report) {
        ReportSummary summary = ReportSummary.of(report);
        StringBuilder sb = new StringBuilder();

        sb.append("CODE SMELL DETECTION REPORT\n");
        sb.append("=".repeat(50)).append("\n\n");
        sb.append("Generated at: ").append(report.generatedAt()).append("\n");
        sb.append("Files analyzed: ").append(report.files().size()).append("\n");
        sb.append("Total smells found: ").append(report.totalFindings()).append("\n");
        sb.append("Active detectors: ").append(String.join(", ", report.activeDetectors())).append("\n\n");

        sb.append("SUMMARY\n");
        sb.append("-".repeat(20)).append("\n");
        sb.append("Smells by type:\n");
        summary.smellsByType().forEach((type, count) ->
                sb.append("  ").append(type).append(": ").append(count).append("\n"));
        sb.append("\nSeverity breakdown:\n");
        summary.severityBreakdown().forEach((severity, count) ->
                sb.append("  ").append(severity).append(": ").append(count).append("\n"));

        sb.append("\nDETAILED FINDINGS\n");
        sb.append("-".repeat(20)).append("\n");
        for (FileReport file : report.files()) {
            for (Finding finding : file.findings()) {
                sb.append("\n").append(finding.kind().displayName())
                        .append(" - ").append(finding.severity().name()).append("\n");
                sb.append("File: ").append(file.sourceFile()).append("\n");
                sb.append("Lines: ").append(finding.range().toDisplayString()).append("\n");
                sb.append("Message: ").append(finding.message()).append("\n");
                if (!finding.metrics().isEmpty()) {
                    sb.append("Details:\n");
                    finding.metrics().forEach((name, value) ->
                            sb.append("  ").append(name).append(": ").append(value).append("\n"));
                }
            }
        }

        if (report.hasFailures()) {
            sb.append("\nFAILED FILES\n");
            sb.append("-".repeat(20)).append("\n");
            for (FileFailure failure : report.failures()) {
                sb.append(failure.sourceFile()).append(": ").append(failure.message()).append("\n");
            }
        }
        return sb.toString();
    }

    /**
     * Print a summary of the report to the console.
     */
    public void printSummary(ProjectReport report, PrintWriter out) {
        ReportSummary summary = ReportSummary.of(report);

        out.println();
        out.println("=".repeat(60));
        out.println("CODE SMELL DETECTION SUMMARY");
        out.println("=".repeat(60));
        out.printf("Files analyzed: %d%n", report.files().size());
        out.printf("Total smells found: %d%n", report.totalFindings());
        out.printf("Active detectors: %s%n", String.join(", ", report.activeDetectors()));
        if (report.hasFailures()) {
            out.printf("Files skipped: %d%n", report.failures().size());
        }

        out.println();
        out.println("Smells by type:");
        summary.smellsByType().forEach((type, count) -> out.printf("  %s: %d%n", type, count));

        out.println();
        out.println("Severity breakdown:");
        summary.severityBreakdown().forEach((severity, count) -> out.printf("  %s: %d%n", severity, count));
        out.println("=".repeat(60));
        out.flush();
    }

    /**
     * JSON document root.
     */
    public record ReportDocument(
            Metadata metadata,
            ReportSummary summary,
            List<SmellEntry> smells,
            List<FailureEntry> failures) {
    }

    public record Metadata(
            LocalDateTime generatedAt,
            String target,
            int totalFilesAnalyzed,
            int totalSmellsFound,
            List<String> activeDetectors,
            SmellConfig configUsed) {
    }

    /**
     * One finding as written to the report.
     */
    public record SmellEntry(
            String smellType,
            String severity,
            String filePath,
            int lineNumber,
            int endLine,
            String symbol,
            String message,
            Map<String, Number> details,
            List<String> locations) {

        static SmellEntry of(Path file, Finding finding) {
            return new SmellEntry(
                    finding.kind().displayName(),
                    finding.severity().label(),
                    file.toString(),
                    finding.startLine(),
                    finding.endLine(),
                    finding.symbol(),
                    finding.message(),
                    finding.metrics(),
                    finding.locations().stream().map(Range::toDisplayString).toList());
        }
    }

    public record FailureEntry(String filePath, String message, int line, int column) {
    }
}
