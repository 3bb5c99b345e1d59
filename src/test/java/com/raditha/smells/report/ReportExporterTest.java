package com.raditha.smells.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.smells.analyzer.FileFailure;
import com.raditha.smells.analyzer.FileReport;
import com.raditha.smells.analyzer.ProjectReport;
import com.raditha.smells.config.SmellConfig;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.Range;
import com.raditha.smells.model.Severity;
import com.raditha.smells.model.SmellKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportExporterTest {

    @TempDir
    Path tempDir;

    private ReportExporter exporter;
    private ProjectReport report;

    @BeforeEach
    void setUp() {
        exporter = new ReportExporter();

        Finding longMethod = new Finding(SmellKind.LONG_METHOD, Severity.HIGH, Range.ofLines(4, 70),
                "Billing.run", "Method 'Billing.run' is too long (66 lines, threshold: 30)",
                Map.of("lineCount", 66, "maxLines", 30));
        Finding magic = new Finding(SmellKind.MAGIC_NUMBERS, Severity.MEDIUM, Range.ofLines(10, 20),
                "42", "Magic number '42' appears 3 times (lines 10, 15, 20)",
                Map.of("occurrences", 3),
                List.of(Range.ofLines(10, 10), Range.ofLines(15, 15), Range.ofLines(20, 20)));

        report = new ProjectReport(
                LocalDateTime.of(2024, 3, 1, 12, 30, 15),
                Path.of("src"),
                List.of("LongMethod", "MagicNumbers"),
                List.of(new FileReport(Path.of("src", "Billing.java"), List.of(longMethod, magic)),
                        new FileReport(Path.of("src", "Clean.java"), List.of())),
                List.of(new FileFailure(Path.of("src", "Broken.java"), "Parse error", 2, 14)),
                SmellConfig.defaults());
    }

    @Test
    void testJsonStructure() throws IOException {
        JsonNode root = new ObjectMapper().readTree(exporter.toJson(report));

        JsonNode metadata = root.get("metadata");
        assertEquals("2024-03-01T12:30:15", metadata.get("generated_at").asText());
        assertEquals(2, metadata.get("total_files_analyzed").asInt());
        assertEquals(2, metadata.get("total_smells_found").asInt());
        assertEquals(30, metadata.get("config_used").get("long_method").get("max_lines").asInt());

        JsonNode summary = root.get("summary");
        assertEquals(1, summary.get("smells_by_type").get("LongMethod").asInt());
        assertEquals(1, summary.get("severity_breakdown").get("high").asInt());
        assertEquals(1, summary.get("severity_breakdown").get("medium").asInt());
        assertEquals(0, summary.get("severity_breakdown").get("low").asInt());

        JsonNode smells = root.get("smells");
        assertEquals(2, smells.size());
        assertEquals("LongMethod", smells.get(0).get("smell_type").asText());
        assertEquals("high", smells.get(0).get("severity").asText());
        assertEquals(4, smells.get(0).get("line_number").asInt());
        assertEquals(66, smells.get(0).get("details").get("lineCount").asInt());
        assertEquals("L15", smells.get(1).get("locations").get(1).asText());

        assertEquals(14, root.get("failures").get(0).get("column").asInt());
    }

    @Test
    void testTextReport() {
        String text = exporter.toText(report);

        assertTrue(text.startsWith("CODE SMELL DETECTION REPORT"));
        assertTrue(text.contains("SUMMARY"));
        assertTrue(text.contains("  LongMethod: 1"));
        assertTrue(text.contains("DETAILED FINDINGS"));
        assertTrue(text.contains("LongMethod - HIGH"));
        assertTrue(text.contains("Lines: L4-70"));
        assertTrue(text.contains("FAILED FILES"));
    }

    @Test
    void testWriteCreatesDirectories() throws IOException {
        Path json = tempDir.resolve("out").resolve("report.json");
        Path txt = tempDir.resolve("out").resolve("report.txt");

        exporter.write(report, json, ReportFormat.JSON);
        exporter.write(report, txt, ReportFormat.TXT);

        assertTrue(Files.readString(json).contains("\"smell_type\""));
        assertTrue(Files.readString(txt).contains("DETAILED FINDINGS"));
    }

    @Test
    void testPrintSummary() {
        StringWriter buffer = new StringWriter();

        exporter.printSummary(report, new PrintWriter(buffer));

        String summary = buffer.toString();
        assertTrue(summary.contains("CODE SMELL DETECTION SUMMARY"));
        assertTrue(summary.contains("Total smells found: 2"));
        assertTrue(summary.contains("Files skipped: 1"));
        assertTrue(summary.contains("  MagicNumbers: 1"));
    }

    @Test
    void testSummaryCounts() {
        ReportSummary summary = ReportSummary.of(report);

        assertEquals(2, summary.total());
        assertEquals(1, summary.smellsByFile().size());
        assertEquals(List.of("high", "medium", "low"), List.copyOf(summary.severityBreakdown().keySet()));
    }
}
