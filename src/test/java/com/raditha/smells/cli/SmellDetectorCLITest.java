package com.raditha.smells.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SmellDetectorCLITest {

    @TempDir
    Path tempDir;

    private Path sources;
    private Path noConfig;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        sources = Files.createDirectory(tempDir.resolve("src"));
        Files.writeString(sources.resolve("Booking.java"), """
                class Booking {
                    void reserve(String a, String b, String c, String d, String e, String f) {
                    }
                }
                """);
        noConfig = tempDir.resolve("missing-config.yaml");
        out = new StringWriter();
        err = new StringWriter();
    }

    private int run(String... args) {
        CommandLine cmd = SmellDetectorCLI.createCommandLine();
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    @Test
    void testJsonReportWritten() throws IOException {
        Path output = tempDir.resolve("report.json");

        int exitCode = run(sources.toString(), "-c", noConfig.toString(), "-o", output.toString());

        assertEquals(0, exitCode, err.toString());
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals(1, root.get("metadata").get("total_smells_found").asInt());
        assertTrue(out.toString().contains("CODE SMELL DETECTION SUMMARY"));
        assertTrue(out.toString().contains("Report saved to: " + output));
    }

    @Test
    void testTextFormat() throws IOException {
        Path output = tempDir.resolve("report.txt");

        int exitCode = run(sources.toString(), "-c", noConfig.toString(), "-o", output.toString(), "-f", "TXT");

        assertEquals(0, exitCode, err.toString());
        assertTrue(Files.readString(output).startsWith("CODE SMELL DETECTION REPORT"));
    }

    @Test
    void testFormatFromConfigFile() throws IOException {
        Path config = tempDir.resolve("config.yaml");
        Files.writeString(config, "report:\n  format: txt\n");
        Path output = tempDir.resolve("report.out");

        assertEquals(0, run(sources.toString(), "-c", config.toString(), "-o", output.toString()));
        assertTrue(Files.readString(output).contains("DETAILED FINDINGS"));
    }

    @Test
    void testOnlyAndExclude() throws IOException {
        Path output = tempDir.resolve("report.json");

        int exitCode = run(sources.toString(), "-c", noConfig.toString(), "-o", output.toString(),
                "--only", "LargeParameterList,LongMethod", "--exclude", "LargeParameterList");

        assertEquals(0, exitCode, err.toString());
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertEquals(0, root.get("metadata").get("total_smells_found").asInt());
        assertEquals("LongMethod", root.get("metadata").get("active_detectors").get(0).asText());
    }

    @Test
    void testUnknownDetector() {
        int exitCode = run(sources.toString(), "-c", noConfig.toString(), "--only", "Foo");

        assertEquals(2, exitCode);
        assertTrue(err.toString().contains("Unknown detector 'Foo'"));
    }

    @Test
    void testMissingTarget() {
        assertEquals(2, run(tempDir.resolve("nothing").toString(), "-c", noConfig.toString()));
    }

    @Test
    void testInvalidConfig() throws IOException {
        Path config = tempDir.resolve("bad.yaml");
        Files.writeString(config, "LongMethod:\n  max_lines: -3\n");

        assertEquals(2, run(sources.toString(), "-c", config.toString()));
    }

    @Test
    void testBadFormatOption() {
        assertEquals(2, run(sources.toString(), "-f", "xml"));
    }
}
