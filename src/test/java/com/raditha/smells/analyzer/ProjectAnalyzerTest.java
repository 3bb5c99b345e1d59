package com.raditha.smells.analyzer;

import com.raditha.smells.config.DetectorSelection;
import com.raditha.smells.config.SmellConfig;
import com.raditha.smells.model.SmellKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectAnalyzerTest {

    @TempDir
    Path tempDir;

    private ProjectAnalyzer analyzer;

    @BeforeEach
    void setUp() throws IOException {
        Files.writeString(tempDir.resolve("Good.java"), """
                class Good {
                    void wide(int a, int b, int c, int d, int e, int f) {
                    }
                }
                """);
        Files.writeString(tempDir.resolve("Broken.java"), "class Broken {\n    void m( {\n}\n");
        Files.createDirectories(tempDir.resolve("target"));
        Files.writeString(tempDir.resolve("target").resolve("Gen.java"),
                "class Gen { void g(int a, int b, int c, int d, int e, int f) { } }\n");
        Files.writeString(tempDir.resolve("notes.txt"), "not java");

        analyzer = new ProjectAnalyzer(DetectorSelection.of(SmellConfig.defaults()));
    }

    @Test
    void testDiscoversJavaFilesOutsideExcludedDirectories() throws IOException {
        List<Path> files = analyzer.findSourceFiles(tempDir);

        assertEquals(List.of(tempDir.resolve("Broken.java"), tempDir.resolve("Good.java")), files);
    }

    @Test
    void testParseFailureDoesNotStopRun() throws IOException {
        ProjectReport report = analyzer.analyze(tempDir);

        assertEquals(1, report.files().size());
        assertEquals(1, report.totalFindings());
        assertEquals(SmellKind.LARGE_PARAMETER_LIST, report.allFindings().get(0).kind());
        assertTrue(report.hasFailures());
        assertEquals(tempDir.resolve("Broken.java"), report.failures().get(0).sourceFile());
        assertEquals(6, report.activeDetectors().size());
    }

    @Test
    void testSingleFileTarget() throws IOException {
        ProjectReport report = analyzer.analyze(tempDir.resolve("Good.java"));

        assertEquals(1, report.files().size());
        assertFalse(report.hasFailures());
    }

    @Test
    void testMissingTarget() {
        assertThrows(IOException.class, () -> analyzer.analyze(tempDir.resolve("nowhere")));
    }

    @Test
    void testEmptyDirectory() throws IOException {
        Path empty = Files.createDirectory(tempDir.resolve("empty"));

        ProjectReport report = analyzer.analyze(empty);

        assertTrue(report.files().isEmpty());
        assertEquals(0, report.totalFindings());
    }
}
