package com.raditha.smells.detectors;

import com.raditha.smells.config.GodClassOptions;
import com.raditha.smells.config.InvalidConfigurationException;
import com.raditha.smells.extraction.SourceModelBuilder;
import com.raditha.smells.extraction.SourceParseException;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.Severity;
import com.raditha.smells.model.SourceUnit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GodClassDetectorTest {

    private final SourceModelBuilder builder = new SourceModelBuilder();

    /**
     * A class with the given number of fields and one-line methods, padded with
     * blank lines so that it spans exactly lineCount lines.
     */
    private SourceUnit classWith(int fields, int methods, int lineCount) throws SourceParseException {
        StringBuilder code = new StringBuilder("class Manager {\n");
        int line = 1;
        for (int i = 0; i < fields; i++) {
            code.append("    private int field").append(i).append(";\n");
            line++;
        }
        for (int i = 0; i < methods; i++) {
            code.append("    void method").append(i).append("() { }\n");
            line++;
        }
        while (line < lineCount) {
            code.append("\n");
            line++;
        }
        code.append("}\n");
        return builder.build(code.toString());
    }

    @Test
    void testTriggeredByLinesAndFields() throws SourceParseException {
        GodClassDetector detector = new GodClassDetector(new GodClassOptions(true, 3, 5, 100));

        List<Finding> findings = detector.detect(classWith(4, 5, 128));

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals("Manager", finding.symbol());
        assertTrue(finding.message().contains("too many fields (4, threshold: 3)"), finding.message());
        assertTrue(finding.message().contains("too many lines (128, threshold: 100)"), finding.message());
        assertFalse(finding.message().contains("too many methods"), finding.message());

        assertEquals(4, finding.metric("fieldCount"), 0.0);
        assertEquals(5, finding.metric("methodCount"), 0.0);
        assertEquals(128, finding.metric("lineCount"), 0.0);
        // max ratio 4/3
        assertEquals(Severity.MEDIUM, finding.severity());
    }

    @Test
    void testHighWhenRatioAboveOneAndHalf() throws SourceParseException {
        GodClassDetector detector = new GodClassDetector(new GodClassOptions(true, 3, 5, 100));

        List<Finding> findings = detector.detect(classWith(5, 2, 20));

        assertEquals(1, findings.size());
        assertEquals(Severity.HIGH, findings.get(0).severity());
    }

    @Test
    void testSmallClassNotReported() throws SourceParseException {
        GodClassDetector detector = new GodClassDetector(GodClassOptions.defaults());

        assertTrue(detector.detect(classWith(15, 20, 200)).isEmpty());
    }

    @Test
    void testConstructorsCountAsMethods() throws SourceParseException {
        String code = """
                class Service {
                    Service() { }
                    Service(int a) { }
                    void run() { }
                }
                """;
        GodClassDetector detector = new GodClassDetector(new GodClassOptions(true, 10, 2, 100));

        List<Finding> findings = detector.detect(builder.build(code));

        assertEquals(1, findings.size());
        assertEquals(3, findings.get(0).metric("methodCount"), 0.0);
    }

    @Test
    void testZeroThresholdRejected() {
        assertThrows(InvalidConfigurationException.class, () -> new GodClassOptions(true, 0, 20, 200));
    }
}
