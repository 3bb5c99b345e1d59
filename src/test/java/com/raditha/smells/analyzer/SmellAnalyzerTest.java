package com.raditha.smells.analyzer;

import com.raditha.smells.config.LongMethodOptions;
import com.raditha.smells.config.SmellConfig;
import com.raditha.smells.extraction.SourceParseException;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.SmellKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SmellAnalyzerTest {

    private static final String ORDER_SERVICE = """
            class OrderService {
                void create(String a, String b, String c, String d, String e, String f) {
                    int x = 250;
                    int y = 250;
                    int z = 250;
                }
            }
            """;

    @Test
    void testEmptySourceHasNoFindings() throws SourceParseException {
        assertTrue(new SmellAnalyzer().analyzeSource("").isEmpty());
    }

    @Test
    void testFindingsFromSeveralDetectorsMerged() throws SourceParseException {
        List<Finding> findings = new SmellAnalyzer().analyzeSource(ORDER_SERVICE);

        assertEquals(2, findings.size());
        assertEquals(SmellKind.LARGE_PARAMETER_LIST, findings.get(0).kind());
        assertEquals(2, findings.get(0).startLine());
        assertEquals(SmellKind.MAGIC_NUMBERS, findings.get(1).kind());
        assertEquals(3, findings.get(1).startLine());
    }

    @Test
    void testDisabledDetectorNotRun() {
        SmellConfig config = SmellConfig.defaults().withLongMethod(new LongMethodOptions(false, 30, 10));

        assertFalse(new SmellAnalyzer(config).kinds().contains(SmellKind.LONG_METHOD));
        assertEquals(5, new SmellAnalyzer(config).kinds().size());
    }

    @Test
    void testUnparseableSource() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> new SmellAnalyzer().analyzeSource("class Broken {\n    void m( {\n}\n"));

        assertTrue(e.getLine() >= 1);
    }
}
