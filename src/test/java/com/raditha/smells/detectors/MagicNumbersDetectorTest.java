package com.raditha.smells.detectors;

import com.raditha.smells.config.MagicNumbersOptions;
import com.raditha.smells.extraction.SourceModelBuilder;
import com.raditha.smells.extraction.SourceParseException;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.Range;
import com.raditha.smells.model.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MagicNumbersDetectorTest {

    private final SourceModelBuilder builder = new SourceModelBuilder();

    private List<Finding> detect(String code, MagicNumbersOptions options) throws SourceParseException {
        return new MagicNumbersDetector(options).detect(builder.build(code));
    }

    @Test
    void testRepeatedValueAcrossFunctions() throws SourceParseException {
        String code = """
                class Pricing {
                    int first() {
                        return 42;
                    }
                    int second() {
                        return 42 * 2;
                    }
                    int third() {
                        return 42 + 7;
                    }
                }
                """;

        List<Finding> findings = detect(code, MagicNumbersOptions.defaults());

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals("42", finding.symbol());
        assertEquals(Severity.MEDIUM, finding.severity());
        assertEquals(3, finding.startLine());
        assertEquals(9, finding.endLine());
        assertEquals(List.of(Range.ofLines(3, 3), Range.ofLines(6, 6), Range.ofLines(9, 9)), finding.locations());
        assertEquals("Magic number '42' appears 3 times (lines 3, 6, 9)", finding.message());
        assertEquals(3, finding.metric("occurrences"), 0.0);
    }

    @Test
    void testOutOfRangeAndWhitelistedValuesIgnored() throws SourceParseException {
        String code = """
                class Tax {
                    double rate(double amount) {
                        double a = amount * 1.15;
                        double b = amount * 1.15;
                        double c = amount * 1.15;
                        int d = -5 + -5 + -5;
                        int e = 0 + 0 + 0 + 1 + 1 + 1;
                        return a + b + c + d + e;
                    }
                }
                """;

        assertTrue(detect(code, MagicNumbersOptions.defaults()).isEmpty());
    }

    @Test
    void testNegativeValuesWithinCustomRange() throws SourceParseException {
        String code = """
                class Offsets {
                    int shift() {
                        return -5 + -5 + -5;
                    }
                }
                """;
        MagicNumbersOptions options = new MagicNumbersOptions(true, 3, List.of(0.0), -10, 10);

        List<Finding> findings = detect(code, options);

        assertEquals(1, findings.size());
        assertEquals("-5", findings.get(0).symbol());
        assertEquals(-5.0, findings.get(0).metric("value"), 0.0);
    }

    @Test
    void testConstantsAndAnnotationsExcluded() throws SourceParseException {
        String code = """
                class Limits {
                    static final int MAX = 100;
                    private final int LIMIT = 100;
                    @Timeout(100)
                    int check(int x) {
                        return x > 100 ? 100 : x;
                    }
                }
                """;

        assertTrue(detect(code, MagicNumbersOptions.defaults()).isEmpty());
    }

    @Test
    void testMinOccurrences() throws SourceParseException {
        String code = """
                class Retry {
                    void run() {
                        wait(250);
                        wait(250);
                    }
                }
                """;

        assertTrue(detect(code, MagicNumbersOptions.defaults()).isEmpty());
        assertEquals(1, detect(code, new MagicNumbersOptions(true, 2, List.of(), 2, 1000)).size());
    }

    @Test
    void testIntegerAndDoubleFormsGroupTogether() throws SourceParseException {
        String code = """
                class Scale {
                    double f(double x) {
                        return x * 10 + x * 10.0 + x * 10L;
                    }
                }
                """;

        List<Finding> findings = detect(code, MagicNumbersOptions.defaults());

        assertEquals(1, findings.size());
        assertEquals("10", findings.get(0).symbol());
    }

    @Test
    void testFormatValue() {
        assertEquals("3", MagicNumbersDetector.formatValue(3.0));
        assertEquals("2.5", MagicNumbersDetector.formatValue(2.5));
        assertEquals("-7", MagicNumbersDetector.formatValue(-7.0));
    }
}
