package com.raditha.smells.detectors;

import com.raditha.smells.config.FeatureEnvyOptions;
import com.raditha.smells.extraction.SourceModelBuilder;
import com.raditha.smells.extraction.SourceParseException;
import com.raditha.smells.model.AttributeAccess;
import com.raditha.smells.model.Finding;
import com.raditha.smells.model.FunctionDef;
import com.raditha.smells.model.Range;
import com.raditha.smells.model.SourceUnit;
import com.raditha.smells.model.Statement;
import com.raditha.smells.model.StatementKind;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeatureEnvyDetectorTest {

    private final SourceModelBuilder builder = new SourceModelBuilder();

    private List<Finding> detect(String code) throws SourceParseException {
        return new FeatureEnvyDetector(FeatureEnvyOptions.defaults()).detect(builder.build(code));
    }

    @Test
    void testMethodUsingAnotherObject() throws SourceParseException {
        String code = """
                class Printer {
                    String label(Order order) {
                        return order.id + " " + order.customer + " " + order.getTotal();
                    }
                }
                """;

        List<Finding> findings = detect(code);

        assertEquals(1, findings.size());
        Finding finding = findings.get(0);
        assertEquals("Printer.label", finding.symbol());
        assertEquals(3, finding.metric("foreignAccesses"), 0.0);
        assertEquals(0, finding.metric("selfAccesses"), 0.0);
        assertEquals(3.0, finding.metric("ratio"), 0.001);
        assertEquals("Method 'Printer.label' shows feature envy towards 'order' "
                + "(foreign accesses: 3, self accesses: 0, ratio: 3.00)", finding.message());
    }

    @Test
    void testEachEnviedObjectReportedSeparately() throws SourceParseException {
        String code = """
                class Shipping {
                    private double rate;
                    double cost(Parcel parcel, Address address) {
                        double weight = parcel.weight * parcel.factor;
                        double distance = address.distance() + address.surcharge;
                        return (weight + distance) * rate;
                    }
                }
                """;

        List<Finding> findings = detect(code);

        assertEquals(2, findings.size());
        assertTrue(findings.get(0).message().contains("towards 'parcel'"));
        assertTrue(findings.get(1).message().contains("towards 'address'"));
        assertEquals(1, findings.get(0).metric("selfAccesses"), 0.0);
    }

    @Test
    void testSelfHeavyMethodNotReported() throws SourceParseException {
        String code = """
                class Account {
                    private double balance;
                    private double limit;
                    private int count;
                    boolean withdraw(Request request) {
                        if (this.balance - request.amount < -limit && count < this.limit) {
                            return false;
                        }
                        this.balance = balance - request.amount;
                        count = count + 1;
                        return true;
                    }
                }
                """;

        assertTrue(detect(code).isEmpty());
    }

    @Test
    void testSingleForeignAccessBelowMinimum() throws SourceParseException {
        String code = """
                class Greeter {
                    String greet(User user) {
                        return "Hello " + user.name;
                    }
                }
                """;

        assertTrue(detect(code).isEmpty());
    }

    @Property
    void raisingMinimumNeverAddsFindings(@ForAll @IntRange(min = 0, max = 6) int selfAccesses,
            @ForAll @IntRange(min = 0, max = 8) int foreignAccesses,
            @ForAll @IntRange(min = 1, max = 10) int minimum) {
        SourceUnit unit = unitWithAccesses(selfAccesses, foreignAccesses);

        int relaxed = new FeatureEnvyDetector(new FeatureEnvyOptions(true, 0, 0.5)).detect(unit).size();
        int strict = new FeatureEnvyDetector(new FeatureEnvyOptions(true, minimum, 0.5)).detect(unit).size();

        assertTrue(relaxed >= strict);
    }

    private static SourceUnit unitWithAccesses(int selfAccesses, int foreignAccesses) {
        List<AttributeAccess> accesses = new ArrayList<>();
        for (int i = 0; i < selfAccesses; i++) {
            accesses.add(AttributeAccess.self("this", "field" + i, 3));
        }
        for (int i = 0; i < foreignAccesses; i++) {
            accesses.add(AttributeAccess.foreign("other", "member" + i, "other", 3));
        }
        Statement statement = new Statement(StatementKind.EXPRESSION, Range.ofLines(3, 3),
                List.of(), List.of(), accesses, 0);
        FunctionDef function = new FunctionDef("work", Range.ofLines(2, 4), List.of(), List.of(statement),
                null, false);
        return new SourceUnit(Path.of("Generated.java"), 5, List.of(), List.of(function), List.of());
    }
}
