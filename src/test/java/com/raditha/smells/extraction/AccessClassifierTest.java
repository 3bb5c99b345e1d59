package com.raditha.smells.extraction;

import com.raditha.smells.model.AccessOrigin;
import com.raditha.smells.model.AttributeAccess;
import com.raditha.smells.model.FunctionDef;
import com.raditha.smells.model.SourceUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccessClassifierTest {

    private static final String ORDER = """
            class Invoice {
                private double rate;
                private Customer customer;

                double own(Order order) {
                    return this.rate * rate * compute() * order.getTotal() + this.rate;
                }

                int throughField() {
                    return this.customer.orders.size() + customer.name.length();
                }

                String throughGetter() {
                    return getCustomer().name + getCustomer().email;
                }

                double statics(double a, double b) {
                    return Math.max(a, b) + Integer.MAX_VALUE;
                }

                double shadowed(double rate) {
                    return rate * 2;
                }

                void lambda(java.util.List<Item> items) {
                    items.forEach(item -> item.ship());
                }
            }
            """;

    private SourceUnit unit;

    @BeforeEach
    void setUp() throws SourceParseException {
        unit = new SourceModelBuilder().build(ORDER);
    }

    private List<AttributeAccess> accessesOf(String name) {
        FunctionDef function = unit.functions().stream()
                .filter(f -> f.name().equals(name))
                .findFirst()
                .orElseThrow();
        return function.accesses();
    }

    @Test
    void testSelfAccesses() {
        List<AttributeAccess> accesses = accessesOf("own");

        long self = accesses.stream().filter(AttributeAccess::isSelf).count();
        List<AttributeAccess> foreign = accesses.stream().filter(AttributeAccess::isForeign).toList();

        assertEquals(4, self, "this.rate twice, bare rate and compute()");
        assertEquals(1, foreign.size());
        assertEquals("order", foreign.get(0).target());
        assertEquals("getTotal", foreign.get(0).attribute());
    }

    @Test
    void testAccessThroughReceiverFieldIsForeign() {
        List<AttributeAccess> accesses = accessesOf("throughField");

        assertEquals(4, accesses.size());
        assertTrue(accesses.stream().allMatch(a -> a.origin() == AccessOrigin.FOREIGN));
        assertTrue(accesses.stream().allMatch(a -> a.target().equals("customer")));
    }

    @Test
    void testAccessThroughGetterIsForeign() {
        List<AttributeAccess> accesses = accessesOf("throughGetter");

        assertEquals(2, accesses.size());
        assertEquals(List.of("name", "email"), accesses.stream().map(AttributeAccess::attribute).toList());
        assertTrue(accesses.stream().allMatch(a -> a.target().equals("getCustomer")));
    }

    @Test
    void testStaticAccessesAreIgnored() {
        assertTrue(accessesOf("statics").isEmpty());
    }

    @Test
    void testParameterShadowsField() {
        assertTrue(accessesOf("shadowed").isEmpty());
    }

    @Test
    void testLambdaParameterIsForeignTarget() {
        List<AttributeAccess> accesses = accessesOf("lambda");

        assertEquals(List.of("items", "item"), accesses.stream().map(AttributeAccess::target).toList());
    }
}
