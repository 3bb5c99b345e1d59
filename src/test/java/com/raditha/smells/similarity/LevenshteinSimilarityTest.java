package com.raditha.smells.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.smells.model.StatementKind.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for LevenshteinSimilarity.
 */
class LevenshteinSimilarityTest {

    private LevenshteinSimilarity similarity;

    @BeforeEach
    void setUp() {
        similarity = new LevenshteinSimilarity();
    }

    @Test
    void testIdenticalSequences() {
        double score = similarity.calculate(List.of(ASSIGN, IF, RETURN), List.of(ASSIGN, IF, RETURN));

        assertEquals(1.0, score, 0.001, "Identical sequences should have 100% similarity");
    }

    @Test
    void testOneSubstitution() {
        double score = similarity.calculate(List.of(ASSIGN, IF, RETURN), List.of(ASSIGN, WHILE, RETURN));

        // Distance = 1, max length = 3, similarity = 1 - 1/3 = 0.666...
        assertEquals(0.666, score, 0.01);
    }

    @Test
    void testOneInsertion() {
        double score = similarity.calculate(List.of(ASSIGN, RETURN), List.of(ASSIGN, CALL, RETURN));

        assertEquals(1, similarity.editDistance(List.of(ASSIGN, RETURN), List.of(ASSIGN, CALL, RETURN)));
        assertEquals(0.666, score, 0.01);
    }

    @Test
    void testCompletelyDifferent() {
        assertEquals(0.0, similarity.calculate(List.of(IF, THROW), List.of(CALL, CALL, CALL)), 0.001);
    }

    @Test
    void testEmptySequences() {
        assertEquals(1.0, similarity.calculate(List.of(), List.of()), 0.001);
        assertEquals(0.0, similarity.calculate(List.of(CALL), List.of()), 0.001);
        assertEquals(0.0, similarity.calculate(null, List.of(CALL)), 0.001);
    }

    @Test
    void testSymmetric() {
        List<String> a = List.of("a", "b", "c", "d");
        List<String> b = List.of("b", "c", "e");

        assertEquals(similarity.calculate(a, b), similarity.calculate(b, a), 0.0);
        assertEquals(2, similarity.editDistance(a, b));
    }
}
