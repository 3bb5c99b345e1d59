package com.raditha.smells.similarity;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.raditha.smells.model.StatementKind.*;
import static org.junit.jupiter.api.Assertions.*;

class StructuralSimilarityTest {

    private StructuralSimilarity similarity;

    @BeforeEach
    void setUp() {
        similarity = new StructuralSimilarity();
    }

    @Test
    void testSameLengthUsesDistinctTags() {
        // Same tags in a different order
        double score = similarity.calculate(List.of(ASSIGN, IF, RETURN), List.of(IF, RETURN, ASSIGN));

        assertEquals(1.0, score, 0.001);
    }

    @Test
    void testRepeatedTagsDoNotLowerTheScore() {
        // Both reduce to {ASSIGN, CALL}
        double score = similarity.calculate(List.of(ASSIGN, CALL, CALL), List.of(ASSIGN, ASSIGN, CALL));

        assertEquals(1.0, score, 0.001);
    }

    @Test
    void testSameLengthDifferentTags() {
        // {ASSIGN, RETURN} vs {ASSIGN, CALL, RETURN}: 2 shared of 3
        double score = similarity.calculate(List.of(ASSIGN, ASSIGN, RETURN), List.of(ASSIGN, CALL, RETURN));

        assertEquals(2.0 / 3.0, score, 0.001);
    }

    @Test
    void testDifferentLengthUsesEditDistance() {
        double score = similarity.calculate(List.of(ASSIGN, IF, RETURN), List.of(ASSIGN, IF, CALL, RETURN));

        // Distance = 1, max length = 4
        assertEquals(0.75, score, 0.001);
    }

    @Test
    void testEmptySequences() {
        assertEquals(1.0, similarity.calculate(List.of(), List.of()), 0.001);
        assertEquals(0.0, similarity.calculate(List.of(), List.of(CALL)), 0.001);
    }
}
