package com.raditha.smells.similarity;

import com.raditha.smells.model.FunctionDef;
import com.raditha.smells.model.StatementKind;

import java.util.List;

/**
 * Compares function bodies by token content and by statement shape.
 */
public class SimilarityCalculator {

    private final TokenSimilarity tokenSimilarity;
    private final StructuralSimilarity structuralSimilarity;

    public SimilarityCalculator() {
        this(new TokenSimilarity(), new StructuralSimilarity());
    }

    public SimilarityCalculator(TokenSimilarity tokenSimilarity, StructuralSimilarity structuralSimilarity) {
        this.tokenSimilarity = tokenSimilarity;
        this.structuralSimilarity = structuralSimilarity;
    }

    /**
     * Precompute the comparable forms of a function body.
     */
    public Fingerprint fingerprint(FunctionDef function) {
        var flattened = function.flattenedStatements();
        return new Fingerprint(
                function,
                tokenSimilarity.normalizedForm(flattened),
                structuralSimilarity.tagSequence(flattened));
    }

    public SimilarityResult compare(Fingerprint first, Fingerprint second) {
        return new SimilarityResult(
                tokenSimilarity.calculate(first.tokens(), second.tokens()),
                structuralSimilarity.calculate(first.tags(), second.tags()));
    }

    /**
     * Normalized token form and tag sequence of one function.
     *
     * @param function Function the forms were computed from
     * @param tokens   Normalized token values in body order
     * @param tags     Statement kinds in depth-first order
     */
    public record Fingerprint(FunctionDef function, List<String> tokens, List<StatementKind> tags) {

        public Fingerprint {
            tokens = List.copyOf(tokens);
            tags = List.copyOf(tags);
        }

        /**
         * Number of statements, nested ones included.
         */
        public int statementCount() {
            return tags.size();
        }
    }
}
