package com.raditha.smells.similarity;

import com.raditha.smells.model.Statement;
import com.raditha.smells.model.StatementKind;

import java.util.List;

/**
 * Calculates structural similarity from the statement-kind tag sequences of
 * two function bodies, ignoring everything inside the statements.
 * <p>
 * Sequences of equal length are compared as sets of distinct tags (Jaccard index);
 * sequences of different length by their Levenshtein ratio.
 */
public class StructuralSimilarity {

    private final LevenshteinSimilarity levenshtein;

    public StructuralSimilarity() {
        this(new LevenshteinSimilarity());
    }

    public StructuralSimilarity(LevenshteinSimilarity levenshtein) {
        this.levenshtein = levenshtein;
    }

    /**
     * Tag sequence of a flattened statement list.
     */
    public List<StatementKind> tagSequence(List<Statement> flattened) {
        return flattened.stream().map(Statement::kind).toList();
    }

    /**
     * Calculate structural similarity between two tag sequences.
     *
     * @return Similarity score (0.0 to 1.0)
     */
    public double calculate(List<StatementKind> tags1, List<StatementKind> tags2) {
        if (tags1 == null || tags2 == null) {
            return 0.0;
        }
        if (tags1.size() == tags2.size()) {
            return SetJaccard.similarity(tags1, tags2);
        }
        return levenshtein.calculate(tags1, tags2);
    }
}
