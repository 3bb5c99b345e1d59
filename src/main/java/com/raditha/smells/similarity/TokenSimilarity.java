package com.raditha.smells.similarity;

import com.raditha.smells.model.Statement;
import com.raditha.smells.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * Token-level similarity of two function bodies: Jaccard index over the
 * distinct normalized tokens of each.
 */
public class TokenSimilarity {

    /**
     * Normalized token form of a statement sequence: the tokens of every
     * statement in depth-first order.
     */
    public List<String> normalizedForm(List<Statement> flattened) {
        List<String> values = new ArrayList<>();
        for (Statement statement : flattened) {
            for (Token token : statement.tokens()) {
                values.add(token.normalizedValue());
            }
        }
        return values;
    }

    /**
     * Calculate token similarity between two normalized forms.
     *
     * @return Similarity score (0.0 to 1.0)
     */
    public double calculate(List<String> tokens1, List<String> tokens2) {
        if (tokens1 == null || tokens2 == null) {
            return 0.0;
        }
        return SetJaccard.similarity(tokens1, tokens2);
    }
}
