package com.raditha.smells.model;

import java.util.ArrayList;
import java.util.List;

/**
 * One statement of a function body.
 *
 * @param kind                    Statement shape
 * @param range                   Source range
 * @param children                Nested statements in source order (branches, loop
 *                                bodies, catch clauses, switch entries)
 * @param tokens                  Normalized tokens of this statement's own
 *                                expressions, led by its keyword token
 * @param accesses                Classified member accesses in this statement's own
 *                                expressions
 * @param expressionDecisionPoints Short-circuit connectives, ternaries and
 *                                switch-expression cases in the own expressions
 */
public record Statement(
        StatementKind kind,
        Range range,
        List<Statement> children,
        List<Token> tokens,
        List<AttributeAccess> accesses,
        int expressionDecisionPoints) {

    public Statement {
        children = List.copyOf(children);
        tokens = List.copyOf(tokens);
        accesses = List.copyOf(accesses);
    }

    /**
     * This statement followed by all nested statements, depth first.
     */
    public List<Statement> flatten() {
        List<Statement> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(Statement statement, List<Statement> into) {
        into.add(statement);
        for (Statement child : statement.children) {
            collect(child, into);
        }
    }
}
