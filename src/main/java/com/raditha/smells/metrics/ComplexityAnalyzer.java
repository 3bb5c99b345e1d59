package com.raditha.smells.metrics;

import com.raditha.smells.model.FunctionDef;
import com.raditha.smells.model.Statement;

import java.util.List;

/**
 * Cyclomatic complexity of a function body: one plus the number of decision
 * points.
 */
public class ComplexityAnalyzer {

    /**
     * Complexity of a function, at least 1.
     */
    public int complexity(FunctionDef function) {
        return 1 + decisionPoints(function.statements());
    }

    /**
     * Number of decision points in a statement sequence, nested statements and
     * expression-level branches included.
     */
    public int decisionPoints(List<Statement> statements) {
        int count = 0;
        for (Statement statement : statements) {
            count += decisionPoints(statement);
        }
        return count;
    }

    private int decisionPoints(Statement statement) {
        int count = statement.expressionDecisionPoints() + (isBranch(statement) ? 1 : 0);
        for (Statement child : statement.children()) {
            count += decisionPoints(child);
        }
        return count;
    }

    private static boolean isBranch(Statement statement) {
        return switch (statement.kind()) {
            case IF, FOR, FOR_EACH, WHILE, DO, CATCH, CASE -> true;
            case ASSIGN, CALL, EXPRESSION, SWITCH, DEFAULT_CASE, TRY, FINALLY, RETURN, THROW,
                    BREAK, CONTINUE, YIELD, SYNCHRONIZED, ASSERT, LOCAL_CLASS -> false;
        };
    }
}
