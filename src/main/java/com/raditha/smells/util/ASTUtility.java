package com.raditha.smells.util;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.raditha.smells.model.Range;

import java.util.function.Consumer;

/**
 * Utility class for common AST operations.
 */
public class ASTUtility {

    private ASTUtility() {
        /* this is only a utility class */
    }

    /**
     * Visit a node and its descendants in pre-order without entering member
     * declarations (anonymous and local class bodies). Those become functions and
     * classes of their own in the model.
     *
     * @param node    Root node
     * @param visitor Receives every visited node
     */
    public static void walkOwnNodes(Node node, Consumer<Node> visitor) {
        visitor.accept(node);
        for (Node child : node.getChildNodes()) {
            if (child instanceof BodyDeclaration<?>) {
                continue;
            }
            walkOwnNodes(child, visitor);
        }
    }

    /**
     * Visit the parts of a statement that belong to it directly: every child
     * that is not itself a statement, catch clause or switch entry, together
     * with its descendants.
     *
     * @param statement Statement whose own expressions are wanted
     * @param visitor   Receives every visited node
     */
    public static void walkOwnExpressions(Statement statement, Consumer<Node> visitor) {
        for (Node child : statement.getChildNodes()) {
            if (child instanceof Statement
                    || child instanceof CatchClause
                    || child instanceof SwitchEntry
                    || child instanceof BodyDeclaration<?>) {
                continue;
            }
            walkOwnNodes(child, visitor);
        }
    }

    /**
     * Begin line of a node, 0 when the node has no position.
     */
    public static int lineOf(Node node) {
        return node.getRange().map(r -> r.begin.line).orElse(0);
    }

    /**
     * Model range of a parsed node.
     *
     * @throws IllegalStateException if the node was not produced by the parser
     */
    public static Range rangeOf(Node node) {
        return node.getRange()
                .map(Range::from)
                .orElseThrow(() -> new IllegalStateException("Node has no source range: " + node));
    }
}
