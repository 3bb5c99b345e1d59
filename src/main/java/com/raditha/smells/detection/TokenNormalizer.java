package com.raditha.smells.detection;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.body.VariableDeclarator;
import com.github.javaparser.ast.expr.*;
import com.github.javaparser.ast.stmt.*;
import com.github.javaparser.ast.type.ClassOrInterfaceType;
import com.github.javaparser.ast.type.PrimitiveType;
import com.raditha.smells.model.StatementKind;
import com.raditha.smells.model.Token;
import com.raditha.smells.model.TokenType;
import com.raditha.smells.util.ASTUtility;

import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes Java statements into role-tagged tokens.
 * Every identifier and literal collapses to a placeholder for its syntactic
 * role, while keywords and operators keep their spelling:
 * {@code total = price * 2} and {@code sum = cost * 3} produce the same tokens.
 */
public class TokenNormalizer {

    /**
     * Normalize a statement: its keyword (if it has one) followed by the tokens
     * of the nodes it owns directly.
     *
     * @param kind     Statement shape
     * @param line     Line of the statement
     * @param ownNodes Nodes of the statement's own expressions in pre-order
     */
    public List<Token> normalize(StatementKind kind, int line, List<Node> ownNodes) {
        List<Token> tokens = new ArrayList<>();
        if (hasKeyword(kind)) {
            tokens.add(keyword(kind.keyword(), line));
        }
        for (Node node : ownNodes) {
            normalizeNode(node, tokens);
        }
        return tokens;
    }

    private boolean hasKeyword(StatementKind kind) {
        return switch (kind) {
            case ASSIGN, CALL, EXPRESSION -> false;
            default -> true;
        };
    }

    /**
     * Append the token(s) for a single AST node. Nodes without meaning of their
     * own (names, modifiers, blocks) produce nothing.
     */
    private void normalizeNode(Node node, List<Token> tokens) {
        int line = ASTUtility.lineOf(node);

        // Identifiers by role
        if (node instanceof NameExpr nameExpr) {
            tokens.add(new Token(TokenType.VAR, "VAR", nameExpr.getNameAsString(), line));
        } else if (node instanceof FieldAccessExpr fieldAccess) {
            tokens.add(new Token(TokenType.FIELD, "FIELD", fieldAccess.getNameAsString(), line));
        } else if (node instanceof MethodCallExpr methodCall) {
            tokens.add(new Token(TokenType.METHOD_CALL, "METHOD_CALL", methodCall.getNameAsString(), line));
        } else if (node instanceof MethodReferenceExpr reference) {
            tokens.add(new Token(TokenType.FIELD, "FIELD", reference.getIdentifier(), line));
            tokens.add(new Token(TokenType.OPERATOR, "OPERATOR(::)", "::", line));
        } else if (node instanceof VariableDeclarator declarator) {
            tokens.add(new Token(TokenType.VAR, "VAR", declarator.getNameAsString(), line));
            if (declarator.getInitializer().isPresent()) {
                tokens.add(new Token(TokenType.OPERATOR, "OPERATOR(=)", "=", line));
            }
        } else if (node instanceof Parameter parameter) {
            tokens.add(new Token(TokenType.VAR, "VAR", parameter.getNameAsString(), line));
        } else if (node instanceof ClassOrInterfaceType type) {
            tokens.add(new Token(TokenType.TYPE, "TYPE", type.getNameAsString(), line));
        } else if (node instanceof PrimitiveType type) {
            tokens.add(new Token(TokenType.TYPE, "TYPE", type.asString(), line));
        }

        // Literals
        else if (node instanceof StringLiteralExpr || node instanceof TextBlockLiteralExpr) {
            tokens.add(new Token(TokenType.STRING_LIT, "STRING_LIT", node.toString(), line));
        } else if (node instanceof CharLiteralExpr) {
            tokens.add(new Token(TokenType.CHAR_LIT, "CHAR_LIT", node.toString(), line));
        } else if (node instanceof IntegerLiteralExpr || node instanceof LongLiteralExpr) {
            tokens.add(new Token(TokenType.INT_LIT, "INT_LIT", node.toString(), line));
        } else if (node instanceof DoubleLiteralExpr) {
            tokens.add(new Token(TokenType.DOUBLE_LIT, "DOUBLE_LIT", node.toString(), line));
        } else if (node instanceof BooleanLiteralExpr) {
            tokens.add(new Token(TokenType.BOOLEAN_LIT, "BOOLEAN_LIT", node.toString(), line));
        } else if (node instanceof NullLiteralExpr) {
            tokens.add(new Token(TokenType.NULL_LIT, "NULL", "null", line));
        }

        // Operators
        else if (node instanceof BinaryExpr binaryExpr) {
            tokens.add(operator(binaryExpr.getOperator().asString(), line));
        } else if (node instanceof UnaryExpr unaryExpr) {
            tokens.add(operator(unaryExpr.getOperator().asString(), line));
        } else if (node instanceof AssignExpr assignExpr) {
            tokens.add(operator(assignExpr.getOperator().asString(), line));
        } else if (node instanceof ConditionalExpr) {
            tokens.add(operator("?:", line));
        } else if (node instanceof InstanceOfExpr) {
            tokens.add(operator("instanceof", line));
        } else if (node instanceof CastExpr) {
            tokens.add(operator("cast", line));
        } else if (node instanceof ArrayAccessExpr) {
            tokens.add(operator("[]", line));
        } else if (node instanceof LambdaExpr) {
            tokens.add(operator("->", line));
        }

        // Keywords inside expressions
        else if (node instanceof ObjectCreationExpr || node instanceof ArrayCreationExpr) {
            tokens.add(keyword("new", line));
        } else if (node instanceof ThisExpr) {
            tokens.add(new Token(TokenType.RECEIVER, "RECEIVER(this)", "this", line));
        } else if (node instanceof SuperExpr) {
            tokens.add(new Token(TokenType.RECEIVER, "RECEIVER(super)", "super", line));
        } else if (node instanceof SwitchExpr) {
            tokens.add(keyword("switch", line));
        } else if (node instanceof com.github.javaparser.ast.stmt.Statement statement) {
            String word = nestedKeyword(statement);
            if (word != null) {
                tokens.add(keyword(word, line));
            }
        }
    }

    /**
     * Keyword for statements met inside lambda bodies and switch expressions.
     */
    private String nestedKeyword(com.github.javaparser.ast.stmt.Statement statement) {
        if (statement instanceof IfStmt) {
            return "if";
        }
        if (statement instanceof ForStmt) {
            return "for";
        }
        if (statement instanceof ForEachStmt) {
            return "foreach";
        }
        if (statement instanceof WhileStmt) {
            return "while";
        }
        if (statement instanceof DoStmt) {
            return "do";
        }
        if (statement instanceof SwitchStmt) {
            return "switch";
        }
        if (statement instanceof TryStmt) {
            return "try";
        }
        if (statement instanceof ReturnStmt) {
            return "return";
        }
        if (statement instanceof ThrowStmt) {
            return "throw";
        }
        if (statement instanceof BreakStmt) {
            return "break";
        }
        if (statement instanceof ContinueStmt) {
            return "continue";
        }
        if (statement instanceof YieldStmt) {
            return "yield";
        }
        return null;
    }

    private Token keyword(String word, int line) {
        return new Token(TokenType.KEYWORD, "KEYWORD(" + word + ")", word, line);
    }

    private Token operator(String operator, int line) {
        return new Token(TokenType.OPERATOR, "OPERATOR(" + operator + ")", operator, line);
    }
}
