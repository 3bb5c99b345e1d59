package com.raditha.smells.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.ObjectCreationExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import com.github.javaparser.ast.expr.VariableDeclarationExpr;
import com.github.javaparser.ast.stmt.*;
import com.raditha.smells.detection.TokenNormalizer;
import com.raditha.smells.model.AttributeAccess;
import com.raditha.smells.model.Range;
import com.raditha.smells.model.StatementKind;
import com.raditha.smells.model.Token;
import com.raditha.smells.util.ASTUtility;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts JavaParser statements of one function body into model statements.
 * Blocks and labels are flattened, catch clauses, finally blocks and switch
 * entries become nested pseudo-statements so that every decision point has a
 * tag of its own.
 */
public class StatementConverter {

    private final TokenNormalizer normalizer;
    private final AccessClassifier classifier;

    public StatementConverter(TokenNormalizer normalizer, AccessClassifier classifier) {
        this.normalizer = normalizer;
        this.classifier = classifier;
    }

    /**
     * Convert a list of statements, preserving order.
     */
    public List<com.raditha.smells.model.Statement> convertAll(List<Statement> statements) {
        List<com.raditha.smells.model.Statement> converted = new ArrayList<>();
        for (Statement statement : statements) {
            converted.addAll(convert(statement));
        }
        return converted;
    }

    /**
     * Convert one statement. Blocks yield their contents, empty statements
     * nothing, everything else exactly one model statement.
     */
    public List<com.raditha.smells.model.Statement> convert(Statement statement) {
        if (statement instanceof BlockStmt block) {
            return convertAll(block.getStatements());
        }
        if (statement instanceof LabeledStmt labeled) {
            return convert(labeled.getStatement());
        }
        if (statement instanceof EmptyStmt) {
            return List.of();
        }

        List<Node> ownNodes = new ArrayList<>();
        ASTUtility.walkOwnExpressions(statement, ownNodes::add);

        return List.of(build(kindOf(statement), ASTUtility.rangeOf(statement), ownNodes, childrenOf(statement)));
    }

    private List<com.raditha.smells.model.Statement> childrenOf(Statement statement) {
        List<com.raditha.smells.model.Statement> children = new ArrayList<>();

        if (statement instanceof IfStmt ifStmt) {
            children.addAll(convert(ifStmt.getThenStmt()));
            ifStmt.getElseStmt().ifPresent(elseStmt -> children.addAll(convert(elseStmt)));
        } else if (statement instanceof ForStmt forStmt) {
            children.addAll(convert(forStmt.getBody()));
        } else if (statement instanceof ForEachStmt forEachStmt) {
            children.addAll(convert(forEachStmt.getBody()));
        } else if (statement instanceof WhileStmt whileStmt) {
            children.addAll(convert(whileStmt.getBody()));
        } else if (statement instanceof DoStmt doStmt) {
            children.addAll(convert(doStmt.getBody()));
        } else if (statement instanceof SynchronizedStmt synchronizedStmt) {
            children.addAll(convert(synchronizedStmt.getBody()));
        } else if (statement instanceof SwitchStmt switchStmt) {
            for (SwitchEntry entry : switchStmt.getEntries()) {
                children.add(convertEntry(entry));
            }
        } else if (statement instanceof TryStmt tryStmt) {
            children.addAll(convert(tryStmt.getTryBlock()));
            for (CatchClause catchClause : tryStmt.getCatchClauses()) {
                children.add(convertCatch(catchClause));
            }
            tryStmt.getFinallyBlock().ifPresent(finallyBlock -> children.add(build(
                    StatementKind.FINALLY,
                    ASTUtility.rangeOf(finallyBlock),
                    List.of(),
                    convert(finallyBlock))));
        }
        return children;
    }

    private com.raditha.smells.model.Statement convertEntry(SwitchEntry entry) {
        List<Node> ownNodes = new ArrayList<>();
        for (Expression label : entry.getLabels()) {
            ASTUtility.walkOwnNodes(label, ownNodes::add);
        }
        StatementKind kind = entry.getLabels().isEmpty() ? StatementKind.DEFAULT_CASE : StatementKind.CASE;
        return build(kind, ASTUtility.rangeOf(entry), ownNodes, convertAll(entry.getStatements()));
    }

    private com.raditha.smells.model.Statement convertCatch(CatchClause catchClause) {
        List<Node> ownNodes = new ArrayList<>();
        ASTUtility.walkOwnNodes(catchClause.getParameter(), ownNodes::add);
        return build(StatementKind.CATCH, ASTUtility.rangeOf(catchClause), ownNodes,
                convert(catchClause.getBody()));
    }

    private com.raditha.smells.model.Statement build(StatementKind kind, Range range, List<Node> ownNodes,
            List<com.raditha.smells.model.Statement> children) {
        List<Token> tokens = normalizer.normalize(kind, range.startLine(), ownNodes);
        List<AttributeAccess> accesses = classifier.classify(ownNodes);
        return new com.raditha.smells.model.Statement(kind, range, children, tokens, accesses,
                countDecisionPoints(ownNodes));
    }

    /**
     * Decision points hidden inside expressions: short-circuit connectives,
     * ternaries, and the branches of switch expressions and lambda bodies.
     */
    static int countDecisionPoints(List<Node> ownNodes) {
        int count = 0;
        for (Node node : ownNodes) {
            if (node instanceof BinaryExpr binary) {
                BinaryExpr.Operator operator = binary.getOperator();
                if (operator == BinaryExpr.Operator.AND || operator == BinaryExpr.Operator.OR) {
                    count++;
                }
            } else if (node instanceof ConditionalExpr) {
                count++;
            } else if (node instanceof SwitchEntry entry) {
                if (!entry.getLabels().isEmpty()) {
                    count++;
                }
            } else if (node instanceof IfStmt
                    || node instanceof ForStmt
                    || node instanceof ForEachStmt
                    || node instanceof WhileStmt
                    || node instanceof DoStmt
                    || node instanceof CatchClause) {
                count++;
            }
        }
        return count;
    }

    static StatementKind kindOf(Statement statement) {
        if (statement instanceof ExpressionStmt expressionStmt) {
            return kindOfExpression(expressionStmt.getExpression());
        }
        if (statement instanceof ExplicitConstructorInvocationStmt) {
            return StatementKind.CALL;
        }
        if (statement instanceof IfStmt) {
            return StatementKind.IF;
        }
        if (statement instanceof ForStmt) {
            return StatementKind.FOR;
        }
        if (statement instanceof ForEachStmt) {
            return StatementKind.FOR_EACH;
        }
        if (statement instanceof WhileStmt) {
            return StatementKind.WHILE;
        }
        if (statement instanceof DoStmt) {
            return StatementKind.DO;
        }
        if (statement instanceof SwitchStmt) {
            return StatementKind.SWITCH;
        }
        if (statement instanceof TryStmt) {
            return StatementKind.TRY;
        }
        if (statement instanceof ReturnStmt) {
            return StatementKind.RETURN;
        }
        if (statement instanceof ThrowStmt) {
            return StatementKind.THROW;
        }
        if (statement instanceof BreakStmt) {
            return StatementKind.BREAK;
        }
        if (statement instanceof ContinueStmt) {
            return StatementKind.CONTINUE;
        }
        if (statement instanceof YieldStmt) {
            return StatementKind.YIELD;
        }
        if (statement instanceof SynchronizedStmt) {
            return StatementKind.SYNCHRONIZED;
        }
        if (statement instanceof AssertStmt) {
            return StatementKind.ASSERT;
        }
        if (statement instanceof LocalClassDeclarationStmt || statement instanceof LocalRecordDeclarationStmt) {
            return StatementKind.LOCAL_CLASS;
        }
        return StatementKind.EXPRESSION;
    }

    private static StatementKind kindOfExpression(Expression expression) {
        if (expression instanceof AssignExpr || expression instanceof VariableDeclarationExpr) {
            return StatementKind.ASSIGN;
        }
        if (expression instanceof UnaryExpr unary && isIncrementOrDecrement(unary)) {
            return StatementKind.ASSIGN;
        }
        if (expression instanceof MethodCallExpr || expression instanceof ObjectCreationExpr) {
            return StatementKind.CALL;
        }
        return StatementKind.EXPRESSION;
    }

    private static boolean isIncrementOrDecrement(UnaryExpr unary) {
        return switch (unary.getOperator()) {
            case PREFIX_INCREMENT, PREFIX_DECREMENT, POSTFIX_INCREMENT, POSTFIX_DECREMENT -> true;
            default -> false;
        };
    }
}
