package com.raditha.smells.extraction;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.CastExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.FieldAccessExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.NameExpr;
import com.github.javaparser.ast.expr.SuperExpr;
import com.github.javaparser.ast.expr.ThisExpr;
import com.raditha.smells.model.AttributeAccess;
import com.raditha.smells.util.ASTUtility;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Classifies member accesses inside one function as self or foreign.
 * <p>
 * Self: {@code this.x}, {@code this.m()}, {@code super.m()}, an unqualified call
 * {@code m()}, and a bare receiver field not shadowed by a parameter or local.
 * <p>
 * Foreign: an access whose chain is rooted at a parameter or local, or that goes
 * through one of the receiver's fields or getters. For {@code this.restaurant.menu}
 * the target is {@code restaurant}; the hop {@code this.restaurant} only reaches
 * the foreign object and is not counted.
 * <p>
 * Chains rooted at a type name ({@code Math.max}), literals, object creation or
 * array access are not object state and are ignored.
 */
public class AccessClassifier {

    private final Set<String> receiverFields;
    private final Set<String> localNames;

    /**
     * @param receiverFields Fields of the class declaring the function (empty when
     *                       there is none)
     * @param localNames     Parameters and local variables of the function
     */
    public AccessClassifier(Set<String> receiverFields, Set<String> localNames) {
        this.receiverFields = Set.copyOf(receiverFields);
        this.localNames = Set.copyOf(localNames);
    }

    /**
     * Classify the accesses among a statement's own nodes.
     *
     * @param ownNodes Nodes in pre-order
     * @return Accesses in the same order
     */
    public List<AttributeAccess> classify(List<Node> ownNodes) {
        List<AttributeAccess> accesses = new ArrayList<>();
        for (Node node : ownNodes) {
            AttributeAccess access = classifyNode(node);
            if (access != null) {
                accesses.add(access);
            }
        }
        return accesses;
    }

    private AttributeAccess classifyNode(Node node) {
        int line = ASTUtility.lineOf(node);

        if (node instanceof FieldAccessExpr fieldAccess) {
            return classifyScoped(fieldAccess, fieldAccess.getScope(), fieldAccess.getNameAsString(), line);
        }
        if (node instanceof MethodCallExpr methodCall) {
            if (methodCall.getScope().isPresent()) {
                return classifyScoped(methodCall, methodCall.getScope().get(), methodCall.getNameAsString(), line);
            }
            if (isScopeOfAccess(methodCall)) {
                return null;
            }
            return AttributeAccess.self("", methodCall.getNameAsString(), line);
        }
        if (node instanceof NameExpr nameExpr) {
            String name = nameExpr.getNameAsString();
            if (isReceiverField(name) && !isScopeOfAccess(nameExpr)) {
                return AttributeAccess.self("", name, line);
            }
        }
        return null;
    }

    private AttributeAccess classifyScoped(Expression access, Expression scope, String attribute, int line) {
        Expression root = unwrap(scope);
        Expression hop = null;
        while (true) {
            if (root instanceof FieldAccessExpr fieldAccess) {
                hop = fieldAccess;
                root = unwrap(fieldAccess.getScope());
            } else if (root instanceof MethodCallExpr methodCall && methodCall.getScope().isPresent()) {
                hop = methodCall;
                root = unwrap(methodCall.getScope().get());
            } else {
                break;
            }
        }

        String base = scope.toString();
        if (root instanceof ThisExpr || root instanceof SuperExpr) {
            if (hop == null) {
                return isScopeOfAccess(access) ? null : AttributeAccess.self(base, attribute, line);
            }
            return AttributeAccess.foreign(base, attribute, memberName(hop), line);
        }
        if (root instanceof NameExpr nameExpr) {
            String name = nameExpr.getNameAsString();
            if (!localNames.contains(name) && !receiverFields.contains(name) && looksLikeTypeName(name)) {
                return null;
            }
            return AttributeAccess.foreign(base, attribute, name, line);
        }
        if (root instanceof MethodCallExpr getter) {
            return AttributeAccess.foreign(base, attribute, getter.getNameAsString(), line);
        }
        return null;
    }

    private boolean isReceiverField(String name) {
        return receiverFields.contains(name) && !localNames.contains(name);
    }

    /**
     * True if the expression is the scope another field access or call is
     * selected from.
     */
    private static boolean isScopeOfAccess(Expression expression) {
        Node child = expression;
        Node parent = expression.getParentNode().orElse(null);
        while (parent instanceof EnclosedExpr || parent instanceof CastExpr) {
            child = parent;
            parent = parent.getParentNode().orElse(null);
        }
        if (parent instanceof FieldAccessExpr fieldAccess) {
            return fieldAccess.getScope() == child;
        }
        if (parent instanceof MethodCallExpr methodCall) {
            return methodCall.getScope().isPresent() && methodCall.getScope().get() == child;
        }
        return false;
    }

    private static Expression unwrap(Expression expression) {
        Expression current = expression;
        while (true) {
            if (current instanceof EnclosedExpr enclosed) {
                current = enclosed.getInner();
            } else if (current instanceof CastExpr cast) {
                current = cast.getExpression();
            } else {
                return current;
            }
        }
    }

    private static String memberName(Expression hop) {
        if (hop instanceof FieldAccessExpr fieldAccess) {
            return fieldAccess.getNameAsString();
        }
        return ((MethodCallExpr) hop).getNameAsString();
    }

    private static boolean looksLikeTypeName(String name) {
        return !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }
}
