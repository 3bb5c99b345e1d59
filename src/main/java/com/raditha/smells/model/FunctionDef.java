package com.raditha.smells.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A method or constructor.
 *
 * @param name        Simple name (the class name for constructors)
 * @param range       Declaration range, signature through closing brace
 * @param parameters  Declared parameters in order
 * @param statements  Top-level body statements; empty for abstract and
 *                    interface methods
 * @param owningClass Class declaring this function, or null
 * @param constructor True for constructors
 */
public record FunctionDef(
        String name,
        Range range,
        List<ParameterDef> parameters,
        List<Statement> statements,
        ClassDef owningClass,
        boolean constructor) {

    public FunctionDef {
        parameters = List.copyOf(parameters);
        statements = List.copyOf(statements);
    }

    public Optional<ClassDef> owner() {
        return Optional.ofNullable(owningClass);
    }

    /**
     * Number of parameters, not counting an implicit receiver in first position.
     */
    public int explicitParameterCount() {
        if (!parameters.isEmpty() && parameters.get(0).implicitReceiver()) {
            return parameters.size() - 1;
        }
        return parameters.size();
    }

    /**
     * All statements, nested ones included, in depth-first source order.
     */
    public List<Statement> flattenedStatements() {
        List<Statement> all = new ArrayList<>();
        for (Statement statement : statements) {
            all.addAll(statement.flatten());
        }
        return all;
    }

    /**
     * All classified member accesses in body order.
     */
    public List<AttributeAccess> accesses() {
        List<AttributeAccess> all = new ArrayList<>();
        for (Statement statement : flattenedStatements()) {
            all.addAll(statement.accesses());
        }
        return all;
    }

    public int lineCount() {
        return range.lineSpan();
    }

    /**
     * "Owner.name" for methods, plain name otherwise.
     */
    public String qualifiedName() {
        return owningClass != null ? owningClass.name() + "." + name : name;
    }

    @Override
    public String toString() {
        return qualifiedName() + " " + range.toDisplayString();
    }
}
