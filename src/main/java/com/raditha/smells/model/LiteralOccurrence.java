package com.raditha.smells.model;

import java.util.Optional;

/**
 * A numeric literal found in the unit.
 *
 * @param value     Numeric value, negated when written with a leading unary minus
 * @param text      Literal as written
 * @param line      Source line
 * @param enclosing Function containing the literal, null for field initializers
 */
public record LiteralOccurrence(double value, String text, int line, FunctionDef enclosing) {

    public Optional<FunctionDef> enclosingFunction() {
        return Optional.ofNullable(enclosing);
    }
}
