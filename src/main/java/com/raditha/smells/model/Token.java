package com.raditha.smells.model;

/**
 * Represents a normalized token in a statement.
 * Identifiers and literal values are replaced with a placeholder for their
 * role, so {@code x = 5} and {@code y = 7} produce the same normalized values.
 * 
 * @param type            Token role
 * @param normalizedValue Normalized representation (e.g., "VAR", "KEYWORD(if)",
 *                        "OPERATOR(+=)")
 * @param originalValue   Original source text (e.g., "userId")
 * @param lineNumber      Source line number
 */
public record Token(
        TokenType type,
        String normalizedValue,
        String originalValue,
        int lineNumber) {
}
