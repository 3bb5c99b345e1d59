package com.raditha.smells.model;

/**
 * Syntactic role of a normalized token.
 * Identifiers and literals collapse to their role; keywords and operators keep
 * their spelling in the normalized value.
 */
public enum TokenType {
    /** Local variable, parameter or bare field name */
    VAR,

    /** Member name selected with a dot (field access, method reference) */
    FIELD,

    /** Name of a called method */
    METHOD_CALL,

    /** Type name (object creation, casts, class literals, declarations) */
    TYPE,

    /** String or text block literal */
    STRING_LIT,

    /** Character literal */
    CHAR_LIT,

    /** Integer or long literal */
    INT_LIT,

    /** Double/Float literal */
    DOUBLE_LIT,

    /** Boolean literal */
    BOOLEAN_LIT,

    /** Null literal */
    NULL_LIT,

    /** Statement keyword (if, for, return, throw, ...) */
    KEYWORD,

    /** Operator (==, &&, +, =, +=, ...) */
    OPERATOR,

    /** Receiver keyword (this, super) */
    RECEIVER
}
