package com.raditha.smells.model;

/**
 * Closed set of statement shapes the detectors work with.
 * Block statements do not appear: their contents are flattened into the
 * enclosing statement or function.
 */
public enum StatementKind {
    /** Assignment, compound assignment, increment or variable declaration */
    ASSIGN("assign"),
    /** Expression statement whose top expression is a call or object creation */
    CALL("call"),
    /** Any other expression statement */
    EXPRESSION("expression"),
    IF("if"),
    FOR("for"),
    FOR_EACH("foreach"),
    WHILE("while"),
    DO("do"),
    SWITCH("switch"),
    /** A switch entry with at least one label */
    CASE("case"),
    /** The default entry of a switch */
    DEFAULT_CASE("default"),
    TRY("try"),
    CATCH("catch"),
    FINALLY("finally"),
    RETURN("return"),
    THROW("throw"),
    BREAK("break"),
    CONTINUE("continue"),
    YIELD("yield"),
    SYNCHRONIZED("synchronized"),
    ASSERT("assert"),
    LOCAL_CLASS("class");

    private final String keyword;

    StatementKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Source keyword, or a short descriptive word for keyword-less statements.
     */
    public String keyword() {
        return keyword;
    }
}
