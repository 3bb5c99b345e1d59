package com.raditha.smells.extraction;

/**
 * The source text is not syntactically valid Java.
 * Analysis of that unit stops; other units of a multi-file run proceed.
 */
public class SourceParseException extends Exception {

    private final int line;
    private final int column;

    public SourceParseException(String message, int line, int column) {
        super(message);
        this.line = line;
        this.column = column;
    }

    /**
     * 1-indexed line of the first problem, 0 when the parser gave no position.
     */
    public int getLine() {
        return line;
    }

    /**
     * 1-indexed column of the first problem, 0 when the parser gave no position.
     */
    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        if (line > 0) {
            return String.format("%s (line %d, column %d)", super.getMessage(), line, column);
        }
        return super.getMessage();
    }
}
