package com.raditha.smells.model;

/**
 * Represents a source code range (line and column positions).
 * Simplified wrapper around JavaParser's Range.
 * 
 * @param startLine   Starting line number (1-indexed)
 * @param endLine     Ending line number (1-indexed, inclusive)
 * @param startColumn Starting column number (1-indexed)
 * @param endColumn   Ending column number (1-indexed, inclusive)
 */
public record Range(
        int startLine,
        int endLine,
        int startColumn,
        int endColumn) {

    public Range {
        if (startLine < 1) {
            throw new IllegalArgumentException("startLine must be >= 1, got: " + startLine);
        }
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    "endLine (" + endLine + ") must not precede startLine (" + startLine + ")");
        }
    }

    /**
     * Create a line-only range.
     */
    public static Range ofLines(int startLine, int endLine) {
        return new Range(startLine, endLine, 1, 1);
    }

    /**
     * Create from JavaParser Range.
     */
    public static Range from(com.github.javaparser.Range jpRange) {
        return new Range(
                jpRange.begin.line,
                jpRange.end.line,
                jpRange.begin.column,
                jpRange.end.column);
    }

    /**
     * Distance between the first and last line, as used by the line-count metrics.
     */
    public int lineSpan() {
        return endLine - startLine;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
