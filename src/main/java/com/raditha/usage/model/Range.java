package com.raditha.usage.model;

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
        int endColumn) implements Comparable<Range> {

    /**
     * Placeholder for nodes that carry no position information.
     */
    public static final Range UNKNOWN = new Range(0, 0, 0, 0);

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
     * Create from the range of a JavaParser node, or {@link #UNKNOWN} if it has none.
     */
    public static Range of(com.github.javaparser.ast.Node node) {
        return node.getRange().map(Range::from).orElse(UNKNOWN);
    }

    @Override
    public int compareTo(Range other) {
        int byLine = Integer.compare(startLine, other.startLine);
        if (byLine != 0) {
            return byLine;
        }
        return Integer.compare(startColumn, other.startColumn);
    }

    /**
     * Format as "L45:9" for display.
     */
    public String toDisplayString() {
        return "L" + startLine + ":" + startColumn;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
