package com.reachscan.adapter.ast;

/**
 * Line/column span of a node in its source unit. Lines are 1-based; {@link #UNKNOWN} has line 0.
 */
public record SourceLocation(
    int line,
    int column,
    int endLine
) {
    public static final SourceLocation UNKNOWN = new SourceLocation(0, 0, 0);

    public static SourceLocation at(int line) {
        return new SourceLocation(line, 0, line);
    }

    public boolean isKnown() {
        return line > 0;
    }
}
