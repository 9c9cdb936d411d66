package com.odebridge.matlab.parser;

import java.util.Objects;

/**
 * Location of a token or node in the script text.
 * Lines and columns are 1-based, offsets are 0-based with an exclusive end.
 */
public final class SourcePosition {
    public final String source;
    public final int line;
    public final int column;
    public final int startOffset;
    public final int endOffset;

    public SourcePosition(String source, int line, int column, int startOffset, int endOffset) {
        this.source = source;
        this.line = line;
        this.column = column;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    /** Position spanning from the start of {@code from} to the end of {@code to}. */
    public static SourcePosition span(SourcePosition from, SourcePosition to) {
        if (from == null) return to;
        if (to == null) return from;
        return new SourcePosition(from.source, from.line, from.column, from.startOffset, to.endOffset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition)) return false;
        SourcePosition p = (SourcePosition) o;
        return line == p.line && column == p.column
                && startOffset == p.startOffset && endOffset == p.endOffset
                && Objects.equals(source, p.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, line, column, startOffset, endOffset);
    }

    @Override
    public String toString() {
        return source + ":" + line + ":" + column;
    }
}
