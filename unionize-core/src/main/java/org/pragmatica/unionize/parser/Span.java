package org.pragmatica.unionize.parser;

/// Half-open source range `[start, end)` of one syntax node or one edit.
public record Span(Position start, Position end) {
    public Span {
        if (end.compareTo(start) < 0) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
    }

    public static Span span(Position start, Position end) {
        return new Span(start, end);
    }

    public static Span span(int startLine, int startColumn, int endLine, int endColumn) {
        return new Span(new Position(startLine, startColumn), new Position(endLine, endColumn));
    }

    public static Span covering(Span first, Span last) {
        return new Span(first.start, last.end);
    }

    public int startLine() {
        return start.line();
    }

    public int startColumn() {
        return start.column();
    }

    public int endLine() {
        return end.line();
    }

    public int endColumn() {
        return end.column();
    }

    public boolean isMultiLine() {
        return start.line() != end.line();
    }

    public boolean contains(Span other) {
        return start.compareTo(other.start) <= 0 && end.compareTo(other.end) >= 0;
    }

    /// True when the two ranges share at least one character. Touching ranges do not overlap.
    public boolean overlaps(Span other) {
        return start.compareTo(other.end) < 0 && other.start.compareTo(end) < 0;
    }

    /// True when this range ends at or before the start of `other`.
    public boolean isBefore(Span other) {
        return !end.isAfter(other.start);
    }

    public Span rebase(Position origin) {
        return new Span(start.rebase(origin), end.rebase(origin));
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
