package org.pragmatica.unionize.parser;

/// A point in source text: 1-based line, 0-based column (UTF-16 chars).
public record Position(int line, int column) implements Comparable<Position> {
    public static final Position ORIGIN = new Position(1, 0);

    public static Position position(int line, int column) {
        return new Position(line, column);
    }

    /// Re-anchor this position so that `origin` becomes line 1, column 0.
    /// Columns shift only on the origin's own line.
    public Position rebase(Position origin) {
        return new Position(line - origin.line + 1,
                            line == origin.line
                            ? column - origin.column
                            : column);
    }

    public boolean isAfter(Position other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(Position other) {
        return line != other.line
               ? Integer.compare(line, other.line)
               : Integer.compare(column, other.column);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
