package org.pragmatica.unionize.parser;

import java.util.List;

/// Immutable snapshot of source text addressed by line and column.
///
/// Lines are split on `\n` only; a trailing `\r` stays part of its line.
public final class SourceText {
    private final String text;
    private final List<String> lines;

    private SourceText(String text) {
        this.text = text;
        this.lines = List.of(text.split("\n", -1));
    }

    public static SourceText sourceText(String text) {
        return new SourceText(text);
    }

    public String text() {
        return text;
    }

    public List<String> lines() {
        return lines;
    }

    public int lineCount() {
        return lines.size();
    }

    /// Line content by 1-based number.
    public String line(int lineNumber) {
        return lines.get(lineNumber - 1);
    }

    public int lineLength(int lineNumber) {
        return line(lineNumber).length();
    }

    public Position end() {
        return new Position(lines.size(), lines.get(lines.size() - 1).length());
    }

    /// Source text covered by `span`, line breaks included.
    public String slice(Span span) {
        if (!span.isMultiLine()) {
            return line(span.startLine()).substring(span.startColumn(), span.endColumn());
        }
        var builder = new StringBuilder(line(span.startLine()).substring(span.startColumn()));
        for (int lineNumber = span.startLine() + 1; lineNumber < span.endLine(); lineNumber++) {
            builder.append('\n')
                   .append(line(lineNumber));
        }
        return builder.append('\n')
                      .append(line(span.endLine()), 0, span.endColumn())
                      .toString();
    }

    public String slice(PyNode node) {
        return slice(node.span());
    }

    /// Whether only whitespace precedes `position` on its line.
    public boolean isLineStart(Position position) {
        return line(position.line()).substring(0, position.column())
                                    .isBlank();
    }

    /// Whether only whitespace or a comment follows `position` on its line.
    public boolean isLineEnd(Position position) {
        var rest = line(position.line()).substring(position.column())
                                        .strip();
        return rest.isEmpty() || rest.startsWith("#");
    }

    /// Leading whitespace of a line.
    public String indentation(int lineNumber) {
        var line = line(lineNumber);
        var end = 0;
        while (end < line.length() && (line.charAt(end) == ' ' || line.charAt(end) == '\t')) {
            end++;
        }
        return line.substring(0, end);
    }

    @Override
    public String toString() {
        return text;
    }
}
