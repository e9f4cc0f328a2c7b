package org.pragmatica.unionize.splice;

import org.pragmatica.unionize.parser.SourceText;
import org.pragmatica.unionize.parser.Span;

/// Request to replace the text under `span` with `replacement`.
///
/// An empty replacement over a span that starts at column 0 and ends at the end of its last line
/// removes those lines entirely instead of leaving an empty line behind.
public record EditOperation(Span span, String replacement) {
    public static EditOperation editOperation(Span span, String replacement) {
        return new EditOperation(span, replacement);
    }

    /// Deletion of the whole lines `firstLine..lastLine` of `text`.
    public static EditOperation lineDeletion(SourceText text, int firstLine, int lastLine) {
        return new EditOperation(Span.span(firstLine, 0, lastLine, text.lineLength(lastLine)), "");
    }

    public boolean isWholeLineDeletion(SourceText text) {
        return replacement.isEmpty() && span.startColumn() == 0 && span.endColumn() == text.lineLength(span.endLine());
    }

    public String describe() {
        return span + " -> '" + replacement + "'";
    }

    @Override
    public String toString() {
        return describe();
    }
}
