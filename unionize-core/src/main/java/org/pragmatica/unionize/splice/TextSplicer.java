package org.pragmatica.unionize.splice;

import org.pragmatica.unionize.parser.Position;
import org.pragmatica.unionize.parser.SourceText;
import org.pragmatica.unionize.parser.Span;
import org.pragmatica.unionize.shared.RewriteException;
import org.pragmatica.unionize.shared.RewriteException.ConflictingEdits;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/// Collects non-overlapping edits over a fixed snapshot of source text and applies them at once.
///
/// Edits are kept ordered by start position. Each new edit is checked against its immediate
/// neighbours only: since the collection is already free of overlaps, that is sufficient.
/// Rendering walks the edits from last to first, so every edit addresses the coordinates of the
/// original snapshot and no offset bookkeeping is needed.
public final class TextSplicer {
    private final SourceText source;
    private final String fileName;
    private final NavigableMap<Position, EditOperation> edits = new TreeMap<>();

    private TextSplicer(SourceText source, String fileName) {
        this.source = source;
        this.fileName = fileName;
    }

    public static TextSplicer textSplicer(SourceText source, String fileName) {
        return new TextSplicer(source, fileName);
    }

    public void substitute(Span span, String replacement) throws ConflictingEdits {
        substitute(EditOperation.editOperation(span, replacement));
    }

    public void substitute(EditOperation edit) throws ConflictingEdits {
        var start = edit.span()
                        .start();
        var same = edits.get(start);
        if (same != null) {
            throw RewriteException.conflictingEdits(fileName, same, edit);
        }
        var predecessor = edits.lowerEntry(start);
        if (predecessor != null && !predecessor.getValue()
                                               .span()
                                               .isBefore(edit.span())) {
            throw RewriteException.conflictingEdits(fileName, predecessor.getValue(), edit);
        }
        var successor = edits.higherEntry(start);
        if (successor != null && !edit.span()
                                      .isBefore(successor.getValue()
                                                         .span())) {
            throw RewriteException.conflictingEdits(fileName, edit, successor.getValue());
        }
        edits.put(start, edit);
    }

    public boolean isEmpty() {
        return edits.isEmpty();
    }

    public int size() {
        return edits.size();
    }

    /// Edits in position order.
    public List<EditOperation> edits() {
        return List.copyOf(edits.values());
    }

    public SourceText source() {
        return source;
    }

    /// New text with every edit applied. The snapshot itself is left untouched.
    public String render() {
        if (edits.isEmpty()) {
            return source.text();
        }
        var lines = new ArrayList<>(source.lines());
        for (var edit : edits.descendingMap()
                             .values()) {
            apply(lines, edit);
        }
        return String.join("\n", lines);
    }

    private void apply(List<String> lines, EditOperation edit) {
        var span = edit.span();
        var first = span.startLine() - 1;
        var last = span.endLine() - 1;
        if (edit.isWholeLineDeletion(source)) {
            lines.subList(first, last + 1)
                 .clear();
            return;
        }
        var merged = lines.get(first)
                          .substring(0, span.startColumn()) + edit.replacement() + lines.get(last)
                                                                                        .substring(span.endColumn());
        lines.subList(first + 1, last + 1)
             .clear();
        lines.set(first, merged);
    }
}
