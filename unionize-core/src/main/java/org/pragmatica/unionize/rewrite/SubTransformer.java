package org.pragmatica.unionize.rewrite;

import org.pragmatica.unionize.parser.PyNode;
import org.pragmatica.unionize.parser.PythonParser;
import org.pragmatica.unionize.parser.SourceText;
import org.pragmatica.unionize.shared.RewriteException;

import java.util.HashSet;

/**
 * Rewrites one non-atomic wrapper argument as a file of its own.
 * <p>
 * The argument's source slice becomes the fragment text and its subtree is rebased so that it starts
 * at line 1, column 0; the first pass runs on that subtree, later passes on a fresh parse of the
 * fragment, until a pass produces no edits. Fragments resolve names through the enclosing file's
 * import bindings and never touch imports.
 */
final class SubTransformer {
    private final PythonParser parser;

    private SubTransformer(PythonParser parser) {
        this.parser = parser;
    }

    static SubTransformer subTransformer(PythonParser parser) {
        return new SubTransformer(parser);
    }

    /**
     * Rewritten fragment text and the references it keeps.
     */
    record Fragment(String text, RetentionSet retention) {}

    Fragment transform(PyNode argument, PassContext outer) throws RewriteException {
        var origin = argument.span()
                             .start();
        var text = outer.source()
                        .slice(argument);
        var node = argument.mapSpans(span -> span.rebase(origin));
        var rewrittenThrough = new HashSet<String>();
        var editingPasses = 0;
        while (true) {
            var outcome = RewritePass.fragmentPass(node, SourceText.sourceText(text), outer, this);
            if (outcome.edits() == 0) {
                var retention = outcome.retention();
                rewrittenThrough.forEach(retention::rewrittenThrough);
                return new Fragment(text, retention);
            }
            editingPasses++;
            if (editingPasses > outer.config()
                                     .maxPasses()) {
                throw RewriteException.noFixedPoint(outer.fileName(), editingPasses);
            }
            rewrittenThrough.addAll(outcome.retention()
                                           .rewrittenModules());
            text = outcome.text();
            node = parser.parseExpression(text, outer.fileName());
        }
    }
}
