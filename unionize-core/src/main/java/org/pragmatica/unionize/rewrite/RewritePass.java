package org.pragmatica.unionize.rewrite;

import org.pragmatica.unionize.parser.PyNode;
import org.pragmatica.unionize.parser.PyNode.Module;
import org.pragmatica.unionize.parser.SourceText;
import org.pragmatica.unionize.shared.RewriteException;

import java.util.Optional;

/**
 * One visit-and-splice pass over a parsed file or fragment.
 */
final class RewritePass {
    private RewritePass() {}

    /**
     * Result of a pass: the spliced text, how many edits produced it, and what stays referenced.
     */
    record Outcome(String text, int edits, RetentionSet retention) {}

    static Outcome filePass(Module module,
                            SourceText source,
                            String fileName,
                            RewriteConfig config,
                            SubTransformer subTransformer) throws RewriteException {
        var context = PassContext.passContext(fileName, source, ImportBindings.importBindings(module, config));
        var tracker = config.pruneImports()
                      ? Optional.of(new ImportUsageTracker(context))
                      : Optional.<ImportUsageTracker>empty();
        new UnionPatternVisitor(context, tracker, subTransformer).visit(module);
        if (tracker.isPresent()) {
            tracker.get()
                   .emitEdits();
        }
        return outcome(context);
    }

    static Outcome fragmentPass(PyNode fragment,
                                SourceText source,
                                PassContext outer,
                                SubTransformer subTransformer) throws RewriteException {
        var context = PassContext.passContext(outer.fileName(), source, outer.bindings());
        new UnionPatternVisitor(context, Optional.empty(), subTransformer).visit(fragment);
        return outcome(context);
    }

    private static Outcome outcome(PassContext context) {
        var splicer = context.splicer();
        return new Outcome(splicer.render(), splicer.size(), context.retention());
    }
}
