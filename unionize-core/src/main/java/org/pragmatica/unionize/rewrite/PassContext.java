package org.pragmatica.unionize.rewrite;

import org.pragmatica.unionize.parser.SourceText;
import org.pragmatica.unionize.splice.TextSplicer;

/**
 * State of one pass over a file or a fragment, threaded through the walk. Never outlives the pass.
 */
record PassContext(String fileName,
                   SourceText source,
                   TextSplicer splicer,
                   ImportBindings bindings,
                   RetentionSet retention) {
    static PassContext passContext(String fileName, SourceText source, ImportBindings bindings) {
        return new PassContext(fileName,
                               source,
                               TextSplicer.textSplicer(source, fileName),
                               bindings,
                               RetentionSet.retentionSet());
    }

    RewriteConfig config() {
        return bindings.config();
    }
}
