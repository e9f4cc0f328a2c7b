package org.pragmatica.unionize.rewrite;

import org.pragmatica.unionize.shared.RewriteException;
import org.pragmatica.unionize.shared.SourceFile;

/**
 * Interface for rewriting Python source files.
 */
public interface Rewriter {
    /**
     * Rewrite a source file. Content is returned unchanged when nothing applies.
     */
    SourceFile rewrite(SourceFile source) throws RewriteException;

    /**
     * Check if a source file is already fully rewritten.
     */
    boolean isRewritten(SourceFile source) throws RewriteException;

    /**
     * Get the rewriter configuration.
     */
    RewriteConfig config();
}
