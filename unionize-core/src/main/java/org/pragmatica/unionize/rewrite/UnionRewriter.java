package org.pragmatica.unionize.rewrite;

import org.pragmatica.unionize.parser.PythonParser;
import org.pragmatica.unionize.parser.SourceText;
import org.pragmatica.unionize.shared.RewriteException;
import org.pragmatica.unionize.shared.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites {@code Optional[T]} to {@code T | None} and {@code Union[A, B]} to {@code A | B}.
 * <p>
 * Every pass parses the current text afresh, visits it and splices the collected edits. Passes repeat
 * until one produces no edits. Leading blank lines exposed by deleted imports are stripped at the end,
 * never more than the rewrite introduced.
 */
public final class UnionRewriter implements Rewriter {
    private static final Logger log = LoggerFactory.getLogger(UnionRewriter.class);

    private final RewriteConfig config;
    private final PythonParser parser;
    private final SubTransformer subTransformer;

    private UnionRewriter(RewriteConfig config) {
        this.config = config;
        this.parser = PythonParser.pythonParser();
        this.subTransformer = SubTransformer.subTransformer(parser);
    }

    /**
     * Factory method for creating a rewriter with default config.
     */
    public static UnionRewriter unionRewriter() {
        return new UnionRewriter(RewriteConfig.defaultConfig());
    }

    /**
     * Factory method for creating a rewriter with custom config.
     */
    public static UnionRewriter unionRewriter(RewriteConfig config) {
        return new UnionRewriter(config);
    }

    @Override
    public SourceFile rewrite(SourceFile source) throws RewriteException {
        return source.withContent(rewrite(source.content(), source.fileName()));
    }

    @Override
    public boolean isRewritten(SourceFile source) throws RewriteException {
        return rewrite(source).content()
                              .equals(source.content());
    }

    @Override
    public RewriteConfig config() {
        return config;
    }

    /**
     * Rewrite source text to its fixed point. {@code fileName} labels diagnostics only.
     */
    public String rewrite(String text, String fileName) throws RewriteException {
        try {
            return rewriteToFixedPoint(text, fileName);
        } catch (StackOverflowError e) {
            throw RewriteException.parseFailure(fileName, 1, 0, "too deeply nested to rewrite");
        }
    }

    private String rewriteToFixedPoint(String text, String fileName) throws RewriteException {
        var current = text;
        var editingPasses = 0;
        var totalEdits = 0;
        while (true) {
            var module = parser.parse(current, fileName);
            var outcome = RewritePass.filePass(module, SourceText.sourceText(current), fileName, config, subTransformer);
            log.debug("{}: pass {} produced {} edits", fileName, editingPasses + 1, outcome.edits());
            if (outcome.edits() == 0) {
                break;
            }
            editingPasses++;
            if (editingPasses > config.maxPasses()) {
                throw RewriteException.noFixedPoint(fileName, editingPasses);
            }
            totalEdits += outcome.edits();
            current = outcome.text();
        }
        if (totalEdits == 0) {
            return text;
        }
        log.debug("{}: converged after {} passes, {} edits", fileName, editingPasses + 1, totalEdits);
        return stripIntroducedBlankLines(text, current);
    }

    private static String stripIntroducedBlankLines(String original, String rewritten) {
        var introduced = leadingBlankLines(rewritten) - leadingBlankLines(original);
        var offset = 0;
        for (int line = 0; line < introduced; line++) {
            offset = rewritten.indexOf('\n', offset) + 1;
        }
        return rewritten.substring(offset);
    }

    private static int leadingBlankLines(String text) {
        var count = 0;
        var offset = 0;
        while (true) {
            var lineEnd = text.indexOf('\n', offset);
            if (lineEnd < 0 || !text.substring(offset, lineEnd)
                                    .isBlank()) {
                return count;
            }
            count++;
            offset = lineEnd + 1;
        }
    }
}
