package org.pragmatica.unionize.cli;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.pragmatica.unionize.rewrite.RewriteConfig;
import org.pragmatica.unionize.rewrite.UnionRewriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line entry point: rewrites {@code Optional}/{@code Union} annotations of Python files in place.
 * <p>
 * Exit codes: 0 when nothing failed (and, with {@code --check}, nothing would change), 1 when
 * {@code --check} found files to rewrite, 2 when at least one file could not be processed.
 */
@Command(name = "unionize",
        mixinStandardHelpOptions = true,
        version = "unionize 0.1.0",
        description = "Rewrite typing.Optional[T] to T | None and typing.Union[A, B] to A | B")
public class UnionizeCli implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(UnionizeCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_WOULD_CHANGE = 1;
    static final int EXIT_FAILURE = 2;

    @Parameters(paramLabel = "<path>",
            description = "Files or directories to rewrite",
            arity = "1..*")
    List<Path> paths;

    @Option(names = {"--check", "-c"},
            description = "Write nothing, list files that would change and exit with 1 if any")
    boolean check;

    @Option(names = {"--module", "-m"},
            paramLabel = "NAME",
            description = "Additional module re-exporting Optional and Union (typing and typing_extensions always apply)")
    List<String> modules = new ArrayList<>();

    @Option(names = "--keep-imports",
            description = "Leave import statements untouched")
    boolean keepImports;

    @Option(names = "--max-passes",
            paramLabel = "N",
            defaultValue = "" + RewriteConfig.DEFAULT_MAX_PASSES,
            description = "Give up on a file after N rewriting passes (default: ${DEFAULT-VALUE})")
    int maxPasses;

    @Option(names = {"--verbose", "-v"},
            description = "Log every pass")
    boolean verbose;

    public static void main(String[] args) {
        System.exit(new CommandLine(new UnionizeCli()).execute(args));
    }

    @Override
    public Integer call() {
        if (verbose) {
            Configurator.setLevel("org.pragmatica.unionize", Level.DEBUG);
        }
        if (maxPasses < 1) {
            log.error("--max-passes must be positive, got {}", maxPasses);
            return EXIT_FAILURE;
        }
        var collectionErrors = new ArrayList<String>();
        var files = FileCollector.collectPythonFiles(paths, collectionErrors::add);
        collectionErrors.forEach(log::error);

        var runner = new RewriteRunner(UnionRewriter.unionRewriter(config()), check);
        var summary = runner.run(files);
        log.info("{} {}, {} unchanged, {} failed",
                 summary.changed()
                        .size(),
                 check
                 ? "would be rewritten"
                 : "rewritten",
                 summary.unchanged(),
                 summary.failed()
                        .size());

        if (!collectionErrors.isEmpty() || !summary.failed()
                                                   .isEmpty()) {
            return EXIT_FAILURE;
        }
        return check && !summary.changed()
                                .isEmpty()
               ? EXIT_WOULD_CHANGE
               : EXIT_OK;
    }

    RewriteConfig config() {
        var config = RewriteConfig.defaultConfig()
                                  .withPruneImports(!keepImports)
                                  .withMaxPasses(maxPasses);
        for (var module : modules) {
            config = config.withWrapperModule(module);
        }
        return config;
    }
}
