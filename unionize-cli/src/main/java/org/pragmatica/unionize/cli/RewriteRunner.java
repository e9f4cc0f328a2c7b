package org.pragmatica.unionize.cli;

import org.pragmatica.unionize.rewrite.Rewriter;
import org.pragmatica.unionize.shared.RewriteException;
import org.pragmatica.unionize.shared.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Rewrites files one at a time on a worker thread with a large stack. A failing file is reported and
 * skipped, the others still run.
 */
final class RewriteRunner {
    private static final Logger log = LoggerFactory.getLogger(RewriteRunner.class);
    // Deeply nested annotations recurse deeply in the parser and the sub-transformer.
    private static final long WORKER_STACK_SIZE = 64L * 1024 * 1024;

    private final Rewriter rewriter;
    private final boolean check;

    RewriteRunner(Rewriter rewriter, boolean check) {
        this.rewriter = rewriter;
        this.check = check;
    }

    RunSummary run(List<Path> files) {
        var changed = new ArrayList<Path>();
        var failed = new ArrayList<Path>();
        var unchanged = 0;
        var worker = Executors.newSingleThreadExecutor(task -> new Thread(null, task, "unionize-rewrite", WORKER_STACK_SIZE));
        try {
            for (var file : files) {
                switch (processOn(worker, file)) {
                    case CHANGED -> changed.add(file);
                    case UNCHANGED -> unchanged++;
                    case FAILED -> failed.add(file);
                }
            }
        } finally {
            worker.shutdownNow();
        }
        return new RunSummary(changed, unchanged, failed);
    }

    private FileOutcome processOn(ExecutorService worker, Path file) {
        try {
            return worker.submit(() -> process(file))
                         .get();
        } catch (InterruptedException e) {
            Thread.currentThread()
                  .interrupt();
            log.error("Interrupted while processing {}", file);
            return FileOutcome.FAILED;
        } catch (ExecutionException e) {
            log.error("Cannot process {}: {}", file, e.getCause()
                                                      .toString());
            return FileOutcome.FAILED;
        }
    }

    private FileOutcome process(Path file) {
        try {
            var source = SourceFile.sourceFile(file, Files.readString(file, StandardCharsets.UTF_8));
            var rewritten = rewriter.rewrite(source);
            if (rewritten.content()
                         .equals(source.content())) {
                log.debug("Unchanged {}", file);
                return FileOutcome.UNCHANGED;
            }
            if (check) {
                log.info("Would rewrite {}", file);
            } else {
                log.info("Rewriting {}", file);
                Files.writeString(file, rewritten.content(), StandardCharsets.UTF_8);
            }
            return FileOutcome.CHANGED;
        } catch (RewriteException e) {
            log.error("Skipping {}", e.getMessage());
            return FileOutcome.FAILED;
        } catch (IOException e) {
            log.error("Cannot process {}: {}", file, e.getMessage());
            return FileOutcome.FAILED;
        } catch (RuntimeException | StackOverflowError e) {
            log.error("Cannot process {}: {}", file, e.toString());
            return FileOutcome.FAILED;
        }
    }

    private enum FileOutcome {
        CHANGED,
        UNCHANGED,
        FAILED
    }

    /**
     * Files that changed (or would change in check mode), the unchanged count and the failed files.
     */
    record RunSummary(List<Path> changed, int unchanged, List<Path> failed) {
        RunSummary {
            changed = List.copyOf(changed);
            failed = List.copyOf(failed);
        }
    }
}
