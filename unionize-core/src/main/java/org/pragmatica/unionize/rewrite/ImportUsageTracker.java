package org.pragmatica.unionize.rewrite;

import org.pragmatica.unionize.parser.ImportRenderer;
import org.pragmatica.unionize.parser.Position;
import org.pragmatica.unionize.parser.PyNode;
import org.pragmatica.unionize.parser.PyNode.Alias;
import org.pragmatica.unionize.parser.PyNode.Block;
import org.pragmatica.unionize.parser.PyNode.Import;
import org.pragmatica.unionize.parser.PyNode.ImportFrom;
import org.pragmatica.unionize.parser.Span;
import org.pragmatica.unionize.shared.RewriteException.ConflictingEdits;
import org.pragmatica.unionize.splice.EditOperation;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Rewrites or removes the import statements of the wrapper names once the walk is complete.
 * <p>
 * Member imports ({@code from typing import Optional, cast}) lose every wrapper name whose kind is
 * not retained. Module imports ({@code import typing}) lose the module only when a usage was rewritten
 * through it and nothing else refers to it anymore. An emptied statement is deleted: together with
 * its {@code ;} when it shares a line, as {@code pass} when it is the only statement of a nested
 * block, and as whole lines otherwise.
 */
final class ImportUsageTracker {
    private final PassContext context;
    private final List<TrackedImport> tracked = new ArrayList<>();

    ImportUsageTracker(PassContext context) {
        this.context = context;
    }

    private record TrackedImport(Block block, int index) {
        PyNode statement() {
            return block.statements()
                        .get(index);
        }
    }

    /**
     * Register the import statement at {@code index} of {@code block} if it involves a wrapper.
     */
    void track(Block block, int index) {
        var statement = block.statements()
                             .get(index);
        var relevant = statement instanceof ImportFrom from
                       ? from.names()
                             .stream()
                             .anyMatch(alias -> isWrapperMember(from, alias))
                       : ((Import) statement).names()
                                             .stream()
                                             .anyMatch(this::isWrapperModule);
        if (relevant) {
            tracked.add(new TrackedImport(block, index));
        }
    }

    /**
     * Emit the edits for every tracked import. Call after the walk.
     */
    void emitEdits() throws ConflictingEdits {
        var deletions = new IdentityHashMap<Block, TreeSet<Integer>>();
        for (var entry : tracked) {
            var statement = entry.statement();
            if (statement instanceof ImportFrom from) {
                var remaining = from.names()
                                    .stream()
                                    .filter(alias -> !isRemovable(from, alias))
                                    .toList();
                if (remaining.size() == from.names()
                                            .size()) {
                    continue;
                }
                if (remaining.isEmpty()) {
                    deletions.computeIfAbsent(entry.block(), block -> new TreeSet<>())
                             .add(entry.index());
                } else {
                    context.splicer()
                           .substitute(from.span(), render(from.withNames(remaining)));
                }
            } else {
                var imported = (Import) statement;
                var remaining = imported.names()
                                        .stream()
                                        .filter(alias -> !isRemovable(alias))
                                        .toList();
                if (remaining.size() == imported.names()
                                                .size()) {
                    continue;
                }
                if (remaining.isEmpty()) {
                    deletions.computeIfAbsent(entry.block(), block -> new TreeSet<>())
                             .add(entry.index());
                } else {
                    context.splicer()
                           .substitute(imported.span(), ImportRenderer.render(imported.withNames(remaining)));
                }
            }
        }
        for (Map.Entry<Block, TreeSet<Integer>> entry : deletions.entrySet()) {
            deleteStatements(entry.getKey(), entry.getValue());
        }
    }

    private boolean isWrapperMember(ImportFrom from, Alias alias) {
        return ImportBindings.wrapperMember(from, alias, context.config())
                             .isPresent();
    }

    private boolean isWrapperModule(Alias alias) {
        return context.config()
                      .isWrapperModule(alias.name());
    }

    private boolean isRemovable(ImportFrom from, Alias alias) {
        return ImportBindings.wrapperMember(from, alias, context.config())
                             .filter(kind -> !context.retention()
                                                     .isRetained(kind))
                             .isPresent();
    }

    private boolean isRemovable(Alias alias) {
        var local = alias.localName();
        return isWrapperModule(alias) && context.retention()
                                                .wasRewrittenThrough(local) && !context.retention()
                                                                                       .isModuleRetained(local);
    }

    private String render(ImportFrom from) {
        var source = context.source();
        if (from.parenthesized() && from.span()
                                        .isMultiLine()) {
            var headerLine = from.span()
                                 .startLine();
            var itemLine = from.names()
                               .stream()
                               .mapToInt(alias -> alias.span()
                                                       .startLine())
                               .filter(line -> line != headerLine)
                               .findFirst();
            if (itemLine.isPresent()) {
                return ImportRenderer.renderParenthesized(from,
                                                          source.indentation(itemLine.getAsInt()),
                                                          source.indentation(headerLine));
            }
        }
        return ImportRenderer.render(from);
    }

    // Statements sharing lines form a run; runs are deleted as a unit or around the kept statements.
    private void deleteStatements(Block block, TreeSet<Integer> deleted) throws ConflictingEdits {
        var statements = block.statements();
        var runStart = 0;
        for (int index = 0; index < statements.size(); index++) {
            var last = index == statements.size() - 1;
            if (last || statements.get(index)
                                  .span()
                                  .endLine() != statements.get(index + 1)
                                                          .span()
                                                          .startLine()) {
                deleteInRun(block, runStart, index, deleted);
                runStart = index + 1;
            }
        }
    }

    private void deleteInRun(Block block, int from, int to, TreeSet<Integer> deleted) throws ConflictingEdits {
        var inRun = deleted.subSet(from, true, to, true);
        if (inRun.isEmpty()) {
            return;
        }
        var statements = block.statements();
        if (inRun.size() == to - from + 1) {
            deleteWholeRun(block, from, to);
            return;
        }
        var index = inRun.first();
        while (index <= to) {
            if (!deleted.contains(index)) {
                index++;
                continue;
            }
            var segmentEnd = index;
            while (segmentEnd < to && deleted.contains(segmentEnd + 1)) {
                segmentEnd++;
            }
            var span = segmentEnd < to
                       ? Span.span(statements.get(index)
                                             .span()
                                             .start(),
                                   statements.get(segmentEnd + 1)
                                             .span()
                                             .start())
                       : Span.span(statements.get(index - 1)
                                             .span()
                                             .end(),
                                   statements.get(segmentEnd)
                                             .span()
                                             .end());
            context.splicer()
                   .substitute(span, "");
            index = segmentEnd + 1;
        }
    }

    private void deleteWholeRun(Block block, int from, int to) throws ConflictingEdits {
        var statements = block.statements();
        var start = statements.get(from)
                              .span()
                              .start();
        var end = statements.get(to)
                            .span()
                            .end();
        if (block.nested() && from == 0 && to == statements.size() - 1) {
            context.splicer()
                   .substitute(Span.span(start, end), "pass");
        } else if (coversWholeLines(start, end)) {
            context.splicer()
                   .substitute(EditOperation.lineDeletion(context.source(), start.line(), end.line()));
        } else {
            context.splicer()
                   .substitute(Span.span(start, end), "");
        }
    }

    // Only whitespace before `start`; after `end` only whitespace, a trailing `;` or a comment.
    private boolean coversWholeLines(Position start, Position end) {
        var source = context.source();
        if (!source.isLineStart(start)) {
            return false;
        }
        var rest = source.line(end.line())
                         .substring(end.column())
                         .strip();
        if (rest.startsWith(";")) {
            rest = rest.substring(1)
                       .strip();
        }
        return rest.isEmpty() || rest.startsWith("#");
    }
}
