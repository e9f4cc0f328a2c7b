package org.pragmatica.unionize.rewrite;

import org.pragmatica.unionize.parser.ExprContext;
import org.pragmatica.unionize.parser.ExprKind;
import org.pragmatica.unionize.parser.PyNode;
import org.pragmatica.unionize.parser.PyNode.Attribute;
import org.pragmatica.unionize.parser.PyNode.Block;
import org.pragmatica.unionize.parser.PyNode.Expr;
import org.pragmatica.unionize.parser.PyNode.Import;
import org.pragmatica.unionize.parser.PyNode.ImportFrom;
import org.pragmatica.unionize.parser.PyNode.Literal;
import org.pragmatica.unionize.parser.PyNode.Name;
import org.pragmatica.unionize.parser.PyNode.Str;
import org.pragmatica.unionize.parser.PyNode.Subscript;
import org.pragmatica.unionize.parser.PyNode.Tuple;
import org.pragmatica.unionize.parser.PyNodes;
import org.pragmatica.unionize.parser.Span;
import org.pragmatica.unionize.parser.TokenKind;
import org.pragmatica.unionize.parser.Tokenizer;
import org.pragmatica.unionize.rewrite.ImportBindings.WrapperHead;
import org.pragmatica.unionize.shared.RewriteException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds {@code Optional[...]} and {@code Union[...]} usage sites and records their replacements.
 * <p>
 * A rewritten site is not descended into: its arguments were already rendered, through the
 * sub-transformer where they are not atomic. A site left as is (forward reference, starred or empty
 * arguments) is traversed like any other expression, so wrappers nested inside it are still found.
 * Every wrapper or wrapper-module reference that stays in the output lands in the retention set.
 */
final class UnionPatternVisitor {
    private static final String NONE = "None";
    private static final Pattern DOTTED_NAME = Pattern.compile("[A-Za-z_]\\w*(?:\\.[A-Za-z_]\\w*)*");

    private final PassContext context;
    private final Optional<ImportUsageTracker> tracker;
    private final SubTransformer subTransformer;

    UnionPatternVisitor(PassContext context, Optional<ImportUsageTracker> tracker, SubTransformer subTransformer) {
        this.context = context;
        this.tracker = tracker;
        this.subTransformer = subTransformer;
    }

    void visit(PyNode node) throws RewriteException {
        visit(node, false);
    }

    /**
     * @param operand whether {@code node} is an operand of an operator binding tighter than {@code |}
     */
    private void visit(PyNode node, boolean operand) throws RewriteException {
        if (node instanceof Block block) {
            visitBlock(block);
            return;
        }
        if (node instanceof Subscript subscript && subscript.context() == ExprContext.LOAD
            && rewriteSite(subscript, operand)) {
            return;
        }
        if (node instanceof Name name) {
            if (name.context() == ExprContext.LOAD) {
                recordReference(name.id());
            }
            return;
        }
        if (node instanceof Str str) {
            recordQuotedReferences(str);
            return;
        }
        if (node instanceof Attribute attribute && attribute.context() == ExprContext.LOAD) {
            context.bindings()
                   .resolveHead(attribute)
                   .ifPresent(head -> context.retention()
                                             .retain(head.kind()));
        }
        visitChildren(node);
    }

    private void visitBlock(Block block) throws RewriteException {
        var statements = block.statements();
        for (int index = 0; index < statements.size(); index++) {
            var statement = statements.get(index);
            if (statement instanceof Import || statement instanceof ImportFrom) {
                var position = index;
                tracker.ifPresent(usages -> usages.track(block, position));
            } else {
                visit(statement);
            }
        }
    }

    private void visitChildren(PyNode node) throws RewriteException {
        if (node instanceof Attribute attribute) {
            visit(attribute.value(), true);
            return;
        }
        if (node instanceof Subscript subscript) {
            visit(subscript.value(), true);
            visit(subscript.slice(), false);
            return;
        }
        var children = node.children();
        for (int index = 0; index < children.size(); index++) {
            visit(children.get(index), node instanceof Expr expr && bindsTighter(expr, index));
        }
    }

    // Whether child `index` of `expr` would capture only part of an unparenthesized `A | B`.
    private boolean bindsTighter(Expr expr, int index) {
        return switch (expr.kind()) {
            case CALL -> index == 0;
            case UNARY, AWAIT -> true;
            case BINARY -> !operatorOf(expr).startsWith("|");
            default -> false;
        };
    }

    private String operatorOf(Expr binary) {
        var left = binary.children()
                         .get(0);
        var right = binary.children()
                          .get(1);
        return context.source()
                      .slice(Span.span(left.span()
                                           .end(),
                                       right.span()
                                            .start()))
                      .strip();
    }

    private void recordReference(String id) {
        context.bindings()
               .resolveName(id)
               .ifPresent(kind -> context.retention()
                                         .retain(kind));
        if (context.bindings()
                   .isModuleAlias(id)) {
            context.retention()
                   .retainModule(id);
        }
    }

    // Wrapper names mentioned inside string literals (forward references) keep their imports.
    private void recordQuotedReferences(Str str) {
        var matcher = DOTTED_NAME.matcher(context.source()
                                                 .slice(str));
        while (matcher.find()) {
            var dotted = matcher.group();
            var lastDot = dotted.lastIndexOf('.');
            if (lastDot < 0) {
                recordReference(dotted);
                continue;
            }
            var module = dotted.substring(0, lastDot);
            recordReference(dotted.substring(0, dotted.indexOf('.')));
            if (context.bindings()
                       .isModuleAlias(module) || context.config()
                                                        .isWrapperModule(module)) {
                WrapperKind.byName(dotted.substring(lastDot + 1))
                           .ifPresent(kind -> context.retention()
                                                     .retain(kind));
            }
        }
    }

    private boolean rewriteSite(Subscript site, boolean operand) throws RewriteException {
        var head = context.bindings()
                          .resolveHead(site.value());
        if (head.isEmpty()) {
            return false;
        }
        var arguments = arguments(head.get(), site.slice());
        if (arguments.isEmpty()) {
            return false;
        }
        var replacement = render(head.get()
                                     .kind(),
                                 arguments.get(),
                                 operand);
        context.splicer()
               .substitute(site.span(), replacement);
        head.get()
            .module()
            .ifPresent(module -> context.retention()
                                        .rewrittenThrough(module));
        return true;
    }

    private Optional<List<PyNode>> arguments(WrapperHead head, PyNode slice) {
        if (head.kind() == WrapperKind.NULLABLE) {
            return slice instanceof Tuple || isUnrewritable(slice)
                   ? Optional.empty()
                   : Optional.of(List.of(slice));
        }
        var elements = slice instanceof Tuple tuple
                       ? tuple.elements()
                       : List.of(slice);
        if (elements.isEmpty() || elements.stream()
                                          .anyMatch(UnionPatternVisitor::isUnrewritable)) {
            return Optional.empty();
        }
        return Optional.of(elements);
    }

    // Forward references cannot be joined with `|`, starred and slice arguments have no union form.
    private static boolean isUnrewritable(PyNode argument) {
        if (PyNodes.unparenthesized(argument) instanceof Str) {
            return true;
        }
        return argument instanceof Expr expr && (expr.kind() == ExprKind.STARRED || expr.kind() == ExprKind.SLICE);
    }

    private String render(WrapperKind kind, List<PyNode> arguments, boolean operand) throws RewriteException {
        var parts = new ArrayList<String>();
        for (var argument : arguments) {
            var text = renderArgument(argument);
            if (isNone(argument) || NONE.equals(text)) {
                // `None | None` is a runtime error
                if (parts.contains(NONE)) {
                    continue;
                }
                text = NONE;
            }
            parts.add(text);
        }
        if (kind == WrapperKind.NULLABLE && !parts.contains(NONE)) {
            parts.add(NONE);
        }
        var replacement = String.join(" | ", parts);
        if (hasBareLineBreak(replacement) || operand && parts.size() > 1) {
            return "(" + replacement + ")";
        }
        return replacement;
    }

    private static boolean isNone(PyNode argument) {
        return PyNodes.unparenthesized(argument) instanceof Literal literal && literal.isNone();
    }

    private String renderArgument(PyNode argument) throws RewriteException {
        String text;
        if (PyNodes.isAtomic(argument)) {
            text = context.source()
                          .slice(argument);
            visit(argument);
        } else {
            var fragment = subTransformer.transform(argument, context);
            context.retention()
                   .mergeFrom(fragment.retention());
            text = fragment.text();
        }
        return argument instanceof Expr expr && expr.kind()
                                                     .bindsLooserThanBitOr()
               ? "(" + text + ")"
               : text;
    }

    // A line break outside brackets would end the statement once the wrapper's brackets are gone.
    private boolean hasBareLineBreak(String text) throws RewriteException {
        if (text.indexOf('\n') < 0) {
            return false;
        }
        return Tokenizer.tokenize(text, context.fileName())
                        .stream()
                        .filter(token -> token.kind() == TokenKind.NEWLINE)
                        .count() > 1;
    }
}
