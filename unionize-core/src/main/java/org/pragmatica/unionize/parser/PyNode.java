package org.pragmatica.unionize.parser;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/// Concrete syntax tree of a Python source file.
///
/// The node set is closed: rewrite logic dispatches over these shapes only, everything else is an
/// [Expr] tagged with an [ExprKind] or a [Statement] tagged with a [StatementKind].
public sealed interface PyNode {
    Span span();

    List<PyNode> children();

    /// Copy of this subtree with every span passed through `mapper`.
    PyNode mapSpans(UnaryOperator<Span> mapper);

    static List<PyNode> mapAll(List<PyNode> nodes, UnaryOperator<Span> mapper) {
        return nodes.stream()
                    .map(node -> node.mapSpans(mapper))
                    .toList();
    }

    record Module(Block body, Span span) implements PyNode {
        @Override
        public List<PyNode> children() {
            return List.of(body);
        }

        @Override
        public Module mapSpans(UnaryOperator<Span> mapper) {
            return new Module(body.mapSpans(mapper), mapper.apply(span));
        }
    }

    /// Statements of one suite. `nested` is false only for the module body.
    record Block(List<PyNode> statements, boolean nested, Span span) implements PyNode {
        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public List<PyNode> children() {
            return statements;
        }

        @Override
        public Block mapSpans(UnaryOperator<Span> mapper) {
            return new Block(mapAll(statements, mapper), nested, mapper.apply(span));
        }
    }

    record Statement(StatementKind kind, List<PyNode> children, Span span) implements PyNode {
        public Statement {
            children = List.copyOf(children);
        }

        @Override
        public Statement mapSpans(UnaryOperator<Span> mapper) {
            return new Statement(kind, mapAll(children, mapper), mapper.apply(span));
        }
    }

    /// One imported name, `name` or `name as asName`.
    record Alias(String name, Optional<String> asName, Span span) {
        public static Alias alias(String name, Optional<String> asName, Span span) {
            return new Alias(name, asName, span);
        }

        /// The name this alias binds in the importing module.
        public String localName() {
            return asName.orElseGet(() -> name.contains(".")
                                          ? name.substring(0, name.indexOf('.'))
                                          : name);
        }

        public Alias mapSpans(UnaryOperator<Span> mapper) {
            return new Alias(name, asName, mapper.apply(span));
        }
    }

    /// `import a, b.c as d`
    record Import(List<Alias> names, Span span) implements PyNode {
        public Import {
            names = List.copyOf(names);
        }

        @Override
        public List<PyNode> children() {
            return List.of();
        }

        @Override
        public Import mapSpans(UnaryOperator<Span> mapper) {
            return new Import(names.stream()
                                   .map(alias -> alias.mapSpans(mapper))
                                   .toList(),
                              mapper.apply(span));
        }

        public Import withNames(List<Alias> remaining) {
            return new Import(remaining, span);
        }
    }

    /// `from ..module import a, b as c`, `from module import (a, b)` or `from module import *`.
    record ImportFrom(String module, int level, List<Alias> names, boolean star, boolean parenthesized, Span span)
    implements PyNode {
        public ImportFrom {
            names = List.copyOf(names);
        }

        @Override
        public List<PyNode> children() {
            return List.of();
        }

        @Override
        public ImportFrom mapSpans(UnaryOperator<Span> mapper) {
            return new ImportFrom(module,
                                  level,
                                  names.stream()
                                       .map(alias -> alias.mapSpans(mapper))
                                       .toList(),
                                  star,
                                  parenthesized,
                                  mapper.apply(span));
        }

        public ImportFrom withNames(List<Alias> remaining) {
            return new ImportFrom(module, level, remaining, star, parenthesized, span);
        }
    }

    record Name(String id, ExprContext context, Span span) implements PyNode {
        @Override
        public List<PyNode> children() {
            return List.of();
        }

        @Override
        public Name mapSpans(UnaryOperator<Span> mapper) {
            return new Name(id, context, mapper.apply(span));
        }
    }

    record Attribute(PyNode value, String attr, ExprContext context, Span span) implements PyNode {
        @Override
        public List<PyNode> children() {
            return List.of(value);
        }

        @Override
        public Attribute mapSpans(UnaryOperator<Span> mapper) {
            return new Attribute(value.mapSpans(mapper), attr, context, mapper.apply(span));
        }
    }

    /// `value[slice]`. A comma-separated slice is a [Tuple] spanning its elements.
    record Subscript(PyNode value, PyNode slice, ExprContext context, Span span) implements PyNode {
        @Override
        public List<PyNode> children() {
            return List.of(value, slice);
        }

        @Override
        public Subscript mapSpans(UnaryOperator<Span> mapper) {
            return new Subscript(value.mapSpans(mapper), slice.mapSpans(mapper), context, mapper.apply(span));
        }
    }

    record Tuple(List<PyNode> elements, boolean parenthesized, ExprContext context, Span span) implements PyNode {
        public Tuple {
            elements = List.copyOf(elements);
        }

        @Override
        public List<PyNode> children() {
            return elements;
        }

        @Override
        public Tuple mapSpans(UnaryOperator<Span> mapper) {
            return new Tuple(mapAll(elements, mapper), parenthesized, context, mapper.apply(span));
        }
    }

    /// One string literal or several implicitly concatenated ones, any prefix.
    record Str(Span span) implements PyNode {
        @Override
        public List<PyNode> children() {
            return List.of();
        }

        @Override
        public Str mapSpans(UnaryOperator<Span> mapper) {
            return new Str(mapper.apply(span));
        }
    }

    /// Numbers, `None`, `True`, `False` and `...`.
    record Literal(String text, Span span) implements PyNode {
        @Override
        public List<PyNode> children() {
            return List.of();
        }

        @Override
        public Literal mapSpans(UnaryOperator<Span> mapper) {
            return new Literal(text, mapper.apply(span));
        }

        public boolean isNone() {
            return "None".equals(text);
        }
    }

    record Expr(ExprKind kind, List<PyNode> children, Span span) implements PyNode {
        public Expr {
            children = List.copyOf(children);
        }

        @Override
        public Expr mapSpans(UnaryOperator<Span> mapper) {
            return new Expr(kind, mapAll(children, mapper), mapper.apply(span));
        }
    }
}
