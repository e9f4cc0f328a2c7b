package org.pragmatica.unionize.parser;

import org.pragmatica.unionize.parser.PyNode.Attribute;
import org.pragmatica.unionize.parser.PyNode.Expr;
import org.pragmatica.unionize.parser.PyNode.Literal;
import org.pragmatica.unionize.parser.PyNode.Name;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Queries over [PyNode] trees.
public final class PyNodes {
    private PyNodes() {}

    /// All nodes of the given type in `root`, in source order, `root` included.
    public static <T extends PyNode> List<T> findAll(PyNode root, Class<T> type) {
        var found = new ArrayList<T>();
        collect(root, type, found);
        return found;
    }

    private static <T extends PyNode> void collect(PyNode node, Class<T> type, List<T> found) {
        if (type.isInstance(node)) {
            found.add(type.cast(node));
        }
        for (var child : node.children()) {
            collect(child, type, found);
        }
    }

    /// `a.b.c` for a chain of attribute accesses rooted at a plain name.
    public static Optional<String> dottedName(PyNode node) {
        if (node instanceof Name name) {
            return Optional.of(name.id());
        }
        if (node instanceof Attribute attribute) {
            return dottedName(attribute.value()).map(prefix -> prefix + "." + attribute.attr());
        }
        return Optional.empty();
    }

    /// The plain name a chain of attribute accesses starts from.
    public static Optional<Name> rootName(PyNode node) {
        if (node instanceof Name name) {
            return Optional.of(name);
        }
        if (node instanceof Attribute attribute) {
            return rootName(attribute.value());
        }
        return Optional.empty();
    }

    /// Names, dotted names and literals: nodes whose source text can be reused as is.
    public static boolean isAtomic(PyNode node) {
        return node instanceof Literal || dottedName(node).isPresent();
    }

    /// The expression inside any number of redundant parentheses: `(("Foo"))` yields the string.
    public static PyNode unparenthesized(PyNode node) {
        var current = node;
        while (current instanceof Expr expr && expr.kind() == ExprKind.PAREN) {
            current = expr.children()
                          .get(0);
        }
        return current;
    }
}
