package org.pragmatica.unionize.parser;

import org.pragmatica.unionize.parser.PyNode.Alias;
import org.pragmatica.unionize.parser.PyNode.Import;
import org.pragmatica.unionize.parser.PyNode.ImportFrom;

import java.util.stream.Collectors;

/// Renders import statements back to source text.
public final class ImportRenderer {
    private ImportRenderer() {}

    /// `import a, b.c as d`
    public static String render(Import node) {
        return "import " + node.names()
                               .stream()
                               .map(ImportRenderer::render)
                               .collect(Collectors.joining(", "));
    }

    /// `from ..module import a, b as c` on one line.
    public static String render(ImportFrom node) {
        if (node.star()) {
            return header(node) + "*";
        }
        return header(node) + node.names()
                                  .stream()
                                  .map(ImportRenderer::render)
                                  .collect(Collectors.joining(", "));
    }

    /// Parenthesized layout, one name per line followed by a comma:
    /// ```
    /// from module import (
    ///     a,
    ///     b as c,
    /// )
    /// ```
    /// `itemIndent` prefixes each name line, `closingIndent` the closing parenthesis.
    public static String renderParenthesized(ImportFrom node, String itemIndent, String closingIndent) {
        var builder = new StringBuilder(header(node)).append("(\n");
        for (var alias : node.names()) {
            builder.append(itemIndent)
                   .append(render(alias))
                   .append(",\n");
        }
        return builder.append(closingIndent)
                      .append(')')
                      .toString();
    }

    public static String render(Alias alias) {
        return alias.asName()
                    .map(asName -> alias.name() + " as " + asName)
                    .orElse(alias.name());
    }

    private static String header(ImportFrom node) {
        return "from " + ".".repeat(node.level()) + node.module() + " import ";
    }
}
