package org.pragmatica.unionize.parser;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.unionize.parser.PyNode.Block;
import org.pragmatica.unionize.parser.PyNode.Import;
import org.pragmatica.unionize.parser.PyNode.ImportFrom;
import org.pragmatica.unionize.parser.PyNode.Name;
import org.pragmatica.unionize.parser.PyNode.Statement;
import org.pragmatica.unionize.parser.PyNode.Str;
import org.pragmatica.unionize.parser.PyNode.Subscript;
import org.pragmatica.unionize.parser.PyNode.Tuple;
import org.pragmatica.unionize.shared.RewriteException.ParseFailure;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.pragmatica.unionize.parser.PythonParser.pythonParser;

class PythonParserTest {
    private final PythonParser parser = pythonParser();

    @Test
    void parse_readsFromImportWithAliases() throws ParseFailure {
        var module = parser.parse("from typing import Optional as Opt, Union\n", "t.py");
        var statement = (ImportFrom) module.body()
                                           .statements()
                                           .get(0);

        assertThat(statement.module()).isEqualTo("typing");
        assertThat(statement.level()).isZero();
        assertThat(statement.names()).extracting(PyNode.Alias::name)
                                     .containsExactly("Optional", "Union");
        assertThat(statement.names()
                            .get(0)
                            .localName()).isEqualTo("Opt");
        assertThat(statement.span()).isEqualTo(Span.span(1, 0, 1, 41));
    }

    @Test
    void parse_readsRelativeAndStarImports() throws ParseFailure {
        var module = parser.parse("from ..pkg import x\nfrom . import y\nfrom typing import *\n", "t.py");
        var imports = PyNodes.findAll(module, ImportFrom.class);

        assertThat(imports.get(0)
                          .level()).isEqualTo(2);
        assertThat(imports.get(0)
                          .module()).isEqualTo("pkg");
        assertThat(imports.get(1)
                          .level()).isEqualTo(1);
        assertThat(imports.get(1)
                          .module()).isEmpty();
        assertThat(imports.get(2)
                          .star()).isTrue();
        assertThat(imports.get(2)
                          .names()).isEmpty();
    }

    @Test
    void parse_readsParenthesizedMultiLineImport() throws ParseFailure {
        var module = parser.parse("from typing import (\n    Optional,\n    cast,\n)\n", "t.py");
        var statement = (ImportFrom) module.body()
                                           .statements()
                                           .get(0);

        assertThat(statement.parenthesized()).isTrue();
        assertThat(statement.span()).isEqualTo(Span.span(1, 0, 4, 1));
        assertThat(statement.names()
                            .get(1)
                            .span()).isEqualTo(Span.span(3, 4, 3, 8));
    }

    @Test
    void parse_readsModuleImports() throws ParseFailure {
        var module = parser.parse("import os.path as p, typing\n", "t.py");
        var statement = (Import) module.body()
                                       .statements()
                                       .get(0);

        assertThat(statement.names()).extracting(PyNode.Alias::localName)
                                     .containsExactly("p", "typing");
        assertThat(statement.names()
                            .get(0)
                            .name()).isEqualTo("os.path");
    }

    @Test
    void parseExpression_readsSubscriptWithTupleSlice() throws ParseFailure {
        var node = (Subscript) parser.parseExpression("Union[A, B]", "t.py");
        var slice = (Tuple) node.slice();

        assertThat(node.span()).isEqualTo(Span.span(1, 0, 1, 11));
        assertThat(slice.parenthesized()).isFalse();
        assertThat(slice.elements()).hasSize(2);
        assertThat(slice.span()).isEqualTo(Span.span(1, 6, 1, 10));
    }

    @Test
    void parseExpression_marksParenthesizedTupleSlice() throws ParseFailure {
        var node = (Subscript) parser.parseExpression("Union[(A, B)]", "t.py");

        assertThat(node.slice()).isInstanceOfSatisfying(Tuple.class, tuple -> assertThat(tuple.parenthesized()).isTrue());
    }

    @Test
    void parseExpression_acceptsLineBreaksAnywhere() throws ParseFailure {
        var node = parser.parseExpression("Dict[\n    str,\n    int] | None", "t.py");

        assertThat(node.span()).isEqualTo(Span.span(1, 0, 3, 15));
    }

    @Test
    void parse_setsStoreContextOnAssignmentTargets() throws ParseFailure {
        var module = parser.parse("x: Optional[int] = None\na, b = c\n", "t.py");
        var names = PyNodes.findAll(module, Name.class);

        assertThat(names).filteredOn(name -> name.context() == ExprContext.STORE)
                         .extracting(Name::id)
                         .containsExactly("x", "a", "b");
        assertThat(PyNodes.findAll(module, Subscript.class)).singleElement()
                                                           .satisfies(subscript -> assertThat(subscript.context()).isEqualTo(ExprContext.LOAD));
    }

    @Test
    void parse_groupsStatementsIntoIndentedBlocks() throws ParseFailure {
        var module = parser.parse("""
                                  def f(x: int) -> None:
                                      if x:
                                          return
                                      y = 1

                                  z = 2
                                  """, "t.py");
        var statements = module.body()
                               .statements();

        assertThat(statements).hasSize(2);
        var function = (Statement) statements.get(0);
        assertThat(function.kind()).isEqualTo(StatementKind.DEF);
        var body = (Block) function.children()
                                   .get(function.children()
                                                .size() - 1);
        assertThat(body.nested()).isTrue();
        assertThat(body.statements()).hasSize(2);
        assertThat(function.span()).isEqualTo(Span.span(1, 0, 4, 9));
    }

    @Test
    void parse_acceptsSingleLineSuitesAndSemicolons() throws ParseFailure {
        var module = parser.parse("if x: import os; y = 1\nimport a; import b;\n", "t.py");
        var ifStatement = (Statement) module.body()
                                            .statements()
                                            .get(0);
        var suite = (Block) ifStatement.children()
                                       .get(1);

        assertThat(suite.statements()).hasSize(2);
        assertThat(module.body()
                         .statements()).hasSize(3);
    }

    @Test
    void parse_distinguishesSoftKeywordsFromNames() throws ParseFailure {
        var module = parser.parse("""
                                  match = re.match(p, s)
                                  match command:
                                      case [x, *rest] if x:
                                          pass
                                      case {"k": v} | Point(x=0) as p:
                                          pass
                                      case _:
                                          pass
                                  type Alias = list[int]
                                  type(x)
                                  """, "t.py");
        var kinds = module.body()
                          .statements()
                          .stream()
                          .map(statement -> ((Statement) statement).kind())
                          .toList();

        assertThat(kinds).containsExactly(StatementKind.ASSIGN,
                                          StatementKind.MATCH,
                                          StatementKind.TYPE_ALIAS,
                                          StatementKind.EXPRESSION);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "@decorator(arg)\nasync def f[T](a, /, b: int = 1, *args: T, c, **kw) -> T:\n    await g()\n",
            "class A(B, metaclass=M):\n    \"\"\"Doc.\"\"\"\n    x: int = 0\n",
            "result = [x for x in range(10) if x % 2 if x > 3]\n",
            "d = {**base, 'k': v, (1, 2): {a, *b}}\ns = {k: v for k, v in items}\n",
            "f = lambda x, *y, z=1, **w: x if y else z\n",
            "if (n := len(a)) > 10 and not b or c is not None:\n    pass\nelif d not in e:\n    pass\nelse:\n    pass\n",
            "try:\n    pass\nexcept* (A, B) as e:\n    raise X from e\nfinally:\n    del a[0], b.c\n",
            "with open(a) as f, (yield) as g:\n    pass\nwith (open(a) as f,\n      open(b) as g,):\n    pass\n",
            "for i, *rest in pairs:\n    continue\nwhile True:\n    break\n",
            "x = y = z[1:2, ::3, ...]\nx += -~1 ** 2 // 3 @ m\n",
            "global a, b\nassert a, \"message\"\nprint(*args, sep='', **kw)\n",
            "s = f'{a!r:>{width}}' 'implicit' \\\n    \"concatenation\"\n",
            "def gen():\n    x = yield\n    yield from other()\n    return (yield x)\n"
    })
    void parse_acceptsCommonSyntax(String source) throws ParseFailure {
        var module = parser.parse(source, "t.py");

        assertThat(module.body()
                         .statements()).isNotEmpty();
    }

    @Test
    void parse_keepsStringLiteralsAsStrNodes() throws ParseFailure {
        var module = parser.parse("x: Union[int, \"Later\"]\n", "t.py");
        var strings = PyNodes.findAll(module, Str.class);

        assertThat(strings).singleElement()
                           .extracting(Str::span)
                           .isEqualTo(Span.span(1, 14, 1, 21));
    }

    @Test
    void parse_reportsUnexpectedIndent() {
        var failure = assertThrows(ParseFailure.class, () -> parser.parse("  x = 1\n", "bad.py"));

        assertThat(failure.line()).isEqualTo(1);
        assertThat(failure.column()).isEqualTo(2);
        assertThat(failure.detail()).isEqualTo("unexpected indent");
    }

    @Test
    void parse_reportsMissingIndentedBlock() {
        var failure = assertThrows(ParseFailure.class, () -> parser.parse("if x:\nreturn\n", "bad.py"));

        assertThat(failure.line()).isEqualTo(2);
        assertThat(failure.detail()).isEqualTo("expected an indented block");
    }

    @Test
    void parse_reportsInvalidSyntaxWithPosition() {
        var failure = assertThrows(ParseFailure.class, () -> parser.parse("def f(:):\n    pass\n", "bad.py"));

        assertThat(failure.line()).isEqualTo(1);
        assertThat(failure.column()).isEqualTo(6);
        assertThat(failure.getMessage()).startsWith("bad.py:1:6: ");
    }

    @Test
    void parse_reportsExhaustedStackAsParseFailure() throws InterruptedException {
        var source = "x = " + "[".repeat(199) + "]".repeat(199) + "\n";
        var thrown = new AtomicReference<Throwable>();
        var thread = new Thread(null, () -> {
            try {
                parser.parse(source, "deep.py");
            } catch (Throwable e) {
                thrown.set(e);
            }
        }, "small-stack", 256 * 1024);

        thread.start();
        thread.join();

        // Depending on frame sizes the parse either fits or fails cleanly, never with StackOverflowError.
        if (thrown.get() != null) {
            assertThat(thrown.get()).isInstanceOfSatisfying(ParseFailure.class,
                                                            failure -> assertThat(failure.detail()).isEqualTo("expression too deeply nested"));
        }
    }

    @Test
    void parse_rejectsAssignmentToCall() {
        assertThrows(ParseFailure.class, () -> parser.parse("f() = 1\n", "bad.py"));
    }

    @Test
    void alias_localNameIsFirstSegmentOfUnaliasedDottedImport() {
        var alias = PyNode.Alias.alias("os.path", Optional.empty(), Span.span(1, 7, 1, 14));

        assertThat(alias.localName()).isEqualTo("os");
    }
}
