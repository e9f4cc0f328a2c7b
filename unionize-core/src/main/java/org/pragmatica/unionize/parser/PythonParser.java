package org.pragmatica.unionize.parser;

import org.pragmatica.unionize.parser.PyNode.Alias;
import org.pragmatica.unionize.parser.PyNode.Attribute;
import org.pragmatica.unionize.parser.PyNode.Block;
import org.pragmatica.unionize.parser.PyNode.Expr;
import org.pragmatica.unionize.parser.PyNode.Import;
import org.pragmatica.unionize.parser.PyNode.ImportFrom;
import org.pragmatica.unionize.parser.PyNode.Literal;
import org.pragmatica.unionize.parser.PyNode.Module;
import org.pragmatica.unionize.parser.PyNode.Name;
import org.pragmatica.unionize.parser.PyNode.Statement;
import org.pragmatica.unionize.parser.PyNode.Str;
import org.pragmatica.unionize.parser.PyNode.Subscript;
import org.pragmatica.unionize.parser.PyNode.Tuple;
import org.pragmatica.unionize.shared.RewriteException;
import org.pragmatica.unionize.shared.RewriteException.ParseFailure;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/// Recursive-descent parser for Python 3 source.
///
/// Builds the tree the rewriter needs: statements grouped into indentation blocks, imports as
/// dedicated nodes, and expressions with exact spans and load/store context. Statement-level
/// semantics the rewriter does not care about (decorators, `global`, `match` patterns) are parsed
/// for validity and kept as generic [Statement] nodes.
public final class PythonParser {
    private static final Set<String> KEYWORDS = Set.of("False", "None", "True", "and", "as", "assert", "async",
                                                       "await", "break", "class", "continue", "def", "del", "elif",
                                                       "else", "except", "finally", "for", "from", "global", "if",
                                                       "import", "in", "is", "lambda", "nonlocal", "not", "or",
                                                       "pass", "raise", "return", "try", "while", "with", "yield");
    private static final Set<String> AUGMENTED_ASSIGNMENTS = Set.of("+=", "-=", "*=", "/=", "//=", "%=", "@=",
                                                                    "&=", "|=", "^=", ">>=", "<<=", "**=");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "==", ">=", "<=", "!=");

    private PythonParser() {}

    public static PythonParser pythonParser() {
        return new PythonParser();
    }

    /// Parse a whole file.
    public Module parse(String source, String fileName) throws ParseFailure {
        var session = new Session(Tokenizer.tokenize(source, fileName), fileName);
        try {
            return session.module(SourceText.sourceText(source));
        } catch (StackOverflowError e) {
            throw session.tooDeeplyNested();
        }
    }

    /// Parse a single expression. Line breaks are insignificant, as inside brackets.
    public PyNode parseExpression(String source, String fileName) throws ParseFailure {
        var session = new Session(Tokenizer.tokenizeExpression(source, fileName), fileName);
        try {
            return session.fragment();
        } catch (StackOverflowError e) {
            throw session.tooDeeplyNested();
        }
    }

    @FunctionalInterface
    private interface Production {
        PyNode parse() throws ParseFailure;
    }

    private static final class Session {
        private final List<Token> tokens;
        private final String fileName;
        private int index;
        private Token previous;

        private Session(List<Token> tokens, String fileName) {
            this.tokens = tokens;
            this.fileName = fileName;
        }

        // --- Entry points ---

        Module module(SourceText text) throws ParseFailure {
            var statements = new ArrayList<PyNode>();
            while (peek().kind() != TokenKind.EOF) {
                if (peek().indent() != 0) {
                    throw failure(peek(), "unexpected indent");
                }
                statementLine(statements, 0);
            }
            var whole = Span.span(Position.ORIGIN, text.end());
            var bodySpan = statements.isEmpty()
                           ? whole
                           : Span.covering(statements.get(0).span(), last(statements).span());
            return new Module(new Block(statements, false, bodySpan), whole);
        }

        PyNode fragment() throws ParseFailure {
            var node = starExpressions();
            if (peek().kind() != TokenKind.EOF) {
                throw unexpected(peek());
            }
            return node;
        }

        // --- Statements ---

        private Block block(int indent) throws ParseFailure {
            var statements = new ArrayList<PyNode>();
            while (peek().kind() != TokenKind.EOF && peek().indent() >= indent) {
                if (peek().indent() > indent) {
                    throw failure(peek(), "unexpected indent");
                }
                statementLine(statements, indent);
            }
            return new Block(statements, true, Span.covering(statements.get(0).span(), last(statements).span()));
        }

        private void statementLine(List<PyNode> statements, int indent) throws ParseFailure {
            var token = peek();
            if (token.isOp("@")) {
                var start = next();
                var decorator = namedExpression();
                statements.add(new Statement(StatementKind.DECORATOR, List.of(decorator), spanFrom(start)));
                expectNewline();
                return;
            }
            if (isCompoundStart()) {
                statements.add(compoundStatement(indent));
                return;
            }
            simpleStatements(statements);
        }

        private void simpleStatements(List<PyNode> statements) throws ParseFailure {
            while (true) {
                statements.add(simpleStatement());
                if (!acceptOp(";") || peek().kind() == TokenKind.NEWLINE) {
                    break;
                }
            }
            expectNewline();
        }

        private boolean isCompoundStart() {
            var token = peek();
            if (token.kind() != TokenKind.NAME) {
                return false;
            }
            return switch (token.text()) {
                case "if", "elif", "else", "while", "for", "try", "except", "finally", "with", "def", "class" -> true;
                case "async" -> peek(1).isName("def") || peek(1).isName("for") || peek(1).isName("with");
                case "match", "case" -> isSoftKeywordHeader();
                default -> false;
            };
        }

        // `match`/`case` start a block only when the logical line has the `kw subject:` shape.
        private boolean isSoftKeywordHeader() {
            var next = peek(1);
            if (next.kind() == TokenKind.NEWLINE || next.kind() == TokenKind.EOF) {
                return false;
            }
            if (next.kind() == TokenKind.OP && !Set.of("(", "[", "{", "-", "*", "~", "...").contains(next.text())) {
                return false;
            }
            var cursor = index + 1;
            while (tokens.get(cursor).kind() != TokenKind.NEWLINE && tokens.get(cursor).kind() != TokenKind.EOF) {
                cursor++;
            }
            return tokens.get(cursor - 1).isOp(":");
        }

        private Statement compoundStatement(int indent) throws ParseFailure {
            var start = peek();
            if (start.isName("async")) {
                next();
            }
            var keyword = next();
            var header = new ArrayList<PyNode>();
            var kind = switch (keyword.text()) {
                case "if" -> StatementKind.IF;
                case "elif" -> StatementKind.ELIF;
                case "else" -> StatementKind.ELSE;
                case "while" -> StatementKind.WHILE;
                case "for" -> StatementKind.FOR;
                case "try" -> StatementKind.TRY;
                case "except" -> StatementKind.EXCEPT;
                case "finally" -> StatementKind.FINALLY;
                case "with" -> StatementKind.WITH;
                case "def" -> StatementKind.DEF;
                case "class" -> StatementKind.CLASS;
                case "match" -> StatementKind.MATCH;
                default -> StatementKind.CASE;
            };
            switch (kind) {
                case IF, ELIF, WHILE -> header.add(namedExpression());
                case FOR -> {
                    header.add(targetList(ExprContext.STORE));
                    expectKeyword("in");
                    header.add(starExpressions());
                }
                case EXCEPT -> exceptHeader(header);
                case WITH -> withItems(header);
                case DEF -> functionHeader(header);
                case CLASS -> classHeader(header);
                case MATCH -> header.add(starExpressions());
                case CASE -> caseHeader(header);
                default -> {}
            }
            expectOp(":");
            var body = suite(indent);
            header.add(body);
            return new Statement(kind, header, Span.span(start.start(), body.span()
                                                                           .end()));
        }

        private Block suite(int indent) throws ParseFailure {
            if (peek().kind() == TokenKind.NEWLINE) {
                next();
                var first = peek();
                if (first.kind() == TokenKind.EOF || first.indent() <= indent) {
                    throw failure(first, "expected an indented block");
                }
                return block(first.indent());
            }
            var statements = new ArrayList<PyNode>();
            simpleStatements(statements);
            return new Block(statements, true, Span.covering(statements.get(0).span(), last(statements).span()));
        }

        private void exceptHeader(List<PyNode> header) throws ParseFailure {
            acceptOp("*");
            if (peek().isOp(":")) {
                return;
            }
            header.add(expression());
            if (peek().isOp(",")) {
                // Python 3.14 allows an unparenthesized exception tuple.
                var elements = new ArrayList<PyNode>(header);
                while (acceptOp(",")) {
                    elements.add(expression());
                }
                header.clear();
                header.add(new Tuple(elements, false, ExprContext.LOAD, Span.covering(elements.get(0).span(),
                                                                                      last(elements).span())));
            }
            if (acceptKeyword("as")) {
                header.add(storeName());
            }
        }

        private void withItems(List<PyNode> header) throws ParseFailure {
            if (peek().isOp("(") && parenthesizedWithItems()) {
                next();
                while (!peek().isOp(")")) {
                    withItem(header);
                    if (!acceptOp(",")) {
                        break;
                    }
                }
                expectOp(")");
                return;
            }
            do {
                withItem(header);
            } while (acceptOp(","));
        }

        // `with (a as b, c):` versus `with (a, b) as c:` or `with (a):`
        private boolean parenthesizedWithItems() {
            var depth = 0;
            for (int cursor = index; cursor < tokens.size(); cursor++) {
                var token = tokens.get(cursor);
                if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                    depth++;
                } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                    depth--;
                    if (depth == 0) {
                        return tokens.get(cursor + 1).isOp(":");
                    }
                } else if (token.kind() == TokenKind.NEWLINE || token.kind() == TokenKind.EOF) {
                    return false;
                }
            }
            return false;
        }

        private void withItem(List<PyNode> header) throws ParseFailure {
            header.add(expression());
            if (acceptKeyword("as")) {
                header.add(asTarget(starTarget(), ExprContext.STORE));
            }
        }

        private void functionHeader(List<PyNode> header) throws ParseFailure {
            header.add(storeName());
            typeParameters(header);
            expectOp("(");
            parameters(header, ")", true);
            expectOp(")");
            if (acceptOp("->")) {
                header.add(expression());
            }
        }

        private void classHeader(List<PyNode> header) throws ParseFailure {
            header.add(storeName());
            typeParameters(header);
            if (acceptOp("(")) {
                arguments(header);
                expectOp(")");
            }
        }

        private void caseHeader(List<PyNode> header) throws ParseFailure {
            do {
                if (peek().isOp(":") || peek().isName("if")) {
                    break;
                }
                header.add(pattern());
            } while (acceptOp(","));
            if (acceptKeyword("if")) {
                header.add(namedExpression());
            }
        }

        private PyNode pattern() throws ParseFailure {
            var start = peek();
            var pattern = acceptOp("*")
                          ? new Expr(ExprKind.STARRED, List.of(storeName()), spanFrom(start))
                          : bitOr();
            if (acceptKeyword("as")) {
                return new Expr(ExprKind.PATTERN, List.of(pattern, storeName()), spanFrom(start));
            }
            return pattern;
        }

        private void typeParameters(List<PyNode> header) throws ParseFailure {
            if (!acceptOp("[")) {
                return;
            }
            while (!peek().isOp("]")) {
                if (!acceptOp("**")) {
                    acceptOp("*");
                }
                header.add(storeName());
                if (acceptOp(":")) {
                    header.add(expression());
                }
                if (acceptOp("=")) {
                    header.add(starExpression());
                }
                if (!acceptOp(",")) {
                    break;
                }
            }
            expectOp("]");
        }

        /// Parameter list of `def` (annotations allowed) or `lambda` (no annotations).
        private void parameters(List<PyNode> out, String terminator, boolean annotated) throws ParseFailure {
            while (!peek().isOp(terminator)) {
                if (acceptOp("/")) {
                    // positional-only marker
                } else if (acceptOp("**")) {
                    parameter(out, annotated, false, false);
                } else if (acceptOp("*")) {
                    if (peek().kind() == TokenKind.NAME) {
                        parameter(out, annotated, true, false);
                    }
                } else {
                    parameter(out, annotated, false, true);
                }
                if (!acceptOp(",")) {
                    break;
                }
            }
        }

        private void parameter(List<PyNode> out, boolean annotated, boolean starred, boolean withDefault)
        throws ParseFailure {
            out.add(storeName());
            if (annotated && acceptOp(":")) {
                out.add(starred
                        ? starExpression()
                        : expression());
            }
            if (withDefault && acceptOp("=")) {
                out.add(expression());
            }
        }

        private PyNode simpleStatement() throws ParseFailure {
            var start = peek();
            if (start.kind() == TokenKind.NAME) {
                switch (start.text()) {
                    case "import":
                        return importStatement();
                    case "from":
                        return fromImport();
                    case "pass":
                        next();
                        return new Statement(StatementKind.PASS, List.of(), spanFrom(start));
                    case "break":
                        next();
                        return new Statement(StatementKind.BREAK, List.of(), spanFrom(start));
                    case "continue":
                        next();
                        return new Statement(StatementKind.CONTINUE, List.of(), spanFrom(start));
                    case "return":
                        next();
                        return new Statement(StatementKind.RETURN,
                                             atSimpleStatementEnd()
                                             ? List.of()
                                             : List.of(starExpressions()),
                                             spanFrom(start));
                    case "raise":
                        return raiseStatement();
                    case "del":
                        next();
                        return new Statement(StatementKind.DEL, List.of(targetList(ExprContext.DEL)), spanFrom(start));
                    case "assert":
                        return assertStatement();
                    case "global", "nonlocal":
                        return scopeDeclaration();
                    case "type":
                        if (peek(1).kind() == TokenKind.NAME && (peek(2).isOp("=") || peek(2).isOp("["))) {
                            return typeAlias();
                        }
                        break;
                    default:
                        break;
                }
            }
            return expressionStatement();
        }

        private Statement raiseStatement() throws ParseFailure {
            var start = next();
            var children = new ArrayList<PyNode>();
            if (!atSimpleStatementEnd()) {
                children.add(expression());
                if (acceptKeyword("from")) {
                    children.add(expression());
                }
            }
            return new Statement(StatementKind.RAISE, children, spanFrom(start));
        }

        private Statement assertStatement() throws ParseFailure {
            var start = next();
            var children = new ArrayList<PyNode>();
            children.add(expression());
            if (acceptOp(",")) {
                children.add(expression());
            }
            return new Statement(StatementKind.ASSERT, children, spanFrom(start));
        }

        private Statement scopeDeclaration() throws ParseFailure {
            var start = next();
            var names = new ArrayList<PyNode>();
            do {
                names.add(storeName());
            } while (acceptOp(","));
            return new Statement(start.text()
                                      .equals("global")
                                 ? StatementKind.GLOBAL
                                 : StatementKind.NONLOCAL,
                                 names,
                                 spanFrom(start));
        }

        private Statement typeAlias() throws ParseFailure {
            var start = next();
            var children = new ArrayList<PyNode>();
            children.add(storeName());
            typeParameters(children);
            expectOp("=");
            children.add(expression());
            return new Statement(StatementKind.TYPE_ALIAS, children, spanFrom(start));
        }

        private Statement expressionStatement() throws ParseFailure {
            var start = peek();
            var first = assignable();
            if (peek().isOp("=")) {
                var parts = new ArrayList<PyNode>();
                parts.add(first);
                while (acceptOp("=")) {
                    parts.add(assignable());
                }
                var children = new ArrayList<PyNode>();
                for (int i = 0; i < parts.size() - 1; i++) {
                    children.add(asTarget(parts.get(i), ExprContext.STORE));
                }
                children.add(last(parts));
                return new Statement(StatementKind.ASSIGN, children, spanFrom(start));
            }
            if (peek().kind() == TokenKind.OP && AUGMENTED_ASSIGNMENTS.contains(peek().text())) {
                next();
                var value = assignable();
                return new Statement(StatementKind.AUG_ASSIGN,
                                     List.of(asTarget(first, ExprContext.STORE), value),
                                     spanFrom(start));
            }
            if (acceptOp(":")) {
                var children = new ArrayList<PyNode>();
                children.add(asTarget(first, ExprContext.STORE));
                children.add(expression());
                if (acceptOp("=")) {
                    children.add(assignable());
                }
                return new Statement(StatementKind.ANN_ASSIGN, children, spanFrom(start));
            }
            return new Statement(StatementKind.EXPRESSION, List.of(first), spanFrom(start));
        }

        private PyNode assignable() throws ParseFailure {
            return peek().isName("yield")
                   ? yieldExpression()
                   : starExpressions();
        }

        private boolean atSimpleStatementEnd() {
            var token = peek();
            return token.kind() == TokenKind.NEWLINE || token.kind() == TokenKind.EOF || token.isOp(";");
        }

        // --- Imports ---

        private Import importStatement() throws ParseFailure {
            var start = next();
            var names = new ArrayList<Alias>();
            do {
                names.add(alias(true));
            } while (acceptOp(","));
            return new Import(names, spanFrom(start));
        }

        private ImportFrom fromImport() throws ParseFailure {
            var start = next();
            var level = 0;
            while (peek().isOp(".") || peek().isOp("...")) {
                level += next().text()
                               .length();
            }
            var module = "";
            if (!peek().isName("import")) {
                module = dottedName();
            } else if (level == 0) {
                throw unexpected(peek());
            }
            expectKeyword("import");
            if (acceptOp("*")) {
                return new ImportFrom(module, level, List.of(), true, false, spanFrom(start));
            }
            var names = new ArrayList<Alias>();
            var parenthesized = acceptOp("(");
            do {
                if (parenthesized && peek().isOp(")")) {
                    break;
                }
                names.add(alias(false));
            } while (acceptOp(","));
            if (parenthesized) {
                expectOp(")");
            }
            if (names.isEmpty()) {
                throw unexpected(previous);
            }
            return new ImportFrom(module, level, names, false, parenthesized, spanFrom(start));
        }

        private Alias alias(boolean dotted) throws ParseFailure {
            var start = peek();
            var name = dotted
                       ? dottedName()
                       : expectName().text();
            var asName = acceptKeyword("as")
                         ? Optional.of(expectName().text())
                         : Optional.<String>empty();
            return Alias.alias(name, asName, spanFrom(start));
        }

        private String dottedName() throws ParseFailure {
            var builder = new StringBuilder(expectName().text());
            while (acceptOp(".")) {
                builder.append('.')
                       .append(expectName().text());
            }
            return builder.toString();
        }

        // --- Targets ---

        private PyNode targetList(ExprContext context) throws ParseFailure {
            var start = peek();
            var first = starTarget();
            if (!peek().isOp(",")) {
                return asTarget(first, context);
            }
            var elements = new ArrayList<PyNode>();
            elements.add(asTarget(first, context));
            while (acceptOp(",")) {
                if (!atExpressionStart()) {
                    break;
                }
                elements.add(asTarget(starTarget(), context));
            }
            return new Tuple(elements, false, context, spanFrom(start));
        }

        private PyNode starTarget() throws ParseFailure {
            var start = peek();
            if (acceptOp("*")) {
                return new Expr(ExprKind.STARRED, List.of(bitOr()), spanFrom(start));
            }
            return bitOr();
        }

        private PyNode asTarget(PyNode node, ExprContext context) throws ParseFailure {
            if (node instanceof Name name) {
                return new Name(name.id(), context, name.span());
            }
            if (node instanceof Attribute attribute) {
                return new Attribute(attribute.value(), attribute.attr(), context, attribute.span());
            }
            if (node instanceof Subscript subscript) {
                return new Subscript(subscript.value(), subscript.slice(), context, subscript.span());
            }
            if (node instanceof Tuple tuple) {
                return new Tuple(targets(tuple.elements(), context), tuple.parenthesized(), context, tuple.span());
            }
            if (node instanceof Expr expr
                && (expr.kind() == ExprKind.LIST || expr.kind() == ExprKind.STARRED || expr.kind() == ExprKind.PAREN)) {
                return new Expr(expr.kind(), targets(expr.children(), context), expr.span());
            }
            throw failure(node.span()
                              .start(), "cannot assign to expression");
        }

        private List<PyNode> targets(List<PyNode> nodes, ExprContext context) throws ParseFailure {
            var result = new ArrayList<PyNode>();
            for (var node : nodes) {
                result.add(asTarget(node, context));
            }
            return result;
        }

        private Name storeName() throws ParseFailure {
            var token = expectName();
            return new Name(token.text(), ExprContext.STORE, token.span());
        }

        // --- Expressions ---

        private PyNode starExpressions() throws ParseFailure {
            var start = peek();
            var first = starExpression();
            if (!peek().isOp(",")) {
                return first;
            }
            var elements = new ArrayList<PyNode>();
            elements.add(first);
            while (acceptOp(",")) {
                if (!atExpressionStart()) {
                    break;
                }
                elements.add(starExpression());
            }
            return new Tuple(elements, false, ExprContext.LOAD, Span.span(start.start(), last(elements).span()
                                                                                                       .end()));
        }

        private PyNode starExpression() throws ParseFailure {
            var start = peek();
            if (acceptOp("*")) {
                return new Expr(ExprKind.STARRED, List.of(bitOr()), spanFrom(start));
            }
            return namedExpression();
        }

        private PyNode namedExpression() throws ParseFailure {
            if (peek().kind() == TokenKind.NAME && peek(1).isOp(":=")) {
                var start = peek();
                var target = storeName();
                next();
                var value = expression();
                return new Expr(ExprKind.NAMED, List.of(target, value), spanFrom(start));
            }
            return expression();
        }

        private PyNode expression() throws ParseFailure {
            var start = peek();
            if (start.isName("lambda")) {
                return lambda();
            }
            var body = disjunction();
            if (!peek().isName("if")) {
                return body;
            }
            next();
            var condition = disjunction();
            expectKeyword("else");
            var orElse = expression();
            return new Expr(ExprKind.TERNARY, List.of(body, condition, orElse), spanFrom(start));
        }

        private PyNode lambda() throws ParseFailure {
            var start = next();
            var children = new ArrayList<PyNode>();
            parameters(children, ":", false);
            expectOp(":");
            children.add(expression());
            return new Expr(ExprKind.LAMBDA, children, spanFrom(start));
        }

        private PyNode disjunction() throws ParseFailure {
            return keywordChain("or", this::conjunction);
        }

        private PyNode conjunction() throws ParseFailure {
            return keywordChain("and", this::inversion);
        }

        private PyNode keywordChain(String keyword, Production operand) throws ParseFailure {
            var start = peek();
            var first = operand.parse();
            if (!peek().isName(keyword)) {
                return first;
            }
            var operands = new ArrayList<PyNode>();
            operands.add(first);
            while (acceptKeyword(keyword)) {
                operands.add(operand.parse());
            }
            return new Expr(ExprKind.BOOL_OP, operands, spanFrom(start));
        }

        private PyNode inversion() throws ParseFailure {
            var start = peek();
            if (acceptKeyword("not")) {
                return new Expr(ExprKind.NOT, List.of(inversion()), spanFrom(start));
            }
            return comparison();
        }

        private PyNode comparison() throws ParseFailure {
            var start = peek();
            var first = bitOr();
            if (!atComparisonOperator()) {
                return first;
            }
            var operands = new ArrayList<PyNode>();
            operands.add(first);
            while (atComparisonOperator()) {
                if (peek().isName("not") || peek().isName("is") && peek(1).isName("not")) {
                    next();
                }
                next();
                operands.add(bitOr());
            }
            return new Expr(ExprKind.COMPARE, operands, spanFrom(start));
        }

        private boolean atComparisonOperator() {
            var token = peek();
            if (token.kind() == TokenKind.OP) {
                return COMPARISON_OPERATORS.contains(token.text());
            }
            return token.isName("in") || token.isName("is") || token.isName("not") && peek(1).isName("in");
        }

        private PyNode bitOr() throws ParseFailure {
            return binaryChain(Set.of("|"), this::bitXor);
        }

        private PyNode bitXor() throws ParseFailure {
            return binaryChain(Set.of("^"), this::bitAnd);
        }

        private PyNode bitAnd() throws ParseFailure {
            return binaryChain(Set.of("&"), this::shift);
        }

        private PyNode shift() throws ParseFailure {
            return binaryChain(Set.of("<<", ">>"), this::sum);
        }

        private PyNode sum() throws ParseFailure {
            return binaryChain(Set.of("+", "-"), this::term);
        }

        private PyNode term() throws ParseFailure {
            return binaryChain(Set.of("*", "/", "//", "%", "@"), this::factor);
        }

        private PyNode binaryChain(Set<String> operators, Production operand) throws ParseFailure {
            var start = peek();
            var left = operand.parse();
            while (peek().kind() == TokenKind.OP && operators.contains(peek().text())) {
                next();
                var right = operand.parse();
                left = new Expr(ExprKind.BINARY, List.of(left, right), spanFrom(start));
            }
            return left;
        }

        private PyNode factor() throws ParseFailure {
            var start = peek();
            if (acceptOp("+") || acceptOp("-") || acceptOp("~")) {
                return new Expr(ExprKind.UNARY, List.of(factor()), spanFrom(start));
            }
            return power();
        }

        private PyNode power() throws ParseFailure {
            var start = peek();
            var base = awaitPrimary();
            if (acceptOp("**")) {
                var exponent = factor();
                return new Expr(ExprKind.BINARY, List.of(base, exponent), spanFrom(start));
            }
            return base;
        }

        private PyNode awaitPrimary() throws ParseFailure {
            var start = peek();
            if (acceptKeyword("await")) {
                return new Expr(ExprKind.AWAIT, List.of(primary()), spanFrom(start));
            }
            return primary();
        }

        private PyNode primary() throws ParseFailure {
            var start = peek();
            var node = atom();
            while (true) {
                if (acceptOp(".")) {
                    var attr = expectName();
                    node = new Attribute(node, attr.text(), ExprContext.LOAD, spanFrom(start));
                } else if (acceptOp("(")) {
                    var children = new ArrayList<PyNode>();
                    children.add(node);
                    arguments(children);
                    expectOp(")");
                    node = new Expr(ExprKind.CALL, children, spanFrom(start));
                } else if (acceptOp("[")) {
                    var slice = slices();
                    expectOp("]");
                    node = new Subscript(node, slice, ExprContext.LOAD, spanFrom(start));
                } else {
                    return node;
                }
            }
        }

        private void arguments(List<PyNode> out) throws ParseFailure {
            while (!peek().isOp(")")) {
                var start = peek();
                if (acceptOp("*")) {
                    out.add(new Expr(ExprKind.STARRED, List.of(expression()), spanFrom(start)));
                } else if (acceptOp("**")) {
                    out.add(new Expr(ExprKind.DOUBLE_STARRED, List.of(expression()), spanFrom(start)));
                } else if (start.kind() == TokenKind.NAME && peek(1).isOp("=")) {
                    next();
                    next();
                    out.add(new Expr(ExprKind.KEYWORD, List.of(expression()), spanFrom(start)));
                } else {
                    var argument = namedExpression();
                    if (atComprehension()) {
                        var children = new ArrayList<PyNode>();
                        children.add(argument);
                        comprehensionClauses(children);
                        argument = new Expr(ExprKind.GENERATOR, children, spanFrom(start));
                    }
                    out.add(argument);
                }
                if (!acceptOp(",")) {
                    break;
                }
            }
        }

        private PyNode slices() throws ParseFailure {
            var start = peek();
            var first = slice();
            if (!peek().isOp(",")) {
                return first;
            }
            var elements = new ArrayList<PyNode>();
            elements.add(first);
            while (acceptOp(",")) {
                if (peek().isOp("]")) {
                    break;
                }
                elements.add(slice());
            }
            return new Tuple(elements, false, ExprContext.LOAD, Span.span(start.start(), last(elements).span()
                                                                                                       .end()));
        }

        private PyNode slice() throws ParseFailure {
            var start = peek();
            if (peek().isOp("*")) {
                return starExpression();
            }
            var parts = new ArrayList<PyNode>();
            if (!peek().isOp(":")) {
                var lower = namedExpression();
                if (!peek().isOp(":")) {
                    return lower;
                }
                parts.add(lower);
            }
            expectOp(":");
            if (atExpressionStart()) {
                parts.add(expression());
            }
            if (acceptOp(":") && atExpressionStart()) {
                parts.add(expression());
            }
            return new Expr(ExprKind.SLICE, parts, spanFrom(start));
        }

        private PyNode atom() throws ParseFailure {
            var token = peek();
            switch (token.kind()) {
                case NAME -> {
                    next();
                    if (token.text()
                             .equals("None") || token.text()
                                                     .equals("True") || token.text()
                                                                             .equals("False")) {
                        return new Literal(token.text(), token.span());
                    }
                    if (KEYWORDS.contains(token.text())) {
                        throw unexpected(token);
                    }
                    return new Name(token.text(), ExprContext.LOAD, token.span());
                }
                case NUMBER -> {
                    next();
                    return new Literal(token.text(), token.span());
                }
                case STRING -> {
                    next();
                    while (peek().kind() == TokenKind.STRING) {
                        next();
                    }
                    return new Str(spanFrom(token));
                }
                case OP -> {
                    return switch (token.text()) {
                        case "..." -> {
                            next();
                            yield new Literal("...", token.span());
                        }
                        case "(" -> parenthesized();
                        case "[" -> listDisplay();
                        case "{" -> braceDisplay();
                        default -> throw unexpected(token);
                    };
                }
                default -> throw unexpected(token);
            }
        }

        private PyNode parenthesized() throws ParseFailure {
            var start = next();
            if (acceptOp(")")) {
                return new Tuple(List.of(), true, ExprContext.LOAD, spanFrom(start));
            }
            if (peek().isName("yield")) {
                var value = yieldExpression();
                expectOp(")");
                return new Expr(ExprKind.PAREN, List.of(value), spanFrom(start));
            }
            var first = starExpression();
            if (atComprehension()) {
                var children = new ArrayList<PyNode>();
                children.add(first);
                comprehensionClauses(children);
                expectOp(")");
                return new Expr(ExprKind.GENERATOR, children, spanFrom(start));
            }
            if (peek().isOp(",")) {
                var elements = new ArrayList<PyNode>();
                elements.add(first);
                while (acceptOp(",")) {
                    if (peek().isOp(")")) {
                        break;
                    }
                    elements.add(starExpression());
                }
                expectOp(")");
                return new Tuple(elements, true, ExprContext.LOAD, spanFrom(start));
            }
            expectOp(")");
            return new Expr(ExprKind.PAREN, List.of(first), spanFrom(start));
        }

        private PyNode listDisplay() throws ParseFailure {
            var start = next();
            var elements = new ArrayList<PyNode>();
            if (acceptOp("]")) {
                return new Expr(ExprKind.LIST, elements, spanFrom(start));
            }
            elements.add(starExpression());
            if (atComprehension()) {
                comprehensionClauses(elements);
                expectOp("]");
                return new Expr(ExprKind.LIST_COMP, elements, spanFrom(start));
            }
            while (acceptOp(",")) {
                if (peek().isOp("]")) {
                    break;
                }
                elements.add(starExpression());
            }
            expectOp("]");
            return new Expr(ExprKind.LIST, elements, spanFrom(start));
        }

        private PyNode braceDisplay() throws ParseFailure {
            var start = next();
            var elements = new ArrayList<PyNode>();
            if (acceptOp("}")) {
                return new Expr(ExprKind.DICT, elements, spanFrom(start));
            }
            boolean dict;
            if (peek().isOp("**")) {
                dict = true;
                dictEntry(elements);
            } else if (peek().isOp("*")) {
                dict = false;
                elements.add(starExpression());
            } else {
                dict = dictEntryOrElement(elements);
            }
            if (atComprehension()) {
                comprehensionClauses(elements);
                expectOp("}");
                return new Expr(dict
                                ? ExprKind.DICT_COMP
                                : ExprKind.SET_COMP, elements, spanFrom(start));
            }
            while (acceptOp(",")) {
                if (peek().isOp("}")) {
                    break;
                }
                if (dict) {
                    dictEntry(elements);
                } else {
                    elements.add(starExpression());
                }
            }
            expectOp("}");
            return new Expr(dict
                            ? ExprKind.DICT
                            : ExprKind.SET, elements, spanFrom(start));
        }

        // Parses the first entry of a brace display and reports whether it was a `key: value` pair.
        private boolean dictEntryOrElement(List<PyNode> elements) throws ParseFailure {
            var first = namedExpression();
            elements.add(first);
            if (acceptOp(":")) {
                elements.add(expression());
                return true;
            }
            return false;
        }

        private void dictEntry(List<PyNode> elements) throws ParseFailure {
            var start = peek();
            if (acceptOp("**")) {
                elements.add(new Expr(ExprKind.DOUBLE_STARRED, List.of(bitOr()), spanFrom(start)));
                return;
            }
            elements.add(expression());
            expectOp(":");
            elements.add(expression());
        }

        private boolean atComprehension() {
            return peek().isName("for") || peek().isName("async") && peek(1).isName("for");
        }

        private void comprehensionClauses(List<PyNode> out) throws ParseFailure {
            while (atComprehension()) {
                var start = peek();
                acceptKeyword("async");
                expectKeyword("for");
                var children = new ArrayList<PyNode>();
                children.add(targetList(ExprContext.STORE));
                expectKeyword("in");
                children.add(disjunction());
                while (acceptKeyword("if")) {
                    children.add(disjunction());
                }
                out.add(new Expr(ExprKind.FOR_CLAUSE, children, spanFrom(start)));
            }
        }

        private PyNode yieldExpression() throws ParseFailure {
            var start = next();
            if (acceptKeyword("from")) {
                return new Expr(ExprKind.YIELD, List.of(expression()), spanFrom(start));
            }
            if (atExpressionStart()) {
                return new Expr(ExprKind.YIELD, List.of(starExpressions()), spanFrom(start));
            }
            return new Expr(ExprKind.YIELD, List.of(), spanFrom(start));
        }

        private boolean atExpressionStart() {
            var token = peek();
            return switch (token.kind()) {
                case NAME -> !KEYWORDS.contains(token.text())
                             || Set.of("None", "True", "False", "not", "lambda", "await").contains(token.text());
                case NUMBER, STRING -> true;
                case OP -> Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(token.text());
                default -> false;
            };
        }

        // --- Token stream ---

        private Token peek() {
            return tokens.get(index);
        }

        private Token peek(int ahead) {
            return tokens.get(Math.min(index + ahead, tokens.size() - 1));
        }

        private Token next() {
            var token = tokens.get(index);
            if (token.kind() != TokenKind.EOF) {
                index++;
            }
            previous = token;
            return token;
        }

        private boolean acceptOp(String op) {
            if (peek().isOp(op)) {
                next();
                return true;
            }
            return false;
        }

        private boolean acceptKeyword(String keyword) {
            if (peek().isName(keyword)) {
                next();
                return true;
            }
            return false;
        }

        private void expectOp(String op) throws ParseFailure {
            if (!acceptOp(op)) {
                throw failure(peek(), "expected '" + op + "', found " + peek());
            }
        }

        private void expectKeyword(String keyword) throws ParseFailure {
            if (!acceptKeyword(keyword)) {
                throw failure(peek(), "expected '" + keyword + "', found " + peek());
            }
        }

        private Token expectName() throws ParseFailure {
            var token = peek();
            if (token.kind() != TokenKind.NAME || KEYWORDS.contains(token.text())) {
                throw failure(token, "expected a name, found " + token);
            }
            return next();
        }

        private void expectNewline() throws ParseFailure {
            var token = peek();
            if (token.kind() == TokenKind.NEWLINE) {
                next();
            } else if (token.kind() != TokenKind.EOF) {
                throw unexpected(token);
            }
        }

        private Span spanFrom(Token start) {
            return Span.span(start.start(), previous.end());
        }

        // The stack ran out below the innermost token reached so far.
        ParseFailure tooDeeplyNested() {
            return failure(peek(), "expression too deeply nested");
        }

        private ParseFailure unexpected(Token token) {
            return failure(token, "invalid syntax, unexpected " + token);
        }

        private ParseFailure failure(Token token, String message) {
            return failure(token.start(), message);
        }

        private ParseFailure failure(Position position, String message) {
            return RewriteException.parseFailure(fileName, position.line(), position.column(), message);
        }

        private static <T> T last(List<T> list) {
            return list.get(list.size() - 1);
        }
    }
}
