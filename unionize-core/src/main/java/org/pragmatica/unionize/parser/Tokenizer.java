package org.pragmatica.unionize.parser;

import org.pragmatica.unionize.shared.RewriteException;
import org.pragmatica.unionize.shared.RewriteException.ParseFailure;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/// Splits Python source into tokens with exact spans.
///
/// Comments and whitespace are dropped. A [TokenKind#NEWLINE] ends every logical line; line breaks
/// inside brackets and after a backslash continuation do not. In expression mode the whole input is
/// treated as if it were enclosed in brackets, so no NEWLINE tokens are produced at all.
/// Brackets nest at most 200 deep.
public final class Tokenizer {
    private static final List<String> OPERATORS = List.of("**=", "//=", ">>=", "<<=", "...",
                                                          "->", ":=", "**", "//", "<<", ">>", "<=", ">=", "==", "!=",
                                                          "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
                                                          "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
                                                          "(", ")", "[", "]", "{", "}", ",", ":", ".", ";", "=", "!");
    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "t",
                                                              "br", "rb", "fr", "rf", "tr", "rt");
    private static final int TAB_SIZE = 8;
    private static final int MAX_NESTING = 200;

    private final String source;
    private final String fileName;
    private final boolean expressionMode;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Token> openBrackets = new ArrayDeque<>();
    private int offset;
    private int line = 1;
    private int lineOffset;
    private boolean logicalLineStarted;

    private Tokenizer(String source, String fileName, boolean expressionMode) {
        this.source = source;
        this.fileName = fileName;
        this.expressionMode = expressionMode;
    }

    public static List<Token> tokenize(String source, String fileName) throws ParseFailure {
        return new Tokenizer(source, fileName, false).run();
    }

    public static List<Token> tokenizeExpression(String source, String fileName) throws ParseFailure {
        return new Tokenizer(source, fileName, true).run();
    }

    private List<Token> run() throws ParseFailure {
        while (offset < source.length()) {
            var c = source.charAt(offset);
            if (c == '\n') {
                endOfPhysicalLine();
            } else if (c == ' ' || c == '\t' || c == '\f' || c == '\r') {
                offset++;
            } else if (c == '#') {
                skipComment();
            } else if (c == '\\') {
                lineContinuation();
            } else if (isIdentifierStart(c)) {
                nameOrPrefixedString();
            } else if (isDigit(c) || (c == '.' && isDigit(charAt(offset + 1)))) {
                number();
            } else if (c == '"' || c == '\'') {
                string(offset, "");
            } else {
                operator();
            }
        }
        if (!openBrackets.isEmpty()) {
            var open = openBrackets.peek();
            throw failure(open.start(), "'" + open.text() + "' was never closed");
        }
        var end = position();
        if (logicalLineStarted && !expressionMode) {
            tokens.add(Token.token(TokenKind.NEWLINE, "", Span.span(end, end), -1));
        }
        tokens.add(Token.token(TokenKind.EOF, "", Span.span(end, end), 0));
        return List.copyOf(tokens);
    }

    private void endOfPhysicalLine() {
        if (!expressionMode && openBrackets.isEmpty() && logicalLineStarted) {
            var here = position();
            tokens.add(Token.token(TokenKind.NEWLINE, "\n", Span.span(here, here), -1));
            logicalLineStarted = false;
        }
        newLine();
    }

    private void skipComment() {
        while (offset < source.length() && source.charAt(offset) != '\n') {
            offset++;
        }
    }

    private void lineContinuation() throws ParseFailure {
        var next = charAt(offset + 1);
        if (next == '\n') {
            offset++;
            newLine();
        } else if (next == '\r' && charAt(offset + 2) == '\n') {
            offset += 2;
            newLine();
        } else {
            throw failure(position(), "unexpected character after line continuation character");
        }
    }

    private void nameOrPrefixedString() throws ParseFailure {
        var start = offset;
        while (offset < source.length() && isIdentifierPart(source.charAt(offset))) {
            offset++;
        }
        var word = source.substring(start, offset);
        var next = charAt(offset);
        if ((next == '"' || next == '\'') && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
            string(start, word);
            return;
        }
        add(TokenKind.NAME, word, positionOf(start));
    }

    private void number() {
        var start = offset;
        if (charAt(offset) == '0' && "xXoObB".indexOf(charAt(offset + 1)) >= 0) {
            offset += 2;
            while (Character.digit(charAt(offset), 16) >= 0 || charAt(offset) == '_') {
                offset++;
            }
        } else {
            skipDigits();
            if (charAt(offset) == '.') {
                offset++;
                skipDigits();
            }
            if (charAt(offset) == 'e' || charAt(offset) == 'E') {
                var mark = offset;
                offset++;
                if (charAt(offset) == '+' || charAt(offset) == '-') {
                    offset++;
                }
                if (isDigit(charAt(offset))) {
                    skipDigits();
                } else {
                    offset = mark;
                }
            }
            if (charAt(offset) == 'j' || charAt(offset) == 'J') {
                offset++;
            }
        }
        add(TokenKind.NUMBER, source.substring(start, offset), positionOf(start));
    }

    private void skipDigits() {
        while (isDigit(charAt(offset)) || charAt(offset) == '_') {
            offset++;
        }
    }

    private void string(int start, String prefix) throws ParseFailure {
        var startPosition = positionOf(start);
        var lowerPrefix = prefix.toLowerCase(Locale.ROOT);
        var formatted = lowerPrefix.contains("f") || lowerPrefix.contains("t");
        var quote = source.charAt(offset);
        var triple = charAt(offset + 1) == quote && charAt(offset + 2) == quote;
        offset += triple
                  ? 3
                  : 1;
        stringBody(quote, triple, formatted, startPosition);
        add(TokenKind.STRING, source.substring(start, offset), startPosition);
    }

    private void stringBody(char quote, boolean triple, boolean formatted, Position start) throws ParseFailure {
        while (true) {
            if (offset >= source.length()) {
                throw failure(start, "unterminated string literal");
            }
            var c = source.charAt(offset);
            if (c == '\\') {
                offset++;
                if (offset < source.length()) {
                    advance();
                }
            } else if (c == '\n') {
                if (!triple) {
                    throw failure(start, "unterminated string literal");
                }
                newLine();
            } else if (c == quote) {
                if (!triple) {
                    offset++;
                    return;
                }
                if (charAt(offset + 1) == quote && charAt(offset + 2) == quote) {
                    offset += 3;
                    return;
                }
                offset++;
            } else if (formatted && c == '{') {
                if (charAt(offset + 1) == '{') {
                    offset += 2;
                } else {
                    offset++;
                    replacementField(start);
                }
            } else {
                offset++;
            }
        }
    }

    // Inside `{...}` of an f-string: brackets nest, nested strings may reuse the outer quote.
    private void replacementField(Position start) throws ParseFailure {
        var fieldStart = offset;
        var depth = 0;
        while (true) {
            if (offset >= source.length()) {
                throw failure(start, "unterminated string literal");
            }
            var c = source.charAt(offset);
            if (c == '\n') {
                newLine();
            } else if (c == '"' || c == '\'') {
                var prefixStart = offset;
                while (prefixStart > fieldStart && Character.isLetter(source.charAt(prefixStart - 1))) {
                    prefixStart--;
                }
                var nestedPrefix = source.substring(prefixStart, offset)
                                         .toLowerCase(Locale.ROOT);
                var triple = charAt(offset + 1) == c && charAt(offset + 2) == c;
                offset += triple
                          ? 3
                          : 1;
                stringBody(c, triple, nestedPrefix.contains("f"), start);
            } else if (c == '(' || c == '[' || c == '{') {
                depth++;
                offset++;
            } else if (c == ')' || c == ']') {
                depth--;
                offset++;
            } else if (c == '}') {
                offset++;
                if (depth == 0) {
                    return;
                }
                depth--;
            } else {
                offset++;
            }
        }
    }

    private void operator() throws ParseFailure {
        var start = position();
        for (var op : OPERATORS) {
            if (source.startsWith(op, offset)) {
                offset += op.length();
                var token = add(TokenKind.OP, op, start);
                trackBrackets(token);
                return;
            }
        }
        throw failure(start, "invalid character '" + source.charAt(offset) + "'");
    }

    private void trackBrackets(Token token) throws ParseFailure {
        switch (token.text()) {
            case "(", "[", "{" -> {
                if (openBrackets.size() == MAX_NESTING) {
                    throw failure(token.start(), "too many nested parentheses");
                }
                openBrackets.push(token);
            }
            case ")", "]", "}" -> {
                if (openBrackets.isEmpty()) {
                    throw failure(token.start(), "unmatched '" + token.text() + "'");
                }
                var open = openBrackets.pop();
                if (!closes(open.text(), token.text())) {
                    throw failure(token.start(),
                                  "closing parenthesis '" + token.text() + "' does not match opening parenthesis '"
                                  + open.text() + "'");
                }
            }
            default -> {}
        }
    }

    private static boolean closes(String open, String close) {
        return switch (open) {
            case "(" -> close.equals(")");
            case "[" -> close.equals("]");
            default -> close.equals("}");
        };
    }

    private Token add(TokenKind kind, String text, Position start) {
        var indent = -1;
        if (!logicalLineStarted && !expressionMode) {
            indent = indentWidth(start);
        }
        logicalLineStarted = true;
        var token = Token.token(kind, text, Span.span(start, position()), indent);
        tokens.add(token);
        return token;
    }

    private int indentWidth(Position start) {
        var lineText = source.substring(offsetOfLineStart(start), offsetOfLineStart(start) + start.column());
        var width = 0;
        for (var c : lineText.toCharArray()) {
            if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                width++;
            }
        }
        return width;
    }

    private int offsetOfLineStart(Position start) {
        // Tokens starting a logical line never span lines before they begin, so `start` is on the
        // current line unless the token itself crossed line breaks (a multi-line string).
        if (start.line() == line) {
            return lineOffset;
        }
        var lineStart = 0;
        for (int current = 1; current < start.line(); current++) {
            lineStart = source.indexOf('\n', lineStart) + 1;
        }
        return lineStart;
    }

    private void newLine() {
        offset++;
        line++;
        lineOffset = offset;
    }

    private void advance() {
        if (source.charAt(offset) == '\n') {
            newLine();
        } else {
            offset++;
        }
    }

    private Position position() {
        return new Position(line, offset - lineOffset);
    }

    // Only valid for offsets on the current line.
    private Position positionOf(int start) {
        return new Position(line, start - lineOffset);
    }

    private char charAt(int index) {
        return index < source.length()
               ? source.charAt(index)
               : 0;
    }

    private ParseFailure failure(Position at, String message) {
        return RewriteException.parseFailure(fileName, at.line(), at.column(), message);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isLetter(c) || (c > 127 && Character.isUnicodeIdentifierStart(c));
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || Character.isLetterOrDigit(c) || (c > 127 && Character.isUnicodeIdentifierPart(c));
    }
}
