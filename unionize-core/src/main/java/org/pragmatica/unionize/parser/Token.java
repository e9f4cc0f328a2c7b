package org.pragmatica.unionize.parser;

/// Lexical token. `indent` is the indentation width of the logical line for the first token of
/// that line, `-1` for every other token.
public record Token(TokenKind kind, String text, Span span, int indent) {
    public static Token token(TokenKind kind, String text, Span span, int indent) {
        return new Token(kind, text, span, indent);
    }

    public boolean isOp(String op) {
        return kind == TokenKind.OP && text.equals(op);
    }

    public boolean isName(String name) {
        return kind == TokenKind.NAME && text.equals(name);
    }

    public boolean isLineStart() {
        return indent >= 0;
    }

    public Position start() {
        return span.start();
    }

    public Position end() {
        return span.end();
    }

    @Override
    public String toString() {
        return kind == TokenKind.NEWLINE
               ? "newline"
               : kind == TokenKind.EOF
                 ? "end of input"
                 : "'" + text + "'";
    }
}
