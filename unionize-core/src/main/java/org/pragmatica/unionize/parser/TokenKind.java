package org.pragmatica.unionize.parser;

public enum TokenKind {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    EOF
}
