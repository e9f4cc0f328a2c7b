package org.pragmatica.unionize.parser;

/// Statement tags. Imports have their own node types.
public enum StatementKind {
    EXPRESSION,
    ASSIGN,
    AUG_ASSIGN,
    ANN_ASSIGN,
    RETURN,
    RAISE,
    DEL,
    ASSERT,
    GLOBAL,
    NONLOCAL,
    PASS,
    BREAK,
    CONTINUE,
    TYPE_ALIAS,
    DECORATOR,
    DEF,
    CLASS,
    IF,
    ELIF,
    ELSE,
    FOR,
    WHILE,
    TRY,
    EXCEPT,
    FINALLY,
    WITH,
    MATCH,
    CASE
}
