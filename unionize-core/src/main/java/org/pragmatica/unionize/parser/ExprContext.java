package org.pragmatica.unionize.parser;

/// How an expression is used: read, assigned to, or deleted.
public enum ExprContext {
    LOAD,
    STORE,
    DEL
}
