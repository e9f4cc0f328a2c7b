package org.pragmatica.unionize.parser;

/// Tags for compound expressions that carry no rewrite-specific structure.
public enum ExprKind {
    CALL,
    KEYWORD,
    STARRED,
    DOUBLE_STARRED,
    BINARY,
    UNARY,
    AWAIT,
    BOOL_OP,
    NOT,
    COMPARE,
    TERNARY,
    LAMBDA,
    NAMED,
    YIELD,
    PAREN,
    LIST,
    SET,
    DICT,
    LIST_COMP,
    SET_COMP,
    DICT_COMP,
    GENERATOR,
    FOR_CLAUSE,
    SLICE,
    PATTERN;

    /// Whether an expression of this kind must be parenthesized to be an operand of `|`.
    public boolean bindsLooserThanBitOr() {
        return switch (this) {
            case BOOL_OP, NOT, COMPARE, TERNARY, LAMBDA, NAMED, YIELD, PATTERN -> true;
            default -> false;
        };
    }
}
