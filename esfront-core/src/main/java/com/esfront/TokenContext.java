package com.esfront;

/**
 * Syntactic context the lexer tracks to decide whether a {@code /} starts a
 * regular expression. The lexer keeps a stack of these, pushed and popped by
 * brackets, braces, template delimiters and {@code function}.
 */
enum TokenContext {
    BRACE_STMT(false),
    BRACE_EXPR(true),
    BRACE_TEMPLATE(false),
    PAREN_STMT(false),
    PAREN_EXPR(true),
    TEMPLATE_QUASI(true),
    FN_STMT(false),
    FN_EXPR(true);

    private final boolean isExpr;

    TokenContext(boolean isExpr) {
        this.isExpr = isExpr;
    }

    /** Whether the construct this context opened is itself a value. */
    boolean isExpr() {
        return isExpr;
    }

    boolean isFunction() {
        return this == FN_STMT || this == FN_EXPR;
    }
}
