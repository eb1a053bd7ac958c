package com.esfront.ast;

import com.esfront.Span;

/** {@code flags} is null when the literal has none. */
public record Regex(Span span, String pattern, String flags) implements Expr {
    @Override
    public String type() {
        return "RegExpLiteral";
    }
}
