package com.esfront.ast;

import com.esfront.Span;

/** {@code { a }} or {@code { a = 1 }} in a pattern; {@code value} is null without a default. */
public record AssignPatProp(Span span, Ident key, Expr value) implements ObjectPatProp {
    @Override
    public String type() {
        return "AssignmentPatternProperty";
    }
}
