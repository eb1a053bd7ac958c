package com.esfront.ast;

import com.esfront.Span;

/** {@code yield}, {@code yield arg} or {@code yield* arg}; {@code arg} is null for a bare yield. */
public record YieldExpr(Span span, Expr arg, boolean delegate) implements Expr {
    @Override
    public String type() {
        return "YieldExpression";
    }
}
