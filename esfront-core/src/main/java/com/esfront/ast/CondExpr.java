package com.esfront.ast;

import com.esfront.Span;

public record CondExpr(Span span, Expr test, Expr cons, Expr alt) implements Expr {
    @Override
    public String type() {
        return "ConditionalExpression";
    }
}
