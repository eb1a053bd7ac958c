package com.esfront.ast;

import com.esfront.Span;

public record UnaryExpr(Span span, String op, Expr arg) implements Expr {
    @Override
    public String type() {
        return "UnaryExpression";
    }
}
