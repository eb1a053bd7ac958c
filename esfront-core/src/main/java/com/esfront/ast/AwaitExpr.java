package com.esfront.ast;

import com.esfront.Span;

public record AwaitExpr(Span span, Expr arg) implements Expr {
    @Override
    public String type() {
        return "AwaitExpression";
    }
}
