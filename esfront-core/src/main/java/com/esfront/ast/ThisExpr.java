package com.esfront.ast;

import com.esfront.Span;

public record ThisExpr(Span span) implements Expr {
    @Override
    public String type() {
        return "ThisExpression";
    }
}
