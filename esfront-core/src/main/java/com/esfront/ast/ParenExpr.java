package com.esfront.ast;

import com.esfront.Span;

public record ParenExpr(Span span, Expr expr) implements Expr {
    @Override
    public String type() {
        return "ParenthesizedExpression";
    }
}
