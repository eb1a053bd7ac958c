package com.esfront.ast;

import com.esfront.Span;

public record UpdateExpr(Span span, String op, boolean prefix, Expr arg) implements Expr {
    @Override
    public String type() {
        return "UpdateExpression";
    }
}
