package com.esfront.ast;

import com.esfront.Span;

public record BinExpr(Span span, String op, Expr left, Expr right) implements Expr {
    @Override
    public String type() {
        return "BinaryExpression";
    }
}
