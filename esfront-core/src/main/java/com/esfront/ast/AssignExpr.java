package com.esfront.ast;

import com.esfront.Span;

public record AssignExpr(Span span, String op, Pat left, Expr right) implements Expr {
    @Override
    public String type() {
        return "AssignmentExpression";
    }
}
