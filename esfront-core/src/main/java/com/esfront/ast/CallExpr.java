package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

public record CallExpr(Span span, Expr callee, List<Expr> args) implements Expr {
    @Override
    public String type() {
        return "CallExpression";
    }
}
