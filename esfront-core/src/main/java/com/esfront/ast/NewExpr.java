package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

/** {@code new C} without an argument list has empty {@code args}. */
public record NewExpr(Span span, Expr callee, List<Expr> args) implements Expr {
    @Override
    public String type() {
        return "NewExpression";
    }
}
