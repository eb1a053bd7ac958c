package com.esfront.ast;

import com.esfront.Span;

public record MemberExpr(Span span, Expr obj, Expr prop, boolean computed) implements Expr, Pat {
    @Override
    public String type() {
        return "MemberExpression";
    }
}
