package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

public record SeqExpr(Span span, List<Expr> exprs) implements Expr {
    @Override
    public String type() {
        return "SequenceExpression";
    }
}
