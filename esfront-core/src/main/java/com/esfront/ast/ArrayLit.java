package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

/** Holes are null entries in {@code elems}. */
public record ArrayLit(Span span, List<Expr> elems) implements Expr {
    @Override
    public String type() {
        return "ArrayExpression";
    }
}
