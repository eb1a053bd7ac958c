package com.esfront.ast;

import com.esfront.Span;

/** Function expression; {@code ident} is null when anonymous. */
public record FnExpr(Span span, Ident ident, Function func) implements Expr {
    @Override
    public String type() {
        return "FunctionExpression";
    }
}
