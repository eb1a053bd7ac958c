package com.esfront.ast;

import com.esfront.Span;

public record ThrowStmt(Span span, Expr arg) implements Stmt {
    @Override
    public String type() {
        return "ThrowStatement";
    }
}
