package com.esfront.ast;

import com.esfront.Span;

public record ReturnStmt(Span span, Expr arg) implements Stmt {
    @Override
    public String type() {
        return "ReturnStatement";
    }
}
