package com.esfront.ast;

import com.esfront.Span;

public record ExprStmt(Span span, Expr expr) implements Stmt {
    @Override
    public String type() {
        return "ExpressionStatement";
    }
}
