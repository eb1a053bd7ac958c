package com.esfront.ast;

import com.esfront.Span;

public record IfStmt(Span span, Expr test, Stmt cons, Stmt alt) implements Stmt {
    @Override
    public String type() {
        return "IfStatement";
    }
}
