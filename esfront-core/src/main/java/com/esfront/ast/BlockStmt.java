package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

public record BlockStmt(Span span, List<Stmt> stmts) implements Stmt {
    @Override
    public String type() {
        return "BlockStatement";
    }
}
