package com.esfront.ast;

import com.esfront.Span;

public record EmptyStmt(Span span) implements Stmt {
    @Override
    public String type() {
        return "EmptyStatement";
    }
}
