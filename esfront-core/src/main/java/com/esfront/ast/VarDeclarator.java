package com.esfront.ast;

import com.esfront.Span;

public record VarDeclarator(Span span, Pat name, Expr init) implements Node {
    @Override
    public String type() {
        return "VariableDeclarator";
    }
}
