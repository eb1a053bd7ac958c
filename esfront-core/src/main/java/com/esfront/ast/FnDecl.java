package com.esfront.ast;

import com.esfront.Span;

public record FnDecl(Span span, Ident ident, Function func) implements Stmt {
    @Override
    public String type() {
        return "FunctionDeclaration";
    }
}
