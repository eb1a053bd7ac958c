package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

/** {@code kind} is {@code var}, {@code let} or {@code const}. */
public record VarDecl(Span span, String kind, List<VarDeclarator> decls) implements Stmt {
    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
