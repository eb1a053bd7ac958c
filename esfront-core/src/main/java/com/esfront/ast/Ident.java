package com.esfront.ast;

import com.esfront.Span;

public record Ident(Span span, String sym) implements Expr, Pat, PropName {
    @Override
    public String type() {
        return "Identifier";
    }
}
