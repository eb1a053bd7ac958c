package com.esfront.ast;

import com.esfront.Span;

public record Null(Span span) implements Expr {
    @Override
    public String type() {
        return "NullLiteral";
    }
}
