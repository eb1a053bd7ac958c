package com.esfront.ast;

import com.esfront.Span;

public record Bool(Span span, boolean value) implements Expr {
    @Override
    public String type() {
        return "BooleanLiteral";
    }
}
