package com.esfront.ast;

import com.esfront.Span;

public record Str(Span span, String value, boolean hasEscape) implements Expr, PropName {
    @Override
    public String type() {
        return "StringLiteral";
    }
}
