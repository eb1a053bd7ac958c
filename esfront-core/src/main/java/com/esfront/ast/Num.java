package com.esfront.ast;

import com.esfront.Span;

public record Num(Span span, double value) implements Expr, PropName {
    @Override
    public String type() {
        return "NumericLiteral";
    }
}
