package com.esfront.ast;

import com.esfront.Span;

/** {@code ...arg} in object literals, array literals and argument lists. */
public record SpreadElement(Span span, Expr arg) implements Prop, Expr {
    @Override
    public String type() {
        return "SpreadElement";
    }
}
