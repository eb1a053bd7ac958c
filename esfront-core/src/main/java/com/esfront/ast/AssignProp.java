package com.esfront.ast;

import com.esfront.Span;

/**
 * {@code { a = 1 }}: only valid when the enclosing object literal is later
 * reinterpreted as a pattern.
 */
public record AssignProp(Span span, Ident key, Expr value) implements Prop {
    @Override
    public String type() {
        return "AssignmentProperty";
    }
}
