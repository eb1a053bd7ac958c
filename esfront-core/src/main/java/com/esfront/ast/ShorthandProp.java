package com.esfront.ast;

import com.esfront.Span;

/** {@code { a }} */
public record ShorthandProp(Span span, Ident key) implements Prop {
    @Override
    public String type() {
        return "ShorthandProperty";
    }
}
