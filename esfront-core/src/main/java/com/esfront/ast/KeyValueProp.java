package com.esfront.ast;

import com.esfront.Span;

public record KeyValueProp(Span span, PropName key, Expr value) implements Prop {
    @Override
    public String type() {
        return "KeyValueProperty";
    }
}
