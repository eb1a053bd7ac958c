package com.esfront.ast;

import com.esfront.Span;

public record MethodProp(Span span, PropName key, Function func) implements Prop {
    @Override
    public String type() {
        return "MethodProperty";
    }
}
