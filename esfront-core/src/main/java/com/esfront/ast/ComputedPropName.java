package com.esfront.ast;

import com.esfront.Span;

/** {@code [expr]} used as a property key. */
public record ComputedPropName(Span span, Expr expr) implements PropName {
    @Override
    public String type() {
        return "ComputedPropertyName";
    }
}
