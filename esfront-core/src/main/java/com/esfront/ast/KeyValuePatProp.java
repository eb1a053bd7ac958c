package com.esfront.ast;

import com.esfront.Span;

public record KeyValuePatProp(Span span, PropName key, Pat value) implements ObjectPatProp {
    @Override
    public String type() {
        return "KeyValuePatternProperty";
    }
}
