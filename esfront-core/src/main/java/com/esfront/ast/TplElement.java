package com.esfront.ast;

import com.esfront.Span;

public record TplElement(Span span, String cooked, String raw, boolean tail) implements Node {
    @Override
    public String type() {
        return "TemplateElement";
    }
}
