package com.esfront.ast;

import com.esfront.Span;

public record RestPat(Span span, Pat arg) implements Pat, ObjectPatProp {
    @Override
    public String type() {
        return "RestElement";
    }
}
