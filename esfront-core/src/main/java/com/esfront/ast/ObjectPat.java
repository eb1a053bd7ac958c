package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

public record ObjectPat(Span span, List<ObjectPatProp> props) implements Pat {
    @Override
    public String type() {
        return "ObjectPattern";
    }
}
