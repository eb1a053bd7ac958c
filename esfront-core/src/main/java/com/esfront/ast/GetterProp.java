package com.esfront.ast;

import com.esfront.Span;

public record GetterProp(Span span, PropName key, BlockStmt body) implements Prop {
    @Override
    public String type() {
        return "GetterProperty";
    }
}
