package com.esfront.ast;

import com.esfront.Span;

public record SetterProp(Span span, PropName key, Pat param, BlockStmt body) implements Prop {
    @Override
    public String type() {
        return "SetterProperty";
    }
}
