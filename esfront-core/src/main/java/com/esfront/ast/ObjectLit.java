package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

public record ObjectLit(Span span, List<Prop> props) implements Expr {
    @Override
    public String type() {
        return "ObjectExpression";
    }
}
