package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

public record Tpl(Span span, List<Expr> exprs, List<TplElement> quasis) implements Expr {
    @Override
    public String type() {
        return "TemplateLiteral";
    }
}
