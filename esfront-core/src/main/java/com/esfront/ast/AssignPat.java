package com.esfront.ast;

import com.esfront.Span;

/** Binding element with a default value. */
public record AssignPat(Span span, Pat left, Expr right) implements Pat {
    @Override
    public String type() {
        return "AssignmentPattern";
    }
}
