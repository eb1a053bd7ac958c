package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

/** Holes are null entries in {@code elems}. */
public record ArrayPat(Span span, List<Pat> elems) implements Pat {
    @Override
    public String type() {
        return "ArrayPattern";
    }
}
