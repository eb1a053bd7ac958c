package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

/** Parameters and body shared by function expressions, declarations and methods. */
public record Function(Span span, List<Pat> params, BlockStmt body, boolean generator, boolean async) implements Node {
    @Override
    public String type() {
        return "Function";
    }
}
