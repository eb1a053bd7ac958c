package com.esfront.ast;

import com.esfront.Span;

import java.util.List;

public record Program(Span span, List<Stmt> body, String sourceType) implements Node {
    @Override
    public String type() {
        return "Program";
    }
}
