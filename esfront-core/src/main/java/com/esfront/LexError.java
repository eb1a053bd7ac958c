package com.esfront;

/**
 * A lexical error carried inside the token stream.
 */
public record LexError(Span span, SyntaxError kind) {
    @Override
    public String toString() {
        return kind + "@" + span;
    }
}
