package com.esfront;

/**
 * A token together with its span and whether a line terminator separates it
 * from the previous token.
 */
public record TokenAndSpan(Token token, Span span, boolean hadLineBreak) {

    public TokenType type() {
        return token.type();
    }

    @Override
    public String toString() {
        return token + "@" + span + (hadLineBreak ? " (lb)" : "");
    }
}
