package com.esfront;

/**
 * One-token lookahead over a {@link Lexer}.
 *
 * <p>Tokens are pulled lazily, so a change made through {@link #lexer()} (strict
 * mode, generator context) applies to every token not yet looked at. An error
 * token surfaces as a {@link ParseException} the moment the parser inspects it.
 */
public class TokenBuffer {
    private final Lexer lexer;
    private final LineIndex lineIndex;

    private TokenAndSpan cur;
    private boolean loaded = false;
    private int lastPos = 0;

    public TokenBuffer(Lexer lexer, LineIndex lineIndex) {
        this.lexer = lexer;
        this.lineIndex = lineIndex;
    }

    public Lexer lexer() {
        return lexer;
    }

    private TokenAndSpan load() {
        if (!loaded) {
            cur = lexer.hasNext() ? lexer.next() : null;
            loaded = true;
        }
        return cur;
    }

    /** The current token with its span, or null at end of input. */
    public TokenAndSpan curTokenAndSpan() {
        TokenAndSpan t = load();
        if (t != null && t.token() instanceof Token.Error error) {
            LexError lexError = error.error();
            throw error(lexError.kind(), lexError.span(), null);
        }
        return t;
    }

    /** The current token, or null at end of input. */
    public Token cur() {
        TokenAndSpan t = curTokenAndSpan();
        return t == null ? null : t.token();
    }

    public boolean isEof() {
        return load() == null;
    }

    public boolean is(TokenType type) {
        Token t = cur();
        return t != null && t.type() == type;
    }

    public boolean isOneOf(TokenType... types) {
        Token t = cur();
        if (t == null) return false;
        for (TokenType type : types) {
            if (t.type() == type) return true;
        }
        return false;
    }

    /** Whether the current token is the identifier {@code sym} written without escapes. */
    public boolean isContextual(String sym) {
        TokenAndSpan t = curTokenAndSpan();
        return t != null
                && t.token() instanceof Token.Word word
                && word.type() == TokenType.IDENTIFIER
                && word.sym().equals(sym)
                && t.span().len() == sym.length();
    }

    public TokenAndSpan bump() {
        TokenAndSpan t = curTokenAndSpan();
        if (t == null) {
            throw error(SyntaxError.UNEXPECTED_EOF, eofSpan(), null);
        }
        lastPos = t.span().hi();
        loaded = false;
        cur = null;
        return t;
    }

    public boolean eat(TokenType type) {
        if (is(type)) {
            bump();
            return true;
        }
        return false;
    }

    public TokenAndSpan expect(TokenType type) {
        if (is(type)) {
            return bump();
        }
        TokenAndSpan found = curTokenAndSpan();
        Span span = found == null ? eofSpan() : found.span();
        throw new ExpectedTokenException(type, found, span, position(span));
    }

    /** Start offset of the current token, or the input length at end of input. */
    public int curPos() {
        TokenAndSpan t = load();
        return t == null ? lexer.input().length() : t.span().lo();
    }

    /** End offset of the last consumed token. */
    public int lastPos() {
        return lastPos;
    }

    /** Span from {@code start} to the end of the last consumed token. */
    public Span span(int start) {
        return new Span(start, Math.max(start, lastPos));
    }

    public Span curSpan() {
        TokenAndSpan t = curTokenAndSpan();
        return t == null ? eofSpan() : t.span();
    }

    public boolean hadLineBreakBeforeCur() {
        TokenAndSpan t = curTokenAndSpan();
        return t != null && t.hadLineBreak();
    }

    private Span eofSpan() {
        int end = lexer.input().length();
        return new Span(end, end);
    }

    // ========================================================================
    // Errors
    // ========================================================================

    /** UNEXPECTED_TOKEN at the current token, or UNEXPECTED_EOF at end of input. */
    public ParseException unexpected() {
        TokenAndSpan t = curTokenAndSpan();
        if (t == null) {
            return error(SyntaxError.UNEXPECTED_EOF, eofSpan(), null);
        }
        return error(SyntaxError.UNEXPECTED_TOKEN, t.span(), "Unexpected token '" + t.token() + "'");
    }

    public ParseException error(SyntaxError kind, Span span, String message) {
        return new ParseException(kind, span, position(span), null, message);
    }

    private SourceLocation.Position position(Span span) {
        if (lineIndex == null || span == null) {
            return null;
        }
        return lineIndex.position(span.lo());
    }
}
