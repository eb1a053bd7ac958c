package com.esfront;

/**
 * Thrown when a required token is missing.
 */
public class ExpectedTokenException extends ParseException {
    private final TokenType expected;

    /**
     * @param found the token in place of the expected one, or null at end of input
     * @param span  span of {@code found}, or the empty span at end of input
     */
    public ExpectedTokenException(TokenType expected, TokenAndSpan found, Span span, SourceLocation.Position position) {
        super(found == null ? SyntaxError.UNEXPECTED_EOF : SyntaxError.UNEXPECTED_TOKEN,
                span, position, null, describe(expected, found));
        this.expected = expected;
    }

    private static String describe(TokenType expected, TokenAndSpan found) {
        String got = found == null ? "end of input" : "'" + found.token() + "'";
        return "Expected '" + expected.text() + "' but found " + got;
    }

    public TokenType expected() {
        return expected;
    }
}
