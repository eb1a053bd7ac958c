package com.esfront;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.esfront.LexerTest.assertLexError;
import static org.junit.jupiter.api.Assertions.*;

public class TestStringsAndEscapes {

    private static TokenAndSpan first(String source, boolean strict) {
        return new Lexer(source, strict, false).tokenize().get(0);
    }

    private static Token.Str str(String source) {
        Token token = first(source, false).token();
        assertInstanceOf(Token.Str.class, token, source);
        return (Token.Str) token;
    }

    @Test
    void testPlainStrings() {
        assertEquals(new Token.Str("abc", false), str("'abc'"));
        assertEquals(new Token.Str("it's", false), str("\"it's\""));
        assertEquals(new Token.Str("", false), str("''"));
    }

    @Test
    void testHexAndUnicodeEscapes() {
        assertEquals(new Token.Str("ABC", true), str("'\\x41\\u0042\\u{43}'"));
        assertEquals("😀", str("'\\u{1F600}'").value());
    }

    @Test
    void testSingleCharacterEscapes() {
        assertEquals("\n\r\t\b\f\u000B'\"\\q", str("'\\n\\r\\t\\b\\f\\v\\'\\\"\\\\\\q'").value());
    }

    @Test
    void testNullEscapeIsAllowedInStrictMode() {
        Token token = first("'\\0'", true).token();
        assertEquals(new Token.Str("\0", true), token);
    }

    @Test
    void testOctalEscapes() {
        assertEquals("A", str("'\\101'").value());
        assertEquals("ÿ0", str("'\\3770'").value());
        assertEquals("\u00008", str("'\\08'").value());
        assertEquals("8", str("'\\8'").value());

        assertLexError(first("'\\101'", true), SyntaxError.LEGACY_OCTAL_ESCAPE, 0, 6);
        assertLexError(first("'\\08'", true), SyntaxError.LEGACY_OCTAL_ESCAPE, 0, 5);
        assertLexError(first("'\\9'", true), SyntaxError.LEGACY_OCTAL_ESCAPE, 0, 4);
    }

    @Test
    void testInvalidEscapes() {
        assertLexError(first("'\\u{110000}'", false), SyntaxError.INVALID_CODE_POINT, 0, 12);
        assertLexError(first("'\\xZZ'", false), SyntaxError.BAD_ESCAPE, 0, 6);
        assertLexError(first("'\\u12'", false), SyntaxError.BAD_ESCAPE, 0, 6);
        assertLexError(first("'\\u{}'", false), SyntaxError.BAD_ESCAPE, 0, 6);
    }

    @Test
    void testUnterminatedString() {
        assertLexError(first("'abc", false), SyntaxError.UNTERMINATED_STR, 0, 4);

        List<TokenAndSpan> tokens = new Lexer("'abc\ndef").tokenize();
        assertEquals(2, tokens.size());
        assertLexError(tokens.get(0), SyntaxError.UNTERMINATED_STR, 0, 4);
        assertEquals(Token.ident("def"), tokens.get(1).token());
        assertTrue(tokens.get(1).hadLineBreak());
    }

    @Test
    void testParagraphSeparatorsInsideStrings() {
        assertEquals("a\u2028b\u2029c", str("'a\u2028b\u2029c'").value());
    }

    @Test
    void testLineContinuations() {
        assertEquals("ab", str("'a\\\nb'").value());
        assertEquals("ab", str("'a\\\r\nb'").value());
        assertEquals("ab", str("'a\\\rb'").value());
    }

    @Test
    void testStringSpanIncludesQuotes() {
        TokenAndSpan token = new Lexer("x = 'é'").tokenize().get(2);
        assertEquals(new Span(4, 8), token.span());
    }
}
