package com.esfront;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.esfront.LexerTest.assertLexError;
import static org.junit.jupiter.api.Assertions.*;

public class TestTemplates {

    private static List<TokenAndSpan> lex(String source) {
        return new Lexer(source).tokenize();
    }

    @Test
    void testTemplateWithSubstitution() {
        List<TokenAndSpan> tokens = lex("`a${b}c`");
        assertEquals(7, tokens.size());
        LexerTest.assertToken(tokens.get(0), Token.punct(TokenType.BACKTICK), 0, 1);
        LexerTest.assertToken(tokens.get(1), new Token.Template("a", "a"), 1, 2);
        LexerTest.assertToken(tokens.get(2), Token.punct(TokenType.DOLLAR_LBRACE), 2, 4);
        LexerTest.assertToken(tokens.get(3), Token.ident("b"), 4, 5);
        LexerTest.assertToken(tokens.get(4), Token.punct(TokenType.RBRACE), 5, 6);
        LexerTest.assertToken(tokens.get(5), new Token.Template("c", "c"), 6, 7);
        LexerTest.assertToken(tokens.get(6), Token.punct(TokenType.BACKTICK), 7, 8);
    }

    @Test
    void testEmptyTemplateHasEmptyChunk() {
        List<TokenAndSpan> tokens = lex("``");
        assertEquals(3, tokens.size());
        LexerTest.assertToken(tokens.get(1), new Token.Template("", ""), 1, 1);
    }

    @Test
    void testCookedAndRawValues() {
        List<TokenAndSpan> tokens = lex("`\\n\\x41`");
        assertEquals(new Token.Template("\nA", "\\n\\x41"), tokens.get(1).token());
    }

    @Test
    void testLineEndingsAreNormalized() {
        List<TokenAndSpan> tokens = lex("`a\r\nb\rc`");
        assertEquals(new Token.Template("a\nb\nc", "a\nb\nc"), tokens.get(1).token());
        assertEquals(new Span(1, 7), tokens.get(1).span());
    }

    @Test
    void testOctalEscapeInTemplate() {
        List<TokenAndSpan> tokens = lex("`\\01`");
        assertEquals(3, tokens.size());
        assertLexError(tokens.get(1), SyntaxError.BAD_ESCAPE, 1, 4);
        assertEquals(TokenType.BACKTICK, tokens.get(2).type());
    }

    @Test
    void testUnterminatedTemplate() {
        List<TokenAndSpan> tokens = lex("`abc");
        assertEquals(2, tokens.size());
        assertLexError(tokens.get(1), SyntaxError.UNTERMINATED_TPL, 1, 4);

        tokens = lex("`");
        assertEquals(2, tokens.size());
        assertLexError(tokens.get(1), SyntaxError.UNTERMINATED_TPL, 1, 1);
    }

    @Test
    void testKeywordKeyInsideSubstitution() {
        List<TokenAndSpan> tokens = lex("`${h('div', {class: 'x'})}`");
        assertEquals(16, tokens.size());
        assertEquals(TokenType.CLASS, tokens.get(8).type());
        LexerTest.assertToken(tokens.get(13), Token.punct(TokenType.RBRACE), 25, 26);
        LexerTest.assertToken(tokens.get(14), new Token.Template("", ""), 26, 26);
        LexerTest.assertToken(tokens.get(15), Token.punct(TokenType.BACKTICK), 26, 27);
    }

    @Test
    void testRegexInsideSubstitution() {
        List<TokenAndSpan> tokens = lex("`${/a/g}`");
        assertEquals(new Token.Regex("a", "g"), tokens.get(3).token());
        assertEquals(TokenType.RBRACE, tokens.get(4).type());
        assertEquals(new Token.Template("", ""), tokens.get(5).token());
    }

    @Test
    void testDivisionAfterTemplate() {
        List<TokenType> types = lex("`a` / 2").stream().map(TokenAndSpan::type).toList();
        assertEquals(List.of(TokenType.BACKTICK, TokenType.TEMPLATE, TokenType.BACKTICK,
                TokenType.SLASH, TokenType.NUMBER), types);
    }

    @Test
    void testObjectLiteralInsideSubstitution() {
        List<TokenType> types = lex("`${ {a: 1}.a }x`").stream().map(TokenAndSpan::type).toList();
        assertEquals(List.of(TokenType.BACKTICK, TokenType.TEMPLATE, TokenType.DOLLAR_LBRACE, TokenType.LBRACE,
                TokenType.IDENTIFIER, TokenType.COLON, TokenType.NUMBER, TokenType.RBRACE, TokenType.DOT,
                TokenType.IDENTIFIER, TokenType.RBRACE, TokenType.TEMPLATE, TokenType.BACKTICK), types);
    }
}
