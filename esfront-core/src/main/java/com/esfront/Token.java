package com.esfront;

/**
 * Lexical token. Lexical errors are tokens too, so a token stream is total.
 */
public sealed interface Token permits Token.Punct, Token.Word, Token.Num, Token.Str, Token.Regex,
        Token.Template, Token.Error {

    TokenType type();

    static Token punct(TokenType type) {
        return new Punct(type);
    }

    static Token ident(String sym) {
        return new Word(TokenType.IDENTIFIER, sym);
    }

    static Token keyword(TokenType type) {
        return new Word(type, type.text());
    }

    /** Punctuator or operator. */
    record Punct(TokenType type) implements Token {
        @Override
        public String toString() {
            return type.text();
        }
    }

    /** Identifier ({@link TokenType#IDENTIFIER}) or keyword. */
    record Word(TokenType type, String sym) implements Token {
        @Override
        public String toString() {
            return sym;
        }
    }

    record Num(double value) implements Token {
        @Override
        public TokenType type() {
            return TokenType.NUMBER;
        }
    }

    record Str(String value, boolean hasEscape) implements Token {
        @Override
        public TokenType type() {
            return TokenType.STRING;
        }
    }

    /**
     * Regular expression literal; {@code flags} is null when no flag run follows the closing slash.
     */
    record Regex(String pattern, String flags) implements Token {
        @Override
        public TokenType type() {
            return TokenType.REGEX;
        }
    }

    /** A literal template chunk between backticks and substitutions. */
    record Template(String cooked, String raw) implements Token {
        @Override
        public TokenType type() {
            return TokenType.TEMPLATE;
        }
    }

    record Error(LexError error) implements Token {
        @Override
        public TokenType type() {
            return TokenType.ERROR;
        }
    }
}
