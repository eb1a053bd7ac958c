package com.esfront;

import java.util.HashMap;
import java.util.Map;

public enum TokenType {
    // Punctuators
    LPAREN(Kind.PUNCT, "(", true),
    RPAREN(Kind.PUNCT, ")", false),
    LBRACE(Kind.PUNCT, "{", true),
    RBRACE(Kind.PUNCT, "}", false),
    LBRACKET(Kind.PUNCT, "[", true),
    RBRACKET(Kind.PUNCT, "]", false),
    SEMICOLON(Kind.PUNCT, ";", true),
    COMMA(Kind.PUNCT, ",", true),
    DOT(Kind.PUNCT, ".", false),
    DOT_DOT_DOT(Kind.PUNCT, "...", true),
    COLON(Kind.PUNCT, ":", true),
    QUESTION(Kind.PUNCT, "?", true),
    QUESTION_DOT(Kind.PUNCT, "?.", false),
    ARROW(Kind.PUNCT, "=>", true),
    BACKTICK(Kind.PUNCT, "`", false),
    DOLLAR_LBRACE(Kind.PUNCT, "${", true),

    // Assignment operators
    ASSIGN(Kind.PUNCT, "=", true),
    PLUS_ASSIGN(Kind.PUNCT, "+=", true),
    MINUS_ASSIGN(Kind.PUNCT, "-=", true),
    STAR_ASSIGN(Kind.PUNCT, "*=", true),
    SLASH_ASSIGN(Kind.PUNCT, "/=", true),
    PERCENT_ASSIGN(Kind.PUNCT, "%=", true),
    STAR_STAR_ASSIGN(Kind.PUNCT, "**=", true),
    LEFT_SHIFT_ASSIGN(Kind.PUNCT, "<<=", true),
    RIGHT_SHIFT_ASSIGN(Kind.PUNCT, ">>=", true),
    UNSIGNED_RIGHT_SHIFT_ASSIGN(Kind.PUNCT, ">>>=", true),
    BIT_AND_ASSIGN(Kind.PUNCT, "&=", true),
    BIT_OR_ASSIGN(Kind.PUNCT, "|=", true),
    BIT_XOR_ASSIGN(Kind.PUNCT, "^=", true),
    AND_ASSIGN(Kind.PUNCT, "&&=", true),
    OR_ASSIGN(Kind.PUNCT, "||=", true),
    QUESTION_QUESTION_ASSIGN(Kind.PUNCT, "??=", true),

    // Binary, unary and update operators
    EQ(Kind.PUNCT, "==", true),
    NE(Kind.PUNCT, "!=", true),
    EQ_STRICT(Kind.PUNCT, "===", true),
    NE_STRICT(Kind.PUNCT, "!==", true),
    LT(Kind.PUNCT, "<", true),
    LE(Kind.PUNCT, "<=", true),
    GT(Kind.PUNCT, ">", true),
    GE(Kind.PUNCT, ">=", true),
    LEFT_SHIFT(Kind.PUNCT, "<<", true),
    RIGHT_SHIFT(Kind.PUNCT, ">>", true),
    UNSIGNED_RIGHT_SHIFT(Kind.PUNCT, ">>>", true),
    PLUS(Kind.PUNCT, "+", true),
    MINUS(Kind.PUNCT, "-", true),
    STAR(Kind.PUNCT, "*", true),
    SLASH(Kind.PUNCT, "/", true),
    PERCENT(Kind.PUNCT, "%", true),
    STAR_STAR(Kind.PUNCT, "**", true),
    INCREMENT(Kind.PUNCT, "++", false),
    DECREMENT(Kind.PUNCT, "--", false),
    BANG(Kind.PUNCT, "!", true),
    TILDE(Kind.PUNCT, "~", true),
    BIT_AND(Kind.PUNCT, "&", true),
    BIT_OR(Kind.PUNCT, "|", true),
    BIT_XOR(Kind.PUNCT, "^", true),
    AND(Kind.PUNCT, "&&", true),
    OR(Kind.PUNCT, "||", true),
    QUESTION_QUESTION(Kind.PUNCT, "??", true),

    // Keywords
    BREAK(Kind.KEYWORD, "break", false),
    CASE(Kind.KEYWORD, "case", true),
    CATCH(Kind.KEYWORD, "catch", false),
    CLASS(Kind.KEYWORD, "class", false),
    CONST(Kind.KEYWORD, "const", false),
    CONTINUE(Kind.KEYWORD, "continue", false),
    DEBUGGER(Kind.KEYWORD, "debugger", false),
    DEFAULT(Kind.KEYWORD, "default", true),
    DELETE(Kind.KEYWORD, "delete", true),
    DO(Kind.KEYWORD, "do", true),
    ELSE(Kind.KEYWORD, "else", true),
    EXPORT(Kind.KEYWORD, "export", false),
    EXTENDS(Kind.KEYWORD, "extends", true),
    FINALLY(Kind.KEYWORD, "finally", false),
    FOR(Kind.KEYWORD, "for", false),
    FUNCTION(Kind.KEYWORD, "function", false),
    IF(Kind.KEYWORD, "if", false),
    IMPORT(Kind.KEYWORD, "import", false),
    IN(Kind.KEYWORD, "in", true),
    INSTANCEOF(Kind.KEYWORD, "instanceof", true),
    NEW(Kind.KEYWORD, "new", true),
    RETURN(Kind.KEYWORD, "return", true),
    SUPER(Kind.KEYWORD, "super", false),
    SWITCH(Kind.KEYWORD, "switch", false),
    THIS(Kind.KEYWORD, "this", false),
    THROW(Kind.KEYWORD, "throw", true),
    TRY(Kind.KEYWORD, "try", false),
    TYPEOF(Kind.KEYWORD, "typeof", true),
    VAR(Kind.KEYWORD, "var", false),
    VOID(Kind.KEYWORD, "void", true),
    WHILE(Kind.KEYWORD, "while", false),
    WITH(Kind.KEYWORD, "with", false),
    NULL(Kind.KEYWORD, "null", false),
    TRUE(Kind.KEYWORD, "true", false),
    FALSE(Kind.KEYWORD, "false", false),

    // Tokens carrying a value
    IDENTIFIER(Kind.VALUE, "identifier", false),
    NUMBER(Kind.VALUE, "number", false),
    STRING(Kind.VALUE, "string", false),
    REGEX(Kind.VALUE, "regular expression", false),
    TEMPLATE(Kind.VALUE, "template", false),
    ERROR(Kind.VALUE, "error", false);

    private enum Kind { PUNCT, KEYWORD, VALUE }

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.kind == Kind.KEYWORD) {
                KEYWORDS.put(type.text, type);
            }
        }
    }

    private final Kind kind;
    private final String text;
    private final boolean beforeExpr;

    TokenType(Kind kind, String text, boolean beforeExpr) {
        this.kind = kind;
        this.text = text;
        this.beforeExpr = beforeExpr;
    }

    /**
     * Source text of a punctuator or keyword; a description for value tokens.
     */
    public String text() {
        return text;
    }

    /**
     * Whether an expression (and therefore a regular expression literal) may
     * directly follow a token of this type.
     */
    public boolean beforeExpr() {
        return beforeExpr;
    }

    public boolean isKeyword() {
        return kind == Kind.KEYWORD;
    }

    public boolean isPunct() {
        return kind == Kind.PUNCT;
    }

    /** Keyword type for {@code word}, or {@code null} if it is not a keyword. */
    public static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }
}
