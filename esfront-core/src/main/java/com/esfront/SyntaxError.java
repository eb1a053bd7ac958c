package com.esfront;

/**
 * Closed set of syntax error kinds reported by the lexer (as error tokens)
 * and by the parser (as {@link ParseException}s).
 */
public enum SyntaxError {
    LEGACY_OCTAL("Legacy octal literals are not available in strict mode"),
    LEGACY_DECIMAL("Decimals with leading zeros are not available in strict mode"),
    LEGACY_COMMENT_IN_MODULE("HTML-like comments are not allowed in module code"),
    LEGACY_OCTAL_ESCAPE("Octal escape sequences are not allowed in strict mode"),
    RESERVED_WORD_IN_OBJ_SHORTHAND_OR_PAT("Reserved words cannot be used as shorthand properties or binding names"),
    RESERVED_WORD("Unexpected reserved word"),
    UNEXPECTED_TOKEN("Unexpected token"),
    UNEXPECTED_EOF("Unexpected end of input"),
    UNEXPECTED_CHAR("Unexpected character"),
    UNTERMINATED_STR("Unterminated string constant"),
    UNTERMINATED_REGEX("Unterminated regular expression"),
    UNTERMINATED_TPL("Unterminated template"),
    UNTERMINATED_BLOCK_COMMENT("Unterminated comment"),
    BAD_ESCAPE("Bad character escape sequence"),
    INVALID_CODE_POINT("Code point out of bounds"),
    INVALID_IDENT_CHAR("Invalid character in identifier"),
    IDENT_AFTER_NUMBER("Identifier directly after number"),
    INVALID_NUMBER("Invalid number"),
    INVALID_REGEX_FLAGS("Invalid regular expression flags"),
    DUPLICATE_BINDING("Duplicate binding"),
    INVALID_ASSIGN_TARGET("Invalid assignment target"),
    COVER_INITIALIZED_NAME("Shorthand property assignments are valid only in destructuring patterns"),
    REST_NOT_LAST("Rest element must be last element");

    private final String message;

    SyntaxError(String message) {
        this.message = message;
    }

    public String message() {
        return message;
    }
}
