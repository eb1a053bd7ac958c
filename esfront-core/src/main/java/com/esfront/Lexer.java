package com.esfront;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Context-sensitive ECMAScript lexer.
 *
 * <p>Produces {@link TokenAndSpan}s on demand. Whether a {@code /} starts a
 * regular expression or is a division operator is decided from a stack of
 * {@link TokenContext}s and an {@code exprAllowed} flag that is recomputed
 * after every token. Malformed input never throws: it becomes a
 * {@link Token.Error} token and scanning resumes after it.
 */
public class Lexer implements Iterator<TokenAndSpan> {
    private static final Logger log = LoggerFactory.getLogger(Lexer.class);

    private static final String REGEX_FLAGS = "dgimsuyv";

    private final SourceInput input;
    private final boolean moduleMode;
    private boolean strictMode;
    private boolean inGenerator = false;
    private boolean expressionStart = false;

    // Regex/division state
    private final ArrayDeque<TokenContext> context = new ArrayDeque<>();
    private boolean exprAllowed = true;
    private TokenType prevType = null; // null until the first token
    // The previous token was `function` or `class` and pushed a function context
    private boolean fnKeywordPushed = false;

    // Start of input counts as a line break
    private boolean hadLineBreak = true;

    // First error seen while scanning the current token
    private SyntaxError pendingError;

    private TokenAndSpan lookahead;
    private boolean finished = false;

    public Lexer(String source) {
        this(new StringInput(source), false, false);
    }

    public Lexer(String source, boolean strict, boolean module) {
        this(new StringInput(source), strict, module);
    }

    public Lexer(SourceInput input, boolean strict, boolean module) {
        this.input = input;
        this.moduleMode = module;
        this.strictMode = strict || module;
        this.context.push(TokenContext.BRACE_STMT);
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    public boolean isModule() {
        return moduleMode;
    }

    /**
     * Switch strictness for tokens not scanned yet (after a {@code "use strict"} directive).
     */
    public void setStrictMode(boolean strict) {
        this.strictMode = strict || moduleMode;
    }

    /** Whether {@code yield} is an operator, so that a following {@code /} starts a regex. */
    public void setGeneratorContext(boolean inGenerator) {
        this.inGenerator = inGenerator;
    }

    /**
     * Treat the start of input as an expression position, so a leading {@code {}
     * opens an object literal and a leading {@code function} is an expression.
     * Only meaningful before the first token is read.
     */
    public void startInExpression() {
        this.expressionStart = true;
    }

    public SourceInput input() {
        return input;
    }

    /** Drains the remaining tokens into a list. */
    public List<TokenAndSpan> tokenize() {
        List<TokenAndSpan> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    @Override
    public boolean hasNext() {
        if (lookahead == null && !finished) {
            lookahead = readNext();
            if (lookahead == null) {
                finished = true;
            }
        }
        return lookahead != null;
    }

    @Override
    public TokenAndSpan next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more tokens");
        }
        TokenAndSpan result = lookahead;
        lookahead = null;
        return result;
    }

    // ========================================================================
    // Token driver
    // ========================================================================

    private TokenAndSpan readNext() {
        boolean inTemplate = curContext() == TokenContext.TEMPLATE_QUASI;
        if (!inTemplate) {
            int commentStart = skipSpace();
            if (commentStart >= 0) {
                return errorToken(new Span(commentStart, input.curPos()), SyntaxError.UNTERMINATED_BLOCK_COMMENT);
            }
        }
        if (input.isEof()) {
            // An opened template still owes its chunk (reported as unterminated)
            boolean chunkDue = inTemplate && (prevType == TokenType.BACKTICK || prevType == TokenType.RBRACE);
            if (!chunkDue) {
                return null;
            }
        }

        int start = input.curPos();
        pendingError = null;
        Token token = inTemplate ? readTemplateToken() : readToken();
        Span span = new Span(start, input.curPos());

        if (pendingError != null) {
            if (isCommentError(pendingError)) {
                return errorToken(span, pendingError);
            }
            token = new Token.Error(new LexError(span, pendingError));
            log.debug("Lexical error {} at {}", pendingError, span);
        }

        boolean lineBreak = hadLineBreak;
        updateContext(token);
        prevType = token.type();
        hadLineBreak = false;
        return new TokenAndSpan(token, span, lineBreak);
    }

    // Comment errors stand in for skipped trivia, so they leave the regex state alone
    private TokenAndSpan errorToken(Span span, SyntaxError kind) {
        log.debug("Lexical error {} at {}", kind, span);
        TokenAndSpan result = new TokenAndSpan(new Token.Error(new LexError(span, kind)), span, hadLineBreak);
        hadLineBreak = false;
        return result;
    }

    private static boolean isCommentError(SyntaxError kind) {
        return kind == SyntaxError.LEGACY_COMMENT_IN_MODULE || kind == SyntaxError.UNTERMINATED_BLOCK_COMMENT;
    }

    private void fail(SyntaxError kind) {
        if (pendingError == null) {
            pendingError = kind;
        }
    }

    // ========================================================================
    // Regex/division context tracking
    // ========================================================================

    private TokenContext curContext() {
        return context.peek();
    }

    private void updateContext(Token token) {
        TokenType type = token.type();

        // `{class: x}`, `{function, ...}`: the keyword was a property name, not a function
        if (fnKeywordPushed && (type == TokenType.COLON || type == TokenType.COMMA || type == TokenType.RBRACE)) {
            context.pop();
        }
        fnKeywordPushed = false;

        // `a.if`, `a.function`: a keyword after a dot is a property name
        if (type.isKeyword() && prevType == TokenType.DOT) {
            exprAllowed = false;
            return;
        }

        switch (type) {
            case LPAREN -> {
                boolean statementParen = prevType == TokenType.IF || prevType == TokenType.FOR
                        || prevType == TokenType.WHILE || prevType == TokenType.WITH;
                context.push(statementParen ? TokenContext.PAREN_STMT : TokenContext.PAREN_EXPR);
                exprAllowed = true;
            }
            case RPAREN, RBRACE -> {
                if (context.size() == 1) {
                    exprAllowed = true;
                    return;
                }
                TokenContext out = context.pop();
                if (out == TokenContext.BRACE_STMT && curContext().isFunction()) {
                    out = context.pop();
                }
                exprAllowed = !out.isExpr();
            }
            case LBRACE -> {
                context.push(braceIsBlock() ? TokenContext.BRACE_STMT : TokenContext.BRACE_EXPR);
                exprAllowed = true;
            }
            case DOLLAR_LBRACE -> {
                context.push(TokenContext.BRACE_TEMPLATE);
                exprAllowed = true;
            }
            case FUNCTION, CLASS -> {
                context.push(functionIsExpression() ? TokenContext.FN_EXPR : TokenContext.FN_STMT);
                fnKeywordPushed = true;
                exprAllowed = false;
            }
            case BACKTICK -> {
                if (curContext() == TokenContext.TEMPLATE_QUASI) {
                    context.pop();
                } else {
                    context.push(TokenContext.TEMPLATE_QUASI);
                }
                exprAllowed = false;
            }
            case INCREMENT, DECREMENT -> {
                // unchanged
            }
            case IDENTIFIER -> {
                boolean allowed = false;
                if (prevType != TokenType.DOT) {
                    String sym = ((Token.Word) token).sym();
                    allowed = (sym.equals("of") && !exprAllowed) || (sym.equals("yield") && inGenerator);
                }
                exprAllowed = allowed;
            }
            default -> exprAllowed = type.beforeExpr();
        }
    }

    private boolean braceIsBlock() {
        TokenContext parent = curContext();
        if (parent.isFunction()) {
            return true;
        }
        if (prevType == TokenType.COLON
                && (parent == TokenContext.BRACE_STMT || parent == TokenContext.BRACE_EXPR)) {
            return !parent.isExpr();
        }
        if (prevType == TokenType.RETURN || (prevType == TokenType.IDENTIFIER && exprAllowed)) {
            return hadLineBreak;
        }
        if (prevType == null) {
            return !expressionStart;
        }
        if (prevType == TokenType.ELSE || prevType == TokenType.SEMICOLON
                || prevType == TokenType.RPAREN || prevType == TokenType.ARROW) {
            return true;
        }
        if (prevType == TokenType.LBRACE) {
            return parent == TokenContext.BRACE_STMT;
        }
        if (prevType == TokenType.VAR || prevType == TokenType.CONST || prevType == TokenType.IDENTIFIER) {
            return false;
        }
        return !exprAllowed;
    }

    private boolean functionIsExpression() {
        if (prevType == null) {
            return expressionStart;
        }
        if (!prevType.beforeExpr() || prevType == TokenType.ELSE) {
            return false;
        }
        if (prevType == TokenType.SEMICOLON && curContext() != TokenContext.PAREN_STMT) {
            return false;
        }
        if (prevType == TokenType.RETURN && hadLineBreak) {
            return false;
        }
        return !((prevType == TokenType.COLON || prevType == TokenType.LBRACE)
                && curContext() == TokenContext.BRACE_STMT);
    }

    // ========================================================================
    // Whitespace and comments
    // ========================================================================

    /**
     * Skips whitespace and comments, recording line breaks.
     *
     * @return start offset of an unterminated block comment, or -1
     */
    private int skipSpace() {
        while (!input.isEof()) {
            int c = input.cur();
            switch (c) {
                case ' ', '\t', 0x0B, '\f', 0xA0, 0xFEFF -> input.bump();
                case '\n', '\r', 0x2028, 0x2029 -> {
                    hadLineBreak = true;
                    input.bump();
                }
                case '/' -> {
                    int next = input.peek();
                    if (next == '/') {
                        skipLineComment();
                    } else if (next == '*') {
                        int start = input.curPos();
                        if (!skipBlockComment()) {
                            return start;
                        }
                    } else {
                        return -1;
                    }
                }
                case '<' -> {
                    if (moduleMode || !lookingAt("<!--")) {
                        return -1;
                    }
                    skipLineComment();
                }
                case '-' -> {
                    if (moduleMode || !hadLineBreak || !lookingAt("-->")) {
                        return -1;
                    }
                    skipLineComment();
                }
                default -> {
                    if (c > 0x7F && Character.getType(c) == Character.SPACE_SEPARATOR) {
                        input.bump();
                    } else {
                        return -1;
                    }
                }
            }
        }
        return -1;
    }

    private void skipLineComment() {
        while (!input.isEof() && !isLineTerminator(input.cur())) {
            input.bump();
        }
    }

    private boolean skipBlockComment() {
        input.bump();
        input.bump();
        while (!input.isEof()) {
            int c = input.cur();
            if (c == '*' && input.peek() == '/') {
                input.bump();
                input.bump();
                return true;
            }
            if (isLineTerminator(c)) {
                hadLineBreak = true;
            }
            input.bump();
        }
        return false;
    }

    // ========================================================================
    // Tokens
    // ========================================================================

    private Token readToken() {
        int c = input.cur();

        if (isIdentifierStart(c) || (c == '\\' && input.peek() == 'u')) {
            return readWord();
        }
        if (isDecimalDigit(c) || (c == '.' && isDecimalDigit(input.peek()))) {
            return readNumber();
        }

        return switch (c) {
            case '"', '\'' -> readString(c);
            case '`' -> op(TokenType.BACKTICK, 1);
            case '/' -> {
                if (exprAllowed) {
                    yield readRegex();
                }
                yield input.peek() == '=' ? op(TokenType.SLASH_ASSIGN, 2) : op(TokenType.SLASH, 1);
            }
            case '(' -> op(TokenType.LPAREN, 1);
            case ')' -> op(TokenType.RPAREN, 1);
            case '{' -> op(TokenType.LBRACE, 1);
            case '}' -> op(TokenType.RBRACE, 1);
            case '[' -> op(TokenType.LBRACKET, 1);
            case ']' -> op(TokenType.RBRACKET, 1);
            case ';' -> op(TokenType.SEMICOLON, 1);
            case ',' -> op(TokenType.COMMA, 1);
            case ':' -> op(TokenType.COLON, 1);
            case '~' -> op(TokenType.TILDE, 1);
            case '.' -> lookingAt("...") ? op(TokenType.DOT_DOT_DOT, 3) : op(TokenType.DOT, 1);
            case '?' -> {
                if (lookingAt("??=")) yield op(TokenType.QUESTION_QUESTION_ASSIGN, 3);
                if (lookingAt("??")) yield op(TokenType.QUESTION_QUESTION, 2);
                // `a?.5:b` is a conditional, not optional chaining
                if (input.peek() == '.' && !isDecimalDigit(input.peekAhead())) yield op(TokenType.QUESTION_DOT, 2);
                yield op(TokenType.QUESTION, 1);
            }
            case '=' -> {
                if (lookingAt("===")) yield op(TokenType.EQ_STRICT, 3);
                if (lookingAt("==")) yield op(TokenType.EQ, 2);
                if (lookingAt("=>")) yield op(TokenType.ARROW, 2);
                yield op(TokenType.ASSIGN, 1);
            }
            case '!' -> {
                if (lookingAt("!==")) yield op(TokenType.NE_STRICT, 3);
                if (lookingAt("!=")) yield op(TokenType.NE, 2);
                yield op(TokenType.BANG, 1);
            }
            case '+' -> {
                if (lookingAt("++")) yield op(TokenType.INCREMENT, 2);
                if (lookingAt("+=")) yield op(TokenType.PLUS_ASSIGN, 2);
                yield op(TokenType.PLUS, 1);
            }
            case '-' -> {
                if (moduleMode && hadLineBreak && lookingAt("-->")) yield legacyCommentInModule();
                if (lookingAt("--")) yield op(TokenType.DECREMENT, 2);
                if (lookingAt("-=")) yield op(TokenType.MINUS_ASSIGN, 2);
                yield op(TokenType.MINUS, 1);
            }
            case '*' -> {
                if (lookingAt("**=")) yield op(TokenType.STAR_STAR_ASSIGN, 3);
                if (lookingAt("**")) yield op(TokenType.STAR_STAR, 2);
                if (lookingAt("*=")) yield op(TokenType.STAR_ASSIGN, 2);
                yield op(TokenType.STAR, 1);
            }
            case '%' -> input.peek() == '=' ? op(TokenType.PERCENT_ASSIGN, 2) : op(TokenType.PERCENT, 1);
            case '<' -> {
                if (moduleMode && lookingAt("<!--")) yield legacyCommentInModule();
                if (lookingAt("<<=")) yield op(TokenType.LEFT_SHIFT_ASSIGN, 3);
                if (lookingAt("<<")) yield op(TokenType.LEFT_SHIFT, 2);
                if (lookingAt("<=")) yield op(TokenType.LE, 2);
                yield op(TokenType.LT, 1);
            }
            case '>' -> {
                if (lookingAt(">>>=")) yield op(TokenType.UNSIGNED_RIGHT_SHIFT_ASSIGN, 4);
                if (lookingAt(">>>")) yield op(TokenType.UNSIGNED_RIGHT_SHIFT, 3);
                if (lookingAt(">>=")) yield op(TokenType.RIGHT_SHIFT_ASSIGN, 3);
                if (lookingAt(">>")) yield op(TokenType.RIGHT_SHIFT, 2);
                if (lookingAt(">=")) yield op(TokenType.GE, 2);
                yield op(TokenType.GT, 1);
            }
            case '&' -> {
                if (lookingAt("&&=")) yield op(TokenType.AND_ASSIGN, 3);
                if (lookingAt("&&")) yield op(TokenType.AND, 2);
                if (lookingAt("&=")) yield op(TokenType.BIT_AND_ASSIGN, 2);
                yield op(TokenType.BIT_AND, 1);
            }
            case '|' -> {
                if (lookingAt("||=")) yield op(TokenType.OR_ASSIGN, 3);
                if (lookingAt("||")) yield op(TokenType.OR, 2);
                if (lookingAt("|=")) yield op(TokenType.BIT_OR_ASSIGN, 2);
                yield op(TokenType.BIT_OR, 1);
            }
            case '^' -> input.peek() == '=' ? op(TokenType.BIT_XOR_ASSIGN, 2) : op(TokenType.BIT_XOR, 1);
            default -> {
                input.bump();
                fail(SyntaxError.UNEXPECTED_CHAR);
                yield null;
            }
        };
    }

    private Token op(TokenType type, int length) {
        for (int i = 0; i < length; i++) {
            input.bump();
        }
        return Token.punct(type);
    }

    private Token legacyCommentInModule() {
        skipLineComment();
        fail(SyntaxError.LEGACY_COMMENT_IN_MODULE);
        return null;
    }

    private boolean lookingAt(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (input.peekAt(i) != text.charAt(i)) {
                return false;
            }
        }
        return true;
    }

    // ========================================================================
    // Identifiers and keywords
    // ========================================================================

    private Token readWord() {
        StringBuilder word = new StringBuilder();
        boolean escaped = false;
        boolean first = true;

        while (true) {
            int c = input.cur();
            if (c == '\\') {
                if (input.peek() != 'u') {
                    break;
                }
                escaped = true;
                input.bump();
                input.bump();
                int cp = readUnicodeEscapeBody();
                if (cp < 0) {
                    break;
                }
                if (first ? !isIdentifierStart(cp) : !isIdentifierPart(cp)) {
                    fail(SyntaxError.INVALID_IDENT_CHAR);
                }
                word.appendCodePoint(cp);
            } else if (first ? isIdentifierStart(c) : isIdentifierPart(c)) {
                word.appendCodePoint(c);
                input.bump();
            } else {
                break;
            }
            first = false;
        }

        String sym = word.toString();
        if (!escaped) {
            TokenType keyword = TokenType.keyword(sym);
            if (keyword != null) {
                return new Token.Word(keyword, sym);
            }
        }
        return Token.ident(sym);
    }

    // ========================================================================
    // Numbers
    // ========================================================================

    private Token readNumber() {
        int start = input.curPos();
        double value;

        if (input.cur() == '0') {
            int next = input.peek();
            int radix = switch (next) {
                case 'x', 'X' -> 16;
                case 'o', 'O' -> 8;
                case 'b', 'B' -> 2;
                default -> 0;
            };
            if (radix != 0) {
                input.bump();
                input.bump();
                value = readRadixDigits(radix);
                checkIdentifierAfterNumber();
                return new Token.Num(value);
            }
            if (isDecimalDigit(next)) {
                Token legacy = readLegacyNumber(start);
                if (legacy != null) {
                    return legacy;
                }
                return readDecimalTail(start);
            }
        }

        while (isDecimalDigit(input.cur())) {
            input.bump();
        }
        return readDecimalTail(start);
    }

    // 017 is an octal integer; 08 and 019 are decimal integers that may take a fraction
    private Token readLegacyNumber(int start) {
        boolean octal = true;
        input.bump();
        while (isDecimalDigit(input.cur())) {
            if (input.cur() >= '8') {
                octal = false;
            }
            input.bump();
        }
        if (strictMode) {
            fail(octal ? SyntaxError.LEGACY_OCTAL : SyntaxError.LEGACY_DECIMAL);
        }
        if (!octal) {
            return null;
        }
        String digits = input.slice(start, input.curPos());
        checkIdentifierAfterNumber();
        return new Token.Num(new BigInteger(digits, 8).doubleValue());
    }

    // Integer part consumed; reads `.digits` and the exponent
    private Token readDecimalTail(int start) {
        if (input.cur() == '.') {
            input.bump();
            while (isDecimalDigit(input.cur())) {
                input.bump();
            }
        }
        int c = input.cur();
        if (c == 'e' || c == 'E') {
            input.bump();
            if (input.cur() == '+' || input.cur() == '-') {
                input.bump();
            }
            if (!isDecimalDigit(input.cur())) {
                fail(SyntaxError.INVALID_NUMBER);
                return null;
            }
            while (isDecimalDigit(input.cur())) {
                input.bump();
            }
        }
        String text = input.slice(start, input.curPos());
        checkIdentifierAfterNumber();
        return new Token.Num(Double.parseDouble(text));
    }

    private double readRadixDigits(int radix) {
        int start = input.curPos();
        while (Character.digit(input.cur(), radix) >= 0 && input.cur() < 0x80) {
            input.bump();
        }
        if (input.curPos() == start) {
            fail(SyntaxError.INVALID_NUMBER);
            return 0;
        }
        return new BigInteger(input.slice(start, input.curPos()), radix).doubleValue();
    }

    private void checkIdentifierAfterNumber() {
        int c = input.cur();
        if (isIdentifierStart(c) || isDecimalDigit(c) || c == '\\') {
            while (isIdentifierPart(input.cur())) {
                input.bump();
            }
            if (input.cur() == '\\') {
                input.bump();
            }
            fail(SyntaxError.IDENT_AFTER_NUMBER);
        }
    }

    // ========================================================================
    // Strings and escapes
    // ========================================================================

    private Token readString(int quote) {
        input.bump();
        StringBuilder out = new StringBuilder();
        boolean hasEscape = false;

        while (true) {
            int c = input.cur();
            if (c == SourceInput.EOF || c == '\n' || c == '\r') {
                fail(SyntaxError.UNTERMINATED_STR);
                break;
            }
            if (c == quote) {
                input.bump();
                break;
            }
            if (c == '\\') {
                hasEscape = true;
                readEscape(out, false);
            } else {
                out.appendCodePoint(c);
                input.bump();
            }
        }
        return new Token.Str(out.toString(), hasEscape);
    }

    /**
     * Reads one escape sequence starting at the backslash and appends its value.
     * Line continuations append nothing.
     */
    private void readEscape(StringBuilder out, boolean inTemplate) {
        input.bump();
        int c = input.cur();
        switch (c) {
            case SourceInput.EOF -> {
                // the caller reports the unterminated literal
            }
            case 'n' -> simpleEscape(out, '\n');
            case 'r' -> simpleEscape(out, '\r');
            case 't' -> simpleEscape(out, '\t');
            case 'b' -> simpleEscape(out, '\b');
            case 'f' -> simpleEscape(out, '\f');
            case 'v' -> simpleEscape(out, 0x0B);
            case '\r' -> {
                input.bump();
                if (input.cur() == '\n') {
                    input.bump();
                }
            }
            case '\n', 0x2028, 0x2029 -> input.bump();
            case 'x' -> {
                input.bump();
                int hi = hexValue(input.cur());
                int lo = hi < 0 ? -1 : hexValue(input.peek());
                if (lo < 0) {
                    fail(SyntaxError.BAD_ESCAPE);
                    return;
                }
                input.bump();
                input.bump();
                out.append((char) (hi * 16 + lo));
            }
            case 'u' -> {
                input.bump();
                int cp = readUnicodeEscapeBody();
                if (cp >= 0) {
                    out.appendCodePoint(cp);
                }
            }
            case '0', '1', '2', '3', '4', '5', '6', '7' -> readOctalEscape(out, inTemplate);
            case '8', '9' -> {
                if (inTemplate) {
                    fail(SyntaxError.BAD_ESCAPE);
                } else if (strictMode) {
                    fail(SyntaxError.LEGACY_OCTAL_ESCAPE);
                }
                out.appendCodePoint(c);
                input.bump();
            }
            default -> {
                out.appendCodePoint(c);
                input.bump();
            }
        }
    }

    private void simpleEscape(StringBuilder out, int value) {
        out.append((char) value);
        input.bump();
    }

    private void readOctalEscape(StringBuilder out, boolean inTemplate) {
        int first = input.cur();
        if (first == '0' && !isDecimalDigit(input.peek())) {
            input.bump();
            out.append('\0');
            return;
        }
        if (inTemplate) {
            fail(SyntaxError.BAD_ESCAPE);
        } else if (strictMode) {
            fail(SyntaxError.LEGACY_OCTAL_ESCAPE);
        }
        int value = first - '0';
        input.bump();
        // up to three digits while the value stays within \377
        for (int i = 0; i < 2; i++) {
            int d = input.cur();
            if (d < '0' || d > '7' || value * 8 + (d - '0') > 0377) {
                break;
            }
            value = value * 8 + (d - '0');
            input.bump();
        }
        out.append((char) value);
    }

    /**
     * Reads the part of a unicode escape that follows the backslash-u prefix:
     * four hex digits or a braced hex run.
     *
     * @return the code point, or -1 after recording an error
     */
    private int readUnicodeEscapeBody() {
        if (input.cur() == '{') {
            input.bump();
            int value = 0;
            int digits = 0;
            boolean overflow = false;
            while (hexValue(input.cur()) >= 0) {
                if (!overflow) {
                    value = value * 16 + hexValue(input.cur());
                    overflow = value > 0x10FFFF;
                }
                input.bump();
                digits++;
            }
            if (digits == 0 || input.cur() != '}') {
                fail(SyntaxError.BAD_ESCAPE);
                return -1;
            }
            input.bump();
            if (overflow) {
                fail(SyntaxError.INVALID_CODE_POINT);
                return -1;
            }
            return value;
        }

        int value = 0;
        for (int i = 0; i < 4; i++) {
            int digit = hexValue(input.cur());
            if (digit < 0) {
                fail(SyntaxError.BAD_ESCAPE);
                return -1;
            }
            value = value * 16 + digit;
            input.bump();
        }
        return value;
    }

    // ========================================================================
    // Regular expressions
    // ========================================================================

    private Token readRegex() {
        input.bump();
        StringBuilder pattern = new StringBuilder();
        boolean inClass = false;
        boolean escaped = false;

        while (true) {
            int c = input.cur();
            if (c == SourceInput.EOF || isLineTerminator(c)) {
                fail(SyntaxError.UNTERMINATED_REGEX);
                return null;
            }
            if (escaped) {
                escaped = false;
            } else if (c == '\\') {
                escaped = true;
            } else if (c == '[') {
                inClass = true;
            } else if (c == ']') {
                inClass = false;
            } else if (c == '/' && !inClass) {
                break;
            }
            pattern.appendCodePoint(c);
            input.bump();
        }
        input.bump();

        StringBuilder flags = new StringBuilder();
        while (isIdentifierPart(input.cur()) || input.cur() == '\\') {
            int c = input.cur();
            if (REGEX_FLAGS.indexOf(c) < 0 || flags.indexOf(String.valueOf((char) c)) >= 0) {
                fail(SyntaxError.INVALID_REGEX_FLAGS);
            }
            flags.appendCodePoint(c);
            input.bump();
        }

        return new Token.Regex(pattern.toString(), flags.length() == 0 ? null : flags.toString());
    }

    // ========================================================================
    // Templates
    // ========================================================================

    private Token readTemplateToken() {
        // A delimiter only follows a chunk; a chunk that failed still counts as one
        if (prevType == TokenType.TEMPLATE || prevType == TokenType.ERROR) {
            if (input.cur() == '`') {
                return op(TokenType.BACKTICK, 1);
            }
            if (input.cur() == '$' && input.peek() == '{') {
                return op(TokenType.DOLLAR_LBRACE, 2);
            }
        }
        return readTemplateChunk();
    }

    private Token readTemplateChunk() {
        int start = input.curPos();
        StringBuilder cooked = new StringBuilder();

        while (true) {
            int c = input.cur();
            if (c == SourceInput.EOF) {
                fail(SyntaxError.UNTERMINATED_TPL);
                break;
            }
            if (c == '`' || (c == '$' && input.peek() == '{')) {
                break;
            }
            if (c == '\\') {
                readEscape(cooked, true);
            } else if (c == '\r') {
                input.bump();
                if (input.cur() == '\n') {
                    input.bump();
                }
                cooked.append('\n');
            } else {
                cooked.appendCodePoint(c);
                input.bump();
            }
        }

        String raw = input.slice(start, input.curPos()).replace("\r\n", "\n").replace('\r', '\n');
        return new Token.Template(cooked.toString(), raw);
    }

    // ========================================================================
    // Character classes
    // ========================================================================

    static boolean isLineTerminator(int c) {
        return c == '\n' || c == '\r' || c == 0x2028 || c == 0x2029;
    }

    static boolean isDecimalDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static int hexValue(int c) {
        if (c >= '0' && c <= '9') return c - '0';
        if (c >= 'a' && c <= 'f') return c - 'a' + 10;
        if (c >= 'A' && c <= 'F') return c - 'A' + 10;
        return -1;
    }

    static boolean isIdentifierStart(int c) {
        if (c < 0x80) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '$' || c == '_';
        }
        return Character.isUnicodeIdentifierStart(c) || isOtherIdStart(c);
    }

    static boolean isIdentifierPart(int c) {
        if (c < 0x80) {
            return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || isDecimalDigit(c) || c == '$' || c == '_';
        }
        if (c == 0x200C || c == 0x200D) {
            return true;
        }
        if (isOtherIdStart(c) || isOtherIdContinue(c)) {
            return true;
        }
        return Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c);
    }

    // Unicode Other_ID_Start, which the JDK does not report consistently
    private static boolean isOtherIdStart(int c) {
        return c == 0x1885 || c == 0x1886 || c == 0x2118 || c == 0x212E || c == 0x309B || c == 0x309C;
    }

    private static boolean isOtherIdContinue(int c) {
        return c == 0x00B7 || c == 0x0387 || (c >= 0x1369 && c <= 0x1371) || c == 0x19DA;
    }
}
