package com.esfront;

import com.esfront.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

public class Parser {
    private static final Logger log = LoggerFactory.getLogger(Parser.class);

    // ========================================================================
    // Binding Power Constants for Pratt Parser
    // ========================================================================
    // Higher binding power = tighter binding (higher precedence)
    private static final int BP_NONE = 0;
    private static final int BP_NULLISH = 4;        // ??
    private static final int BP_OR = 5;             // ||
    private static final int BP_AND = 6;            // &&
    private static final int BP_BIT_OR = 7;         // |
    private static final int BP_BIT_XOR = 8;        // ^
    private static final int BP_BIT_AND = 9;        // &
    private static final int BP_EQUALITY = 10;      // == != === !==
    private static final int BP_RELATIONAL = 11;    // < <= > >= instanceof in
    private static final int BP_SHIFT = 12;         // << >> >>>
    private static final int BP_ADDITIVE = 13;      // + -
    private static final int BP_MULTIPLICATIVE = 14;// * / %
    private static final int BP_EXPONENT = 15;      // ** (right-associative)

    private final TokenBuffer tokens;
    private final boolean forceModuleMode;

    private final ObjectLitParser objectLitParser = new ObjectLitParser();
    private final ObjectPatParser objectPatParser = new ObjectPatParser();

    // Context flags, saved and restored around sub-parses
    private boolean allowIn = true;
    private boolean strictMode;
    private boolean inGenerator = false;
    private boolean inAsync = false;
    private boolean inFunction = false;

    // `a = 1` shorthand properties not (yet) reinterpreted as patterns
    private final List<AssignProp> pendingCoverInits = new ArrayList<>();

    // Primary already consumed by statement-level lookahead (`let` used as an identifier)
    private Expr pendingPrimary = null;

    public Parser(String source) {
        this(source, false, false);
    }

    public Parser(String source, boolean forceModuleMode) {
        this(source, forceModuleMode, false);
    }

    public Parser(String source, boolean forceModuleMode, boolean forceStrictMode) {
        // Module code is always strict
        boolean initialStrictMode = forceModuleMode || forceStrictMode;
        this.strictMode = initialStrictMode;
        this.forceModuleMode = forceModuleMode;
        Lexer lexer = new Lexer(source, initialStrictMode, forceModuleMode);
        this.tokens = new TokenBuffer(lexer, new LineIndex(source));
    }

    // ========================================================================
    // Entry points
    // ========================================================================

    public static Program parse(String source) {
        return parse(source, false);
    }

    public static Program parse(String source, boolean forceModuleMode) {
        return new Parser(source, forceModuleMode).parseProgram();
    }

    /** Parses a source consisting of exactly one object literal. */
    public static ObjectLit parseObjectExpression(String source, boolean forceModuleMode) {
        Parser parser = new Parser(source, forceModuleMode);
        return parser.logFailures(() -> {
            ObjectLit object = parser.parseObjectLit();
            parser.expectEof();
            return object;
        });
    }

    /** Parses a source consisting of exactly one object pattern. */
    public static ObjectPat parseObjectPattern(String source, boolean forceModuleMode) {
        Parser parser = new Parser(source, forceModuleMode);
        return parser.logFailures(() -> {
            ObjectPat pattern = parser.parseObjectPat();
            parser.expectEof();
            return pattern;
        });
    }

    public Program parseProgram() {
        return logFailures(() -> {
            List<Stmt> body = parseStatementList(true, false);
            checkCoverInits();
            Span span = new Span(0, tokens.lexer().input().length());
            return new Program(span, body, forceModuleMode ? "module" : "script");
        });
    }

    /** Parses a source consisting of exactly one expression. */
    public Expr parseExpression() {
        return logFailures(() -> {
            tokens.lexer().startInExpression();
            Expr expr = parseExpr();
            expectEof();
            checkCoverInits();
            return expr;
        });
    }

    /**
     * Parses one object literal at the current token. {@code a = 1} properties are
     * kept as {@link AssignProp}; whether they are legal depends on what encloses
     * the literal.
     */
    public ObjectLit parseObjectLit() {
        return logFailures(() -> {
            tokens.lexer().startInExpression();
            return parseObject(objectLitParser);
        });
    }

    public ObjectPat parseObjectPat() {
        return logFailures(() -> {
            tokens.lexer().startInExpression();
            return parseObject(objectPatParser);
        });
    }

    private <T> T logFailures(Supplier<T> parse) {
        try {
            return parse.get();
        } catch (ParseException e) {
            log.debug("Parse failed: {}", e.getMessage());
            throw e;
        }
    }

    private void expectEof() {
        if (!tokens.isEof()) {
            throw tokens.unexpected();
        }
    }

    TokenBuffer tokens() {
        return tokens;
    }

    public boolean isStrictMode() {
        return strictMode;
    }

    // ========================================================================
    // Context helpers
    // ========================================================================

    private void setStrictMode(boolean strict) {
        strictMode = strict;
        tokens.lexer().setStrictMode(strict);
    }

    private <T> T includeIn(boolean allow, Supplier<T> body) {
        boolean oldAllowIn = allowIn;
        allowIn = allow;
        try {
            return body.get();
        } finally {
            allowIn = oldAllowIn;
        }
    }

    /**
     * Runs {@code body} as the inside of a function: {@code return} allowed,
     * {@code in} allowed, generator/async flags set, and any strictness picked up
     * from the body's directives dropped on exit.
     */
    <T> T inFunctionContext(boolean isGenerator, boolean isAsync, Supplier<T> body) {
        boolean oldInFunction = inFunction;
        boolean oldInGenerator = inGenerator;
        boolean oldInAsync = inAsync;
        boolean oldAllowIn = allowIn;
        boolean oldStrictMode = strictMode;

        inFunction = true;
        inGenerator = isGenerator;
        inAsync = isAsync;
        allowIn = true;
        tokens.lexer().setGeneratorContext(isGenerator);
        try {
            return body.get();
        } finally {
            inFunction = oldInFunction;
            inGenerator = oldInGenerator;
            inAsync = oldInAsync;
            allowIn = oldAllowIn;
            tokens.lexer().setGeneratorContext(oldInGenerator);
            if (strictMode != oldStrictMode) {
                setStrictMode(oldStrictMode);
            }
        }
    }

    /**
     * Words that cannot name a binding or be referenced as an identifier in the
     * current context.
     */
    public boolean isReservedWord(String word) {
        return switch (word) {
            case "break", "case", "catch", "class", "const", "continue", "debugger", "default",
                 "delete", "do", "else", "enum", "export", "extends", "false", "finally", "for",
                 "function", "if", "import", "in", "instanceof", "new", "null", "return", "super",
                 "switch", "this", "throw", "true", "try", "typeof", "var", "void", "while",
                 "with" -> true;
            case "implements", "interface", "let", "package", "private", "protected", "public",
                 "static" -> strictMode;
            case "yield" -> strictMode || inGenerator;
            case "await" -> forceModuleMode || inAsync;
            default -> false;
        };
    }

    // ========================================================================
    // Object production
    // ========================================================================

    /**
     * {@code { prop, prop, ... }} with an optional trailing comma. Properties come
     * from {@code strategy}.
     */
    public <T, P> T parseObject(ParseObject<T, P> strategy) {
        int start = tokens.curPos();
        tokens.expect(TokenType.LBRACE);

        List<P> props = new ArrayList<>();
        boolean first = true;
        while (!tokens.eat(TokenType.RBRACE)) {
            if (first) {
                first = false;
            } else {
                tokens.expect(TokenType.COMMA);
                if (tokens.eat(TokenType.RBRACE)) {
                    break;
                }
            }
            props.add(strategy.parseObjectProp(this));
        }

        return strategy.makeObject(tokens.span(start), props);
    }

    /** Property key: identifier name, string, number or {@code [expr]}. */
    public PropName parsePropName() {
        TokenAndSpan t = tokens.curTokenAndSpan();
        if (t == null) {
            throw tokens.unexpected();
        }
        Token token = t.token();
        Span span = t.span();

        if (token instanceof Token.Str str) {
            tokens.bump();
            return new Str(span, str.value(), str.hasEscape());
        }
        if (token instanceof Token.Num num) {
            tokens.bump();
            return new Num(span, num.value());
        }
        if (token instanceof Token.Word word) {
            tokens.bump();
            return new Ident(span, word.sym());
        }
        if (token.type() == TokenType.LBRACKET) {
            tokens.bump();
            Expr expr = parseAssignExprAllowIn();
            tokens.expect(TokenType.RBRACKET);
            return new ComputedPropName(tokens.span(span.lo()), expr);
        }
        throw tokens.unexpected();
    }

    void registerCoverInit(AssignProp prop) {
        pendingCoverInits.add(prop);
    }

    private void checkCoverInits() {
        if (!pendingCoverInits.isEmpty()) {
            AssignProp prop = pendingCoverInits.get(0);
            throw tokens.error(SyntaxError.COVER_INITIALIZED_NAME, prop.span(), null);
        }
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private List<Stmt> parseStatementList(boolean directives, boolean inBlock) {
        List<Stmt> stmts = new ArrayList<>();
        boolean inPrologue = directives;
        while (!tokens.isEof() && !(inBlock && tokens.is(TokenType.RBRACE))) {
            Stmt stmt = parseStatement();

            // Apply "use strict" before the next token is scanned
            if (inPrologue) {
                if (isDirective(stmt)) {
                    if (isUseStrictDirective(stmt)) {
                        setStrictMode(true);
                    }
                } else {
                    inPrologue = false;
                }
            }
            stmts.add(stmt);
        }
        return stmts;
    }

    private static boolean isDirective(Stmt stmt) {
        return stmt instanceof ExprStmt exprStmt && exprStmt.expr() instanceof Str;
    }

    private static boolean isUseStrictDirective(Stmt stmt) {
        Str str = (Str) ((ExprStmt) stmt).expr();
        return !str.hasEscape() && str.value().equals("use strict");
    }

    private Stmt parseStatement() {
        TokenAndSpan t = tokens.curTokenAndSpan();
        if (t == null) {
            throw tokens.unexpected();
        }

        switch (t.type()) {
            case LBRACE:
                return parseBlock();
            case SEMICOLON: {
                tokens.bump();
                return new EmptyStmt(t.span());
            }
            case VAR:
            case CONST:
                return parseVarStatement();
            case IF:
                return parseIfStatement();
            case RETURN:
                return parseReturnStatement();
            case THROW:
                return parseThrowStatement();
            case FUNCTION:
                return parseFunctionDeclaration();
            case IDENTIFIER:
                if (tokens.isContextual("let")) {
                    return parseLetStatement();
                }
                return parseExpressionStatement();
            default:
                return parseExpressionStatement();
        }
    }

    private BlockStmt parseBlock() {
        int start = tokens.curPos();
        tokens.expect(TokenType.LBRACE);
        List<Stmt> stmts = parseStatementList(false, true);
        tokens.expect(TokenType.RBRACE);
        return new BlockStmt(tokens.span(start), stmts);
    }

    private ExprStmt parseExpressionStatement() {
        int start = tokens.curPos();
        Expr expr = parseExpr();
        consumeSemicolon();
        return new ExprStmt(tokens.span(start), expr);
    }

    /** Automatic semicolon insertion: {@code ;}, or before {@code }}, end of input or a line break. */
    private void consumeSemicolon() {
        if (tokens.eat(TokenType.SEMICOLON)) {
            return;
        }
        if (tokens.isEof() || tokens.is(TokenType.RBRACE) || tokens.hadLineBreakBeforeCur()) {
            return;
        }
        throw tokens.unexpected();
    }

    private VarDecl parseVarStatement() {
        int start = tokens.curPos();
        TokenAndSpan keyword = tokens.bump();
        String kind = keyword.type() == TokenType.CONST ? "const" : "var";
        List<VarDeclarator> decls = parseVarDeclarations(kind);
        consumeSemicolon();
        return new VarDecl(tokens.span(start), kind, decls);
    }

    // `let` is only a declaration keyword when a binding follows it
    private Stmt parseLetStatement() {
        int start = tokens.curPos();
        TokenAndSpan let = tokens.bump();
        if (tokens.isOneOf(TokenType.IDENTIFIER, TokenType.LBRACKET, TokenType.LBRACE)) {
            List<VarDeclarator> decls = parseVarDeclarations("let");
            consumeSemicolon();
            return new VarDecl(tokens.span(start), "let", decls);
        }
        pendingPrimary = identifierReference("let", let.span());
        Expr expr = parseExpr();
        consumeSemicolon();
        return new ExprStmt(tokens.span(start), expr);
    }

    private List<VarDeclarator> parseVarDeclarations(String kind) {
        List<VarDeclarator> decls = new ArrayList<>();
        do {
            int start = tokens.curPos();
            Pat name = parseBindingTarget();
            Expr init = null;
            if (tokens.eat(TokenType.ASSIGN)) {
                init = parseAssignExpr();
            } else if (kind.equals("const") || !(name instanceof Ident)) {
                throw tokens.error(SyntaxError.UNEXPECTED_TOKEN, tokens.curSpan(),
                        "Missing initializer in " + kind + " declaration");
            }
            decls.add(new VarDeclarator(tokens.span(start), name, init));
        } while (tokens.eat(TokenType.COMMA));
        return decls;
    }

    private IfStmt parseIfStatement() {
        int start = tokens.curPos();
        tokens.expect(TokenType.IF);
        tokens.expect(TokenType.LPAREN);
        Expr test = includeIn(true, this::parseExpr);
        tokens.expect(TokenType.RPAREN);
        Stmt cons = parseStatement();
        Stmt alt = tokens.eat(TokenType.ELSE) ? parseStatement() : null;
        return new IfStmt(tokens.span(start), test, cons, alt);
    }

    private ReturnStmt parseReturnStatement() {
        if (!inFunction) {
            throw tokens.error(SyntaxError.UNEXPECTED_TOKEN, tokens.curSpan(), "Illegal return statement");
        }
        int start = tokens.curPos();
        tokens.expect(TokenType.RETURN);
        Expr arg = null;
        if (!tokens.isEof() && !tokens.isOneOf(TokenType.SEMICOLON, TokenType.RBRACE)
                && !tokens.hadLineBreakBeforeCur()) {
            arg = parseExpr();
        }
        consumeSemicolon();
        return new ReturnStmt(tokens.span(start), arg);
    }

    private ThrowStmt parseThrowStatement() {
        int start = tokens.curPos();
        tokens.expect(TokenType.THROW);
        if (tokens.hadLineBreakBeforeCur()) {
            throw tokens.error(SyntaxError.UNEXPECTED_TOKEN, tokens.curSpan(), "Illegal newline after throw");
        }
        Expr arg = parseExpr();
        consumeSemicolon();
        return new ThrowStmt(tokens.span(start), arg);
    }

    private FnDecl parseFunctionDeclaration() {
        int start = tokens.curPos();
        tokens.expect(TokenType.FUNCTION);
        boolean isGenerator = tokens.eat(TokenType.STAR);
        Ident ident = parseBindingIdentifier();
        Function func = parseFunctionRest(start, isGenerator, false, false);
        return new FnDecl(tokens.span(start), ident, func);
    }

    // ========================================================================
    // Functions
    // ========================================================================

    /**
     * Parameter list and body, starting at {@code (}. Methods pass
     * {@code uniqueParams}; other functions only reject duplicates in strict code.
     */
    Function parseFunctionRest(int start, boolean isGenerator, boolean isAsync, boolean uniqueParams) {
        return inFunctionContext(isGenerator, isAsync, () -> {
            List<Pat> params = parseFormalParams();
            BlockStmt body = parseFunctionBody();
            // strictMode still reflects the body's own directives here
            if (uniqueParams || strictMode) {
                checkUniqueParams(params);
            }
            return new Function(tokens.span(start), params, body, isGenerator, isAsync);
        });
    }

    private List<Pat> parseFormalParams() {
        tokens.expect(TokenType.LPAREN);
        List<Pat> params = new ArrayList<>();
        while (!tokens.eat(TokenType.RPAREN)) {
            int start = tokens.curPos();
            if (tokens.eat(TokenType.DOT_DOT_DOT)) {
                Pat arg = parseBindingTarget();
                RestPat rest = new RestPat(tokens.span(start), arg);
                if (!tokens.is(TokenType.RPAREN)) {
                    throw tokens.error(SyntaxError.REST_NOT_LAST, rest.span(), null);
                }
                params.add(rest);
                continue;
            }
            params.add(parseBindingElement());
            if (!tokens.is(TokenType.RPAREN)) {
                tokens.expect(TokenType.COMMA);
            }
        }
        return params;
    }

    private void checkUniqueParams(List<Pat> params) {
        List<Ident> names = new ArrayList<>();
        for (Pat param : params) {
            collectBoundNames(param, names);
        }
        Set<String> seen = new HashSet<>();
        for (Ident name : names) {
            if (!seen.add(name.sym())) {
                throw tokens.error(SyntaxError.DUPLICATE_BINDING, name.span(),
                        "Duplicate parameter name '" + name.sym() + "'");
            }
        }
    }

    private static void collectBoundNames(Pat pat, List<Ident> out) {
        if (pat instanceof Ident ident) {
            out.add(ident);
        } else if (pat instanceof AssignPat assign) {
            collectBoundNames(assign.left(), out);
        } else if (pat instanceof RestPat rest) {
            collectBoundNames(rest.arg(), out);
        } else if (pat instanceof ArrayPat array) {
            for (Pat elem : array.elems()) {
                if (elem != null) {
                    collectBoundNames(elem, out);
                }
            }
        } else if (pat instanceof ObjectPat object) {
            for (ObjectPatProp prop : object.props()) {
                if (prop instanceof KeyValuePatProp kv) {
                    collectBoundNames(kv.value(), out);
                } else if (prop instanceof AssignPatProp assign) {
                    out.add(assign.key());
                } else if (prop instanceof RestPat rest) {
                    collectBoundNames(rest.arg(), out);
                }
            }
        }
    }

    /** {@code { directives; statements }} of a function; call inside {@link #inFunctionContext}. */
    BlockStmt parseFunctionBody() {
        int start = tokens.curPos();
        tokens.expect(TokenType.LBRACE);
        List<Stmt> stmts = parseStatementList(true, true);
        tokens.expect(TokenType.RBRACE);
        return new BlockStmt(tokens.span(start), stmts);
    }

    // ========================================================================
    // Patterns
    // ========================================================================

    Ident parseBindingIdentifier() {
        TokenAndSpan t = tokens.curTokenAndSpan();
        if (t != null && t.token() instanceof Token.Word word) {
            if (isReservedWord(word.sym())) {
                throw tokens.error(SyntaxError.RESERVED_WORD, t.span(),
                        "Unexpected reserved word '" + word.sym() + "'");
            }
            tokens.bump();
            return new Ident(t.span(), word.sym());
        }
        throw tokens.unexpected();
    }

    private Pat parseBindingTarget() {
        if (tokens.is(TokenType.LBRACE)) {
            return parseObject(objectPatParser);
        }
        if (tokens.is(TokenType.LBRACKET)) {
            return parseArrayPattern();
        }
        return parseBindingIdentifier();
    }

    /** Binding target with an optional {@code = default}. */
    Pat parseBindingElement() {
        int start = tokens.curPos();
        Pat target = parseBindingTarget();
        if (tokens.eat(TokenType.ASSIGN)) {
            Expr value = parseAssignExprAllowIn();
            return new AssignPat(tokens.span(start), target, value);
        }
        return target;
    }

    private ArrayPat parseArrayPattern() {
        int start = tokens.curPos();
        tokens.expect(TokenType.LBRACKET);
        List<Pat> elems = new ArrayList<>();
        while (!tokens.eat(TokenType.RBRACKET)) {
            if (tokens.eat(TokenType.COMMA)) {
                elems.add(null);
                continue;
            }
            int elemStart = tokens.curPos();
            if (tokens.eat(TokenType.DOT_DOT_DOT)) {
                Pat arg = parseBindingTarget();
                RestPat rest = new RestPat(tokens.span(elemStart), arg);
                if (!tokens.is(TokenType.RBRACKET)) {
                    throw tokens.error(SyntaxError.REST_NOT_LAST, rest.span(), null);
                }
                elems.add(rest);
                continue;
            }
            elems.add(parseBindingElement());
            if (!tokens.is(TokenType.RBRACKET)) {
                tokens.expect(TokenType.COMMA);
            }
        }
        return new ArrayPat(tokens.span(start), elems);
    }

    // ========================================================================
    // Cover grammar: expressions reinterpreted as assignment targets
    // ========================================================================

    private Pat toAssignTarget(Expr expr) {
        if (expr instanceof Ident || expr instanceof MemberExpr) {
            return (Pat) expr;
        }
        if (expr instanceof ObjectLit object) {
            return toObjectPat(object);
        }
        if (expr instanceof ArrayLit array) {
            return toArrayPat(array);
        }
        if (expr instanceof ParenExpr) {
            return toSimpleTarget(expr);
        }
        throw invalidTarget(expr);
    }

    // Targets of compound assignment and update operators
    private Pat toSimpleTarget(Expr expr) {
        Expr inner = expr;
        while (inner instanceof ParenExpr paren) {
            inner = paren.expr();
        }
        if (inner instanceof Ident || inner instanceof MemberExpr) {
            return (Pat) inner;
        }
        throw invalidTarget(expr);
    }

    // Element of a destructuring target: may carry a default
    private Pat toTargetElement(Expr expr) {
        if (expr instanceof AssignExpr assign && assign.op().equals("=")) {
            return new AssignPat(assign.span(), assign.left(), assign.right());
        }
        return toAssignTarget(expr);
    }

    private ObjectPat toObjectPat(ObjectLit object) {
        List<ObjectPatProp> props = new ArrayList<>();
        List<Prop> source = object.props();
        for (int i = 0; i < source.size(); i++) {
            Prop prop = source.get(i);
            if (prop instanceof KeyValueProp kv) {
                props.add(new KeyValuePatProp(kv.span(), kv.key(), toTargetElement(kv.value())));
            } else if (prop instanceof ShorthandProp shorthand) {
                props.add(new AssignPatProp(shorthand.span(), shorthand.key(), null));
            } else if (prop instanceof AssignProp assign) {
                pendingCoverInits.removeIf(pending -> pending == assign);
                props.add(new AssignPatProp(assign.span(), assign.key(), assign.value()));
            } else if (prop instanceof SpreadElement spread) {
                if (i != source.size() - 1) {
                    throw tokens.error(SyntaxError.REST_NOT_LAST, spread.span(), null);
                }
                props.add(new RestPat(spread.span(), toSimpleTarget(spread.arg())));
            } else {
                // methods, getters and setters
                throw invalidTarget(prop);
            }
        }
        return new ObjectPat(object.span(), props);
    }

    private ArrayPat toArrayPat(ArrayLit array) {
        List<Pat> elems = new ArrayList<>();
        List<Expr> source = array.elems();
        for (int i = 0; i < source.size(); i++) {
            Expr elem = source.get(i);
            if (elem == null) {
                elems.add(null);
            } else if (elem instanceof SpreadElement spread) {
                if (i != source.size() - 1) {
                    throw tokens.error(SyntaxError.REST_NOT_LAST, spread.span(), null);
                }
                elems.add(new RestPat(spread.span(), toAssignTarget(spread.arg())));
            } else {
                elems.add(toTargetElement(elem));
            }
        }
        return new ArrayPat(array.span(), elems);
    }

    private ParseException invalidTarget(Node node) {
        return tokens.error(SyntaxError.INVALID_ASSIGN_TARGET, node.span(), null);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    // Start of the expression being parsed, including a primary consumed ahead of time
    private int exprStart() {
        return pendingPrimary != null ? pendingPrimary.span().lo() : tokens.curPos();
    }

    Expr parseAssignExprAllowIn() {
        return includeIn(true, this::parseAssignExpr);
    }

    private Expr parseExpr() {
        int start = exprStart();
        Expr first = parseAssignExpr();
        if (!tokens.is(TokenType.COMMA)) {
            return first;
        }
        List<Expr> exprs = new ArrayList<>();
        exprs.add(first);
        while (tokens.eat(TokenType.COMMA)) {
            exprs.add(parseAssignExpr());
        }
        return new SeqExpr(tokens.span(start), exprs);
    }

    private Expr parseAssignExpr() {
        if (pendingPrimary == null && inGenerator && tokens.isContextual("yield")) {
            return parseYield();
        }

        int start = exprStart();
        Expr left = parseConditional();

        Token t = tokens.cur();
        if (t == null || !isAssignmentOperator(t.type())) {
            return left;
        }
        TokenType op = t.type();
        Pat target = op == TokenType.ASSIGN ? toAssignTarget(left) : toSimpleTarget(left);
        tokens.bump();
        Expr right = parseAssignExpr();
        return new AssignExpr(tokens.span(start), op.text(), target, right);
    }

    private static boolean isAssignmentOperator(TokenType type) {
        return switch (type) {
            case ASSIGN, PLUS_ASSIGN, MINUS_ASSIGN, STAR_ASSIGN, SLASH_ASSIGN, PERCENT_ASSIGN,
                 STAR_STAR_ASSIGN, LEFT_SHIFT_ASSIGN, RIGHT_SHIFT_ASSIGN, UNSIGNED_RIGHT_SHIFT_ASSIGN,
                 BIT_AND_ASSIGN, BIT_OR_ASSIGN, BIT_XOR_ASSIGN, AND_ASSIGN, OR_ASSIGN,
                 QUESTION_QUESTION_ASSIGN -> true;
            default -> false;
        };
    }

    private Expr parseYield() {
        int start = tokens.curPos();
        tokens.bump();
        if (tokens.isEof() || tokens.hadLineBreakBeforeCur()
                || tokens.isOneOf(TokenType.RPAREN, TokenType.RBRACKET, TokenType.RBRACE,
                        TokenType.COMMA, TokenType.SEMICOLON, TokenType.COLON)) {
            return new YieldExpr(tokens.span(start), null, false);
        }
        boolean delegate = tokens.eat(TokenType.STAR);
        Expr arg = parseAssignExpr();
        return new YieldExpr(tokens.span(start), arg, delegate);
    }

    private Expr parseConditional() {
        int start = exprStart();
        Expr test = parseBinary(BP_NONE);
        if (!tokens.eat(TokenType.QUESTION)) {
            return test;
        }
        Expr cons = parseAssignExprAllowIn();
        tokens.expect(TokenType.COLON);
        Expr alt = parseAssignExpr();
        return new CondExpr(tokens.span(start), test, cons, alt);
    }

    private int binaryBindingPower(TokenType type) {
        return switch (type) {
            case QUESTION_QUESTION -> BP_NULLISH;
            case OR -> BP_OR;
            case AND -> BP_AND;
            case BIT_OR -> BP_BIT_OR;
            case BIT_XOR -> BP_BIT_XOR;
            case BIT_AND -> BP_BIT_AND;
            case EQ, NE, EQ_STRICT, NE_STRICT -> BP_EQUALITY;
            case LT, LE, GT, GE, INSTANCEOF -> BP_RELATIONAL;
            case IN -> allowIn ? BP_RELATIONAL : BP_NONE;
            case LEFT_SHIFT, RIGHT_SHIFT, UNSIGNED_RIGHT_SHIFT -> BP_SHIFT;
            case PLUS, MINUS -> BP_ADDITIVE;
            case STAR, SLASH, PERCENT -> BP_MULTIPLICATIVE;
            case STAR_STAR -> BP_EXPONENT;
            default -> BP_NONE;
        };
    }

    private Expr parseBinary(int minBp) {
        int start = exprStart();
        Expr left = parseUnary();

        while (true) {
            Token t = tokens.cur();
            if (t == null) {
                break;
            }
            TokenType op = t.type();
            int bp = binaryBindingPower(op);
            if (bp == BP_NONE || bp <= minBp) {
                break;
            }
            // `-a ** b` is ambiguous and rejected; `(-a) ** b` is fine
            if (op == TokenType.STAR_STAR && left instanceof UnaryExpr) {
                throw tokens.unexpected();
            }
            tokens.bump();
            // ** is right-associative
            Expr right = parseBinary(op == TokenType.STAR_STAR ? bp - 1 : bp);
            left = new BinExpr(tokens.span(start), op.text(), left, right);
        }
        return left;
    }

    private Expr parseUnary() {
        if (pendingPrimary == null) {
            int start = tokens.curPos();
            Token t = tokens.cur();
            if (t == null) {
                throw tokens.unexpected();
            }
            switch (t.type()) {
                case BANG, TILDE, PLUS, MINUS, TYPEOF, VOID, DELETE -> {
                    tokens.bump();
                    Expr arg = parseUnary();
                    return new UnaryExpr(tokens.span(start), t.type().text(), arg);
                }
                case INCREMENT, DECREMENT -> {
                    tokens.bump();
                    Expr arg = parseUnary();
                    toSimpleTarget(arg);
                    return new UpdateExpr(tokens.span(start), t.type().text(), true, arg);
                }
                default -> {
                    if (inAsync && tokens.isContextual("await")) {
                        tokens.bump();
                        Expr arg = parseUnary();
                        return new AwaitExpr(tokens.span(start), arg);
                    }
                }
            }
        }

        int start = exprStart();
        Expr expr = parseLeftHandSide();
        if (tokens.isOneOf(TokenType.INCREMENT, TokenType.DECREMENT) && !tokens.hadLineBreakBeforeCur()) {
            toSimpleTarget(expr);
            TokenAndSpan op = tokens.bump();
            return new UpdateExpr(tokens.span(start), op.type().text(), false, expr);
        }
        return expr;
    }

    private Expr parseLeftHandSide() {
        int start = exprStart();
        Expr callee = pendingPrimary == null && tokens.is(TokenType.NEW) ? parseNew() : parsePrimary();
        return parseMemberTail(start, callee, true);
    }

    private Expr parseNew() {
        int start = tokens.curPos();
        tokens.expect(TokenType.NEW);
        int calleeStart = tokens.curPos();
        Expr callee = tokens.is(TokenType.NEW) ? parseNew() : parsePrimary();
        callee = parseMemberTail(calleeStart, callee, false);
        List<Expr> args = tokens.is(TokenType.LPAREN) ? parseArguments() : List.of();
        return new NewExpr(tokens.span(start), callee, args);
    }

    private Expr parseMemberTail(int start, Expr expr, boolean allowCall) {
        while (true) {
            if (tokens.eat(TokenType.DOT)) {
                Ident prop = parseIdentifierName();
                expr = new MemberExpr(tokens.span(start), expr, prop, false);
            } else if (tokens.eat(TokenType.LBRACKET)) {
                Expr prop = includeIn(true, this::parseExpr);
                tokens.expect(TokenType.RBRACKET);
                expr = new MemberExpr(tokens.span(start), expr, prop, true);
            } else if (allowCall && tokens.is(TokenType.LPAREN)) {
                List<Expr> args = parseArguments();
                expr = new CallExpr(tokens.span(start), expr, args);
            } else {
                return expr;
            }
        }
    }

    private List<Expr> parseArguments() {
        tokens.expect(TokenType.LPAREN);
        List<Expr> args = new ArrayList<>();
        while (!tokens.eat(TokenType.RPAREN)) {
            int start = tokens.curPos();
            if (tokens.eat(TokenType.DOT_DOT_DOT)) {
                Expr arg = parseAssignExprAllowIn();
                args.add(new SpreadElement(tokens.span(start), arg));
            } else {
                args.add(parseAssignExprAllowIn());
            }
            if (!tokens.is(TokenType.RPAREN)) {
                tokens.expect(TokenType.COMMA);
            }
        }
        return args;
    }

    // Any word, keywords included, after `.`
    private Ident parseIdentifierName() {
        TokenAndSpan t = tokens.curTokenAndSpan();
        if (t != null && t.token() instanceof Token.Word word) {
            tokens.bump();
            return new Ident(t.span(), word.sym());
        }
        throw tokens.unexpected();
    }

    private Ident identifierReference(String sym, Span span) {
        if (isReservedWord(sym)) {
            throw tokens.error(SyntaxError.RESERVED_WORD, span, "Unexpected reserved word '" + sym + "'");
        }
        return new Ident(span, sym);
    }

    private Expr parsePrimary() {
        if (pendingPrimary != null) {
            Expr primary = pendingPrimary;
            pendingPrimary = null;
            return primary;
        }

        TokenAndSpan t = tokens.curTokenAndSpan();
        if (t == null) {
            throw tokens.unexpected();
        }
        Token token = t.token();
        Span span = t.span();

        switch (token.type()) {
            case IDENTIFIER: {
                tokens.bump();
                return identifierReference(((Token.Word) token).sym(), span);
            }
            case THIS:
                tokens.bump();
                return new ThisExpr(span);
            case NULL:
                tokens.bump();
                return new Null(span);
            case TRUE:
            case FALSE:
                tokens.bump();
                return new Bool(span, token.type() == TokenType.TRUE);
            case NUMBER:
                tokens.bump();
                return new Num(span, ((Token.Num) token).value());
            case STRING: {
                tokens.bump();
                Token.Str str = (Token.Str) token;
                return new Str(span, str.value(), str.hasEscape());
            }
            case REGEX: {
                tokens.bump();
                Token.Regex regex = (Token.Regex) token;
                return new Regex(span, regex.pattern(), regex.flags());
            }
            case BACKTICK:
                return parseTemplate();
            case LBRACKET:
                return parseArrayLiteral();
            case LBRACE:
                return parseObject(objectLitParser);
            case FUNCTION:
                return parseFunctionExpression();
            case LPAREN: {
                tokens.bump();
                Expr expr = includeIn(true, this::parseExpr);
                tokens.expect(TokenType.RPAREN);
                return new ParenExpr(tokens.span(span.lo()), expr);
            }
            default:
                throw tokens.unexpected();
        }
    }

    private FnExpr parseFunctionExpression() {
        int start = tokens.curPos();
        tokens.expect(TokenType.FUNCTION);
        boolean isGenerator = tokens.eat(TokenType.STAR);
        Ident ident = tokens.is(TokenType.LPAREN) ? null : parseBindingIdentifier();
        Function func = parseFunctionRest(start, isGenerator, false, false);
        return new FnExpr(tokens.span(start), ident, func);
    }

    private ArrayLit parseArrayLiteral() {
        int start = tokens.curPos();
        tokens.expect(TokenType.LBRACKET);
        List<Expr> elems = new ArrayList<>();
        while (!tokens.eat(TokenType.RBRACKET)) {
            if (tokens.eat(TokenType.COMMA)) {
                elems.add(null);
                continue;
            }
            int elemStart = tokens.curPos();
            if (tokens.eat(TokenType.DOT_DOT_DOT)) {
                Expr arg = parseAssignExprAllowIn();
                elems.add(new SpreadElement(tokens.span(elemStart), arg));
            } else {
                elems.add(parseAssignExprAllowIn());
            }
            if (!tokens.is(TokenType.RBRACKET)) {
                tokens.expect(TokenType.COMMA);
            }
        }
        return new ArrayLit(tokens.span(start), elems);
    }

    private Tpl parseTemplate() {
        int start = tokens.curPos();
        tokens.expect(TokenType.BACKTICK);
        List<Expr> exprs = new ArrayList<>();
        List<TplElement> quasis = new ArrayList<>();
        while (true) {
            TokenAndSpan chunk = tokens.expect(TokenType.TEMPLATE);
            Token.Template tpl = (Token.Template) chunk.token();
            if (tokens.eat(TokenType.BACKTICK)) {
                quasis.add(new TplElement(chunk.span(), tpl.cooked(), tpl.raw(), true));
                break;
            }
            quasis.add(new TplElement(chunk.span(), tpl.cooked(), tpl.raw(), false));
            tokens.expect(TokenType.DOLLAR_LBRACE);
            exprs.add(includeIn(true, this::parseExpr));
            tokens.expect(TokenType.RBRACE);
        }
        return new Tpl(tokens.span(start), exprs, quasis);
    }
}
