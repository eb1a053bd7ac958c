package com.esfront;

import com.esfront.ast.*;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static List<Stmt> body(String source) {
        return Parser.parse(source).body();
    }

    private static Expr expr(String source) {
        return ((ExprStmt) body(source).get(0)).expr();
    }

    private static ParseException error(String source) {
        return assertThrows(ParseException.class, () -> Parser.parse(source));
    }

    @Test
    void testProgram() {
        Program program = Parser.parse("a;\nb");
        assertEquals(new Span(0, 4), program.span());
        assertEquals("script", program.sourceType());
        assertEquals(2, program.body().size());
        assertEquals("module", Parser.parse("a", true).sourceType());
        assertTrue(Parser.parse("").body().isEmpty());
    }

    // ==================== Statements ====================

    @Test
    void testAutomaticSemicolonInsertion() {
        assertEquals(2, body("a\nb").size());
        assertEquals(1, body("{ a }").size());
        assertEquals(SyntaxError.UNEXPECTED_TOKEN, error("a b").kind());

        List<Stmt> stmts = body("a\n++b");
        assertEquals(2, stmts.size());
        UpdateExpr update = (UpdateExpr) ((ExprStmt) stmts.get(1)).expr();
        assertTrue(update.prefix());
    }

    @Test
    void testReturn() {
        ParseException e = error("return 1");
        assertEquals(SyntaxError.UNEXPECTED_TOKEN, e.kind());
        assertTrue(e.getMessage().contains("Illegal return statement"));

        FnDecl fn = (FnDecl) body("function f() { return\n1 }").get(0);
        List<Stmt> stmts = fn.func().body().stmts();
        assertEquals(2, stmts.size());
        assertNull(((ReturnStmt) stmts.get(0)).arg());

        ReturnStmt ret = (ReturnStmt) ((FnDecl) body("function f() { return a, b }").get(0)).func().body().stmts().get(0);
        assertInstanceOf(SeqExpr.class, ret.arg());
    }

    @Test
    void testThrow() {
        ThrowStmt stmt = (ThrowStmt) body("throw new Error('x');").get(0);
        assertInstanceOf(NewExpr.class, stmt.arg());
        assertEquals(SyntaxError.UNEXPECTED_TOKEN, error("throw\nx").kind());
    }

    @Test
    void testVariableDeclarations() {
        VarDecl decl = (VarDecl) body("var a = 1, b;").get(0);
        assertEquals("var", decl.kind());
        assertEquals(2, decl.decls().size());
        assertEquals(new Ident(new Span(4, 5), "a"), decl.decls().get(0).name());
        assertNull(decl.decls().get(1).init());
        assertEquals(new Span(0, 13), decl.span());

        VarDecl destructuring = (VarDecl) body("const { a, b: [c] } = d;").get(0);
        assertEquals("const", destructuring.kind());
        assertInstanceOf(ObjectPat.class, destructuring.decls().get(0).name());

        assertEquals(SyntaxError.UNEXPECTED_TOKEN, error("const a;").kind());
        assertEquals(SyntaxError.UNEXPECTED_TOKEN, error("var { a };").kind());
        assertEquals(SyntaxError.RESERVED_WORD, error("var if = 1;").kind());
    }

    @Test
    void testLet() {
        VarDecl decl = (VarDecl) body("let x = 1, [y] = z;").get(0);
        assertEquals("let", decl.kind());
        assertInstanceOf(ArrayPat.class, decl.decls().get(1).name());

        AssignExpr assign = (AssignExpr) expr("let = 5");
        assertEquals(new Ident(new Span(0, 3), "let"), assign.left());
        assertEquals(new Span(0, 7), assign.span());

        MemberExpr member = (MemberExpr) expr("let.a");
        assertEquals(new Span(0, 5), member.span());

        assertEquals(SyntaxError.RESERVED_WORD, error("'use strict'; let = 5").kind());
    }

    @Test
    void testIfElse() {
        IfStmt stmt = (IfStmt) body("if (a) b; else { c }").get(0);
        assertInstanceOf(ExprStmt.class, stmt.cons());
        assertInstanceOf(BlockStmt.class, stmt.alt());
        assertNull(((IfStmt) body("if (a) b").get(0)).alt());
    }

    @Test
    void testEmptyAndBlockStatements() {
        List<Stmt> stmts = body(";{ ; }");
        assertInstanceOf(EmptyStmt.class, stmts.get(0));
        BlockStmt block = (BlockStmt) stmts.get(1);
        assertEquals(new Span(1, 6), block.span());
        assertInstanceOf(EmptyStmt.class, block.stmts().get(0));
    }

    @Test
    void testFunctions() {
        FnDecl decl = (FnDecl) body("function f(a, [b], {c}, d = 1, ...e) {}").get(0);
        assertEquals("f", decl.ident().sym());
        List<Pat> params = decl.func().params();
        assertEquals(5, params.size());
        assertInstanceOf(ArrayPat.class, params.get(1));
        assertInstanceOf(ObjectPat.class, params.get(2));
        assertInstanceOf(AssignPat.class, params.get(3));
        assertInstanceOf(RestPat.class, params.get(4));

        assertEquals(SyntaxError.REST_NOT_LAST, error("function f(...a, b) {}").kind());

        AssignExpr assign = (AssignExpr) expr("x = function () {}");
        FnExpr fn = assertInstanceOf(FnExpr.class, assign.right());
        assertNull(fn.ident());
    }

    // ==================== Expressions ====================

    @Test
    void testPrecedence() {
        BinExpr sum = (BinExpr) expr("a + b * c");
        assertEquals("+", sum.op());
        assertEquals("*", ((BinExpr) sum.right()).op());
        assertEquals(new Span(0, 9), sum.span());

        BinExpr or = (BinExpr) expr("a || b && c");
        assertEquals("||", or.op());

        BinExpr shift = (BinExpr) expr("a - b - c");
        assertInstanceOf(BinExpr.class, shift.left());

        CondExpr cond = (CondExpr) expr("a ? b : c ? d : e");
        assertInstanceOf(CondExpr.class, cond.alt());

        AssignExpr chained = (AssignExpr) expr("a = b = c");
        assertInstanceOf(AssignExpr.class, chained.right());
    }

    @Test
    void testExponent() {
        BinExpr pow = (BinExpr) expr("a ** b ** c");
        assertEquals(new Ident(new Span(0, 1), "a"), pow.left());
        assertInstanceOf(BinExpr.class, pow.right());

        assertEquals(SyntaxError.UNEXPECTED_TOKEN, error("-2 ** 2").kind());
        BinExpr paren = (BinExpr) expr("(-2) ** 2");
        assertInstanceOf(ParenExpr.class, paren.left());
        BinExpr negativeExponent = (BinExpr) expr("2 ** -2");
        assertInstanceOf(UnaryExpr.class, negativeExponent.right());
    }

    @Test
    void testUnaryAndUpdate() {
        UnaryExpr typeof = (UnaryExpr) expr("typeof a.b");
        assertEquals("typeof", typeof.op());
        assertInstanceOf(MemberExpr.class, typeof.arg());

        UpdateExpr post = (UpdateExpr) expr("a.b++");
        assertFalse(post.prefix());
        assertEquals(new Span(0, 5), post.span());

        assertEquals(SyntaxError.INVALID_ASSIGN_TARGET, error("1++").kind());
        assertEquals(SyntaxError.INVALID_ASSIGN_TARGET, error("++f()").kind());
    }

    @Test
    void testNewAndMemberChains() {
        CallExpr call = (CallExpr) expr("new Foo.Bar(1).baz()");
        MemberExpr member = (MemberExpr) call.callee();
        NewExpr ctor = assertInstanceOf(NewExpr.class, member.obj());
        assertInstanceOf(MemberExpr.class, ctor.callee());
        assertEquals(1, ctor.args().size());

        NewExpr bare = (NewExpr) expr("new Foo");
        assertTrue(bare.args().isEmpty());

        MemberExpr computed = (MemberExpr) expr("a[b + 1].if");
        assertEquals("if", ((Ident) computed.prop()).sym());
        assertTrue(((MemberExpr) computed.obj()).computed());

        CallExpr spread = (CallExpr) expr("f(a, ...b)");
        assertInstanceOf(SpreadElement.class, spread.args().get(1));
    }

    @Test
    void testLiterals() {
        ArrayLit array = (ArrayLit) expr("[1, , 'x', true, null, this, /r/g]");
        assertEquals(7, array.elems().size());
        assertNull(array.elems().get(1));
        assertInstanceOf(Null.class, array.elems().get(4));
        assertEquals(new Regex(new Span(29, 33), "r", "g"), array.elems().get(6));

        SeqExpr seq = (SeqExpr) expr("a, b, c");
        assertEquals(3, seq.exprs().size());
    }

    @Test
    void testTemplate() {
        Tpl tpl = (Tpl) expr("`a${b}c${d + 1}`");
        assertEquals(2, tpl.exprs().size());
        assertEquals(3, tpl.quasis().size());
        assertEquals(new TplElement(new Span(1, 2), "a", "a", false), tpl.quasis().get(0));
        assertTrue(tpl.quasis().get(2).tail());
        assertEquals("", tpl.quasis().get(2).cooked());
        assertInstanceOf(BinExpr.class, tpl.exprs().get(1));

        assertEquals(SyntaxError.UNTERMINATED_TPL, error("`abc").kind());
        assertEquals(SyntaxError.BAD_ESCAPE, error("`\\01`").kind());
    }

    @Test
    void testKeywordKeyInTemplateSubstitution() {
        Tpl tpl = (Tpl) ((AssignExpr) expr("x = `${h({class: 'x'})}`;")).right();
        CallExpr call = (CallExpr) tpl.exprs().get(0);
        KeyValueProp prop = (KeyValueProp) ((ObjectLit) call.args().get(0)).props().get(0);
        assertEquals("class", ((Ident) prop.key()).sym());
        assertEquals("x", ((Str) prop.value()).value());
        assertTrue(tpl.quasis().get(1).tail());
    }

    @Test
    void testRegexVersusDivisionInStatements() {
        List<Stmt> stmts = body("x = a / b / c;\nif (x) {} /re/.test(y)");
        assertInstanceOf(BinExpr.class, ((AssignExpr) ((ExprStmt) stmts.get(0)).expr()).right());
        CallExpr call = (CallExpr) ((ExprStmt) stmts.get(2)).expr();
        assertInstanceOf(Regex.class, ((MemberExpr) call.callee()).obj());
    }

    @Test
    void testYieldInGenerator() {
        FnDecl fn = (FnDecl) body("function* g() { yield /re/g; yield* h(); yield }").get(0);
        assertTrue(fn.func().generator());
        List<Stmt> stmts = fn.func().body().stmts();

        YieldExpr first = (YieldExpr) ((ExprStmt) stmts.get(0)).expr();
        assertInstanceOf(Regex.class, first.arg());
        YieldExpr delegate = (YieldExpr) ((ExprStmt) stmts.get(1)).expr();
        assertTrue(delegate.delegate());
        YieldExpr bare = (YieldExpr) ((ExprStmt) stmts.get(2)).expr();
        assertNull(bare.arg());

        // outside a generator `yield` is an identifier in sloppy code
        BinExpr division = (BinExpr) expr("yield / 2");
        assertEquals("/", division.op());
        assertEquals(SyntaxError.RESERVED_WORD, error("function* g() { var yield; }").kind());
    }

    @Test
    void testReservedWords() {
        assertEquals(SyntaxError.RESERVED_WORD, error("var enum;").kind());
        assertDoesNotThrow(() -> Parser.parse("var await = 1; var static;"));

        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("await", true));
        assertEquals(SyntaxError.RESERVED_WORD, e.kind());
        assertEquals(new Span(0, 5), e.span());

        Parser parser = new Parser("x", false, true);
        assertTrue(parser.isReservedWord("implements"));
        assertFalse(parser.isReservedWord("await"));
        assertFalse(new Parser("x").isReservedWord("let"));
    }

    @Test
    void testErrorPosition() {
        ParseException e = error("a\n  b c");
        assertEquals(new Span(6, 7), e.span());
        assertEquals(new SourceLocation.Position(2, 4), e.position());
        assertTrue(e.getMessage().startsWith("SyntaxError: "));
        assertTrue(e.getMessage().endsWith("(2:4)"));
    }

    @Test
    void testLexErrorSurfacesAsParseException() {
        ParseException e = error("x = 'abc");
        assertEquals(SyntaxError.UNTERMINATED_STR, e.kind());
        assertEquals(new Span(4, 8), e.span());
    }

    @Test
    void testParseExpression() {
        Expr expr = new Parser("{ a: function () {} }").parseExpression();
        ObjectLit object = assertInstanceOf(ObjectLit.class, expr);
        assertInstanceOf(FnExpr.class, ((KeyValueProp) object.props().get(0)).value());

        assertEquals(SyntaxError.UNEXPECTED_TOKEN,
                assertThrows(ParseException.class, () -> new Parser("a b").parseExpression()).kind());
    }
}
