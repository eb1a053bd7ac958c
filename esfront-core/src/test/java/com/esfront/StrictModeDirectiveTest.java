package com.esfront;

import com.esfront.ast.ExprStmt;
import com.esfront.ast.Num;
import com.esfront.ast.Program;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies that a "use strict" directive switches the lexer before the token
 * following the directive is scanned, and that function-level strictness ends
 * with the function body.
 */
public class StrictModeDirectiveTest {

    /**
     * The legacy octal literal right after the directive must already be lexed
     * in strict mode.
     */
    @Test
    @DisplayName("Legacy octal after a program-level directive is rejected")
    void testOctalAfterProgramDirective_ShouldThrow() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("\"use strict\"; 010"));
        assertEquals(SyntaxError.LEGACY_OCTAL, e.kind());
        assertEquals(new Span(14, 17), e.span());
        System.out.println("Correctly throws: " + e.getMessage());
    }

    @Test
    @DisplayName("Legacy octal without a directive is allowed")
    void testOctalWithoutDirective_ShouldSucceed() {
        Program program = Parser.parse("010");
        ExprStmt stmt = (ExprStmt) program.body().get(0);
        assertEquals(8, ((Num) stmt.expr()).value());
    }

    @Test
    @DisplayName("Directive later in the prologue still applies")
    void testSecondDirectiveInPrologue_ShouldThrow() {
        assertThrows(ParseException.class, () -> Parser.parse("'a'; 'use strict'; 010"));
    }

    @Test
    @DisplayName("A string after the prologue is not a directive")
    void testDirectiveAfterStatement_ShouldSucceed() {
        assertDoesNotThrow(() -> Parser.parse("x; 'use strict'; 010"));
    }

    @Test
    @DisplayName("Parenthesized and escaped strings are not directives")
    void testNonDirectiveForms_ShouldSucceed() {
        assertDoesNotThrow(() -> Parser.parse("('use strict'); 010"));
        assertDoesNotThrow(() -> Parser.parse("'use\\x20strict'; 010"));
        assertDoesNotThrow(() -> Parser.parse("'use strict' + 1; 010"));
    }

    @Test
    @DisplayName("Function-level directive applies inside the function body")
    void testOctalInStrictFunction_ShouldThrow() {
        ParseException e = assertThrows(ParseException.class,
                () -> Parser.parse("function f() { 'use strict'; return 010; }"));
        assertEquals(SyntaxError.LEGACY_OCTAL, e.kind());
    }

    @Test
    @DisplayName("Function-level strictness ends with the function")
    void testStrictnessRestoredAfterFunction_ShouldSucceed() {
        Parser parser = new Parser("function f() { 'use strict'; } 010;");
        Program program = parser.parseProgram();
        assertEquals(2, program.body().size());
        assertFalse(parser.isStrictMode());
    }

    @Test
    @DisplayName("Strict directive also rejects octal escapes")
    void testOctalEscapeAfterDirective_ShouldThrow() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("'use strict'; '\\101'"));
        assertEquals(SyntaxError.LEGACY_OCTAL_ESCAPE, e.kind());
    }

    @Test
    @DisplayName("A directive makes the program's reserved words strict")
    void testStrictReservedWords_ShouldThrow() {
        assertDoesNotThrow(() -> Parser.parse("var interface = 1;"));
        ParseException e = assertThrows(ParseException.class,
                () -> Parser.parse("'use strict'; var interface = 1;"));
        assertEquals(SyntaxError.RESERVED_WORD, e.kind());
    }

    @Test
    @DisplayName("Duplicate parameters are rejected when the body is strict")
    void testDuplicateParamsInStrictFunction_ShouldThrow() {
        assertDoesNotThrow(() -> Parser.parse("function f(a, a) {}"));
        ParseException e = assertThrows(ParseException.class,
                () -> Parser.parse("function f(a, a) { 'use strict'; }"));
        assertEquals(SyntaxError.DUPLICATE_BINDING, e.kind());
        assertEquals(new Span(14, 15), e.span());
    }

    @Test
    @DisplayName("Module code is strict from the first token")
    void testModuleIsStrict_ShouldThrow() {
        ParseException e = assertThrows(ParseException.class, () -> Parser.parse("010", true));
        assertEquals(SyntaxError.LEGACY_OCTAL, e.kind());
    }
}
