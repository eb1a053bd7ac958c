package com.esfront;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SpanAndSourceTest {

    @Test
    void testSpanIsHalfOpen() {
        Span span = new Span(2, 5);
        assertEquals(3, span.len());
        assertFalse(span.contains(1));
        assertTrue(span.contains(2));
        assertTrue(span.contains(4));
        assertFalse(span.contains(5));
        assertFalse(new Span(3, 3).contains(3));
    }

    @Test
    void testSpanRejectsInvalidRanges() {
        assertThrows(IllegalArgumentException.class, () -> new Span(-1, 2));
        assertThrows(IllegalArgumentException.class, () -> new Span(4, 3));
        assertDoesNotThrow(() -> new Span(7, 7));
    }

    @Test
    void testSpanHull() {
        assertEquals(new Span(1, 9), new Span(1, 3).to(new Span(6, 9)));
        assertEquals("1..3", new Span(1, 3).toString());
    }

    @Test
    void testStringInputUsesUtf8Offsets() {
        StringInput input = new StringInput("aé😀b");
        assertEquals(8, input.length());
        assertEquals('a', input.cur());
        input.bump();
        assertEquals(1, input.curPos());
        assertEquals('é', input.cur());
        input.bump();
        assertEquals(3, input.curPos());
        assertEquals(0x1F600, input.cur());
        assertEquals('b', input.peek());
        assertEquals(SourceInput.EOF, input.peekAhead());
        input.bump();
        assertEquals(7, input.curPos());
        input.bump();
        assertTrue(input.isEof());
        assertEquals(SourceInput.EOF, input.cur());
        input.bump();
        assertEquals(8, input.curPos());
    }

    @Test
    void testSliceByByteRange() {
        StringInput input = new StringInput("aé😀b");
        assertEquals("é😀", input.slice(1, 7));
        assertEquals("", input.slice(3, 3));
        assertEquals("aé😀b", input.slice(0, 8));
        assertThrows(IndexOutOfBoundsException.class, () -> input.slice(2, 7));
        assertThrows(IllegalArgumentException.class, () -> input.slice(3, 1));
    }

    @Test
    void testLineIndexPositions() {
        LineIndex index = new LineIndex("ab\ncd\r\nef\rg\u2028h");
        assertEquals(5, index.lineCount());
        assertEquals(new SourceLocation.Position(1, 0), index.position(0));
        assertEquals(new SourceLocation.Position(1, 2), index.position(2));
        assertEquals(new SourceLocation.Position(2, 0), index.position(3));
        assertEquals(new SourceLocation.Position(2, 1), index.position(4));
        assertEquals(new SourceLocation.Position(3, 0), index.position(7));
        assertEquals(new SourceLocation.Position(4, 0), index.position(10));
        assertEquals(new SourceLocation.Position(5, 0), index.position(14));
    }

    @Test
    void testLineIndexColumnsCountBytes() {
        LineIndex index = new LineIndex("é = 1");
        assertEquals(new SourceLocation.Position(1, 3), index.position(3));
        assertEquals(new SourceLocation(new SourceLocation.Position(1, 0), new SourceLocation.Position(1, 2)),
                index.location(new Span(0, 2)));
    }
}
