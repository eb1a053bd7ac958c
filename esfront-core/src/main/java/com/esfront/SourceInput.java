package com.esfront;

/**
 * Character source consumed by the {@link Lexer}.
 *
 * Positions are UTF-8 byte offsets; characters are Unicode code points.
 * {@code -1} marks the end of input.
 */
public interface SourceInput {

    int EOF = -1;

    /** Byte offset of the current character. */
    int curPos();

    /** Current code point, or {@link #EOF}. */
    int cur();

    /** Code point after the current one, or {@link #EOF}. */
    int peek();

    /** Code point two after the current one, or {@link #EOF}. */
    int peekAhead();

    /** Code point {@code n} positions after the current one ({@code 0} is the current one), or {@link #EOF}. */
    int peekAt(int n);

    /** Advances past the current code point. No-op at end of input. */
    void bump();

    boolean isEof();

    /** Raw source text covered by the byte range {@code [lo, hi)}. */
    String slice(int lo, int hi);

    /** Length of the whole input in bytes. */
    int length();
}
