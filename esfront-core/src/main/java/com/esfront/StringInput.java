package com.esfront;

import java.util.Arrays;

/**
 * In-memory {@link SourceInput} over a Java string.
 *
 * Byte offsets follow UTF-8; a lone surrogate counts as three bytes.
 */
public final class StringInput implements SourceInput {

    private final String source;
    // byteOffsets[i] is the byte offset of char index i; last entry is the total length
    private final int[] byteOffsets;
    private int index = 0;

    public StringInput(String source) {
        this.source = source;
        this.byteOffsets = buildByteOffsets(source);
    }

    private static int[] buildByteOffsets(String source) {
        int n = source.length();
        int[] offsets = new int[n + 1];
        int bytes = 0;
        int i = 0;
        while (i < n) {
            int cp = source.codePointAt(i);
            int chars = Character.charCount(cp);
            offsets[i] = bytes;
            if (chars == 2) {
                // the low surrogate has no position of its own
                offsets[i + 1] = bytes;
            }
            bytes += utf8Length(cp);
            i += chars;
        }
        offsets[n] = bytes;
        return offsets;
    }

    static int utf8Length(int cp) {
        if (cp < 0x80) return 1;
        if (cp < 0x800) return 2;
        if (cp < 0x10000) return 3;
        return 4;
    }

    @Override
    public int curPos() {
        return byteOffsets[index];
    }

    @Override
    public int cur() {
        return codePointAt(index);
    }

    @Override
    public int peek() {
        return peekAt(1);
    }

    @Override
    public int peekAhead() {
        return peekAt(2);
    }

    @Override
    public int peekAt(int n) {
        int i = index;
        for (int k = 0; k < n; k++) {
            if (i >= source.length()) return EOF;
            i += Character.charCount(source.codePointAt(i));
        }
        return codePointAt(i);
    }

    private int codePointAt(int i) {
        return i < source.length() ? source.codePointAt(i) : EOF;
    }

    @Override
    public void bump() {
        if (index < source.length()) {
            index += Character.charCount(source.codePointAt(index));
        }
    }

    @Override
    public boolean isEof() {
        return index >= source.length();
    }

    @Override
    public String slice(int lo, int hi) {
        if (lo > hi) {
            throw new IllegalArgumentException("invalid range [" + lo + ", " + hi + ")");
        }
        return source.substring(charIndexOf(lo), charIndexOf(hi));
    }

    private int charIndexOf(int bytePos) {
        int i = Arrays.binarySearch(byteOffsets, bytePos);
        if (i < 0) {
            throw new IndexOutOfBoundsException("byte offset " + bytePos + " is not on a character boundary");
        }
        // surrogate pairs share an offset; take the first
        while (i > 0 && byteOffsets[i - 1] == bytePos) {
            i--;
        }
        return i;
    }

    @Override
    public int length() {
        return byteOffsets[source.length()];
    }

    public String source() {
        return source;
    }
}
