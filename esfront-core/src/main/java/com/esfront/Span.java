package com.esfront;

/**
 * Half-open byte range {@code [lo, hi)} into a UTF-8 encoded source buffer.
 * Zero-width spans are legal (synthesized nodes, end-of-input markers).
 */
public record Span(int lo, int hi) {

    public static final Span DUMMY = new Span(0, 0);

    public Span {
        if (lo < 0 || hi < lo) {
            throw new IllegalArgumentException("invalid span [" + lo + ", " + hi + ")");
        }
    }

    public int len() {
        return hi - lo;
    }

    public boolean contains(int pos) {
        return pos >= lo && pos < hi;
    }

    /**
     * Hull from the start of this span to the end of {@code other}.
     */
    public Span to(Span other) {
        return new Span(lo, Math.max(lo, other.hi));
    }

    public Span withLo(int lo) {
        return new Span(lo, hi);
    }

    public Span withHi(int hi) {
        return new Span(lo, hi);
    }

    @Override
    public String toString() {
        return lo + ".." + hi;
    }
}
