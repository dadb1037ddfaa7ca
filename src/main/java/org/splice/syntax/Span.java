package org.splice.syntax;

import java.util.Objects;

/**
 * A byte range {@code [lo, hi)} in a {@link SourceFile}, tagged with the hygiene context of the
 * tokens it covers. A span with {@code lo == hi} is an insertion point.
 */
public final class Span {

    /** Hygiene context of tokens that were written in the source, not produced by expansion. */
    public static final int ROOT_CONTEXT = 0;

    public static final Span DUMMY = new Span(null, 0, 0, ROOT_CONTEXT);

    private final SourceFile file;
    private final int lo;
    private final int hi;
    private final int ctxt;

    public Span(SourceFile file, int lo, int hi, int ctxt) {
        if (lo > hi) {
            throw new IllegalArgumentException("span lo > hi: " + lo + " > " + hi);
        }
        if (file != null && hi > file.length()) {
            throw new IllegalArgumentException("span " + lo + ".." + hi + " exceeds " + file.name());
        }
        this.file = file;
        this.lo = lo;
        this.hi = hi;
        this.ctxt = ctxt;
    }

    public SourceFile file() {
        return file;
    }

    public int lo() {
        return lo;
    }

    public int hi() {
        return hi;
    }

    public int ctxt() {
        return ctxt;
    }

    public boolean isDummy() {
        return this.equals(DUMMY);
    }

    public boolean isEmpty() {
        return lo == hi;
    }

    public int length() {
        return hi - lo;
    }

    /**
     * Checks if this span has source text that can be rewritten, or used as source text to rewrite
     * something else. Macro-generated text is never rewritable.
     */
    public boolean isRewritable() {
        return file != null && !isDummy() && ctxt == ROOT_CONTEXT;
    }

    /** The zero-width span at {@code lo}. */
    public Span startPoint() {
        return new Span(file, lo, lo, ctxt);
    }

    /** The zero-width span at {@code hi}. */
    public Span endPoint() {
        return new Span(file, hi, hi, ctxt);
    }

    public Span withLo(int newLo) {
        return new Span(file, newLo, hi, ctxt);
    }

    public Span withHi(int newHi) {
        return new Span(file, lo, newHi, ctxt);
    }

    public Span withCtxt(int newCtxt) {
        return new Span(file, lo, hi, newCtxt);
    }

    /** The span from the start of this one to the end of {@code end}. */
    public Span to(Span end) {
        if (file != end.file) {
            throw new IllegalArgumentException("spans from different files: " + this + ", " + end);
        }
        return new Span(file, Math.min(lo, end.lo), Math.max(hi, end.hi), ctxt);
    }

    public boolean contains(Span other) {
        return file == other.file && lo <= other.lo && other.hi <= hi;
    }

    /** Strict overlap: touching ranges and insertion points at a boundary do not overlap. */
    public boolean overlaps(Span other) {
        return file == other.file && lo < other.hi && other.lo < hi;
    }

    public String text() {
        if (file == null) {
            return "";
        }
        return file.slice(lo, hi);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Span span = (Span) o;
        return lo == span.lo && hi == span.hi && ctxt == span.ctxt && file == span.file;
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(file), lo, hi, ctxt);
    }

    @Override
    public String toString() {
        String name = file == null ? "<dummy>" : file.name();
        return name + "[" + lo + ".." + hi + (ctxt == ROOT_CONTEXT ? "" : ", #" + ctxt) + "]";
    }
}
