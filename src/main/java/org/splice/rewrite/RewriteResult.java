package org.splice.rewrite;

import org.splice.syntax.Span;

import java.util.List;

public final class RewriteResult {

    private final List<TextRewrite> rewrites;
    private final List<Span> abandoned;

    public RewriteResult(List<TextRewrite> rewrites, List<Span> abandoned) {
        this.rewrites = List.copyOf(rewrites);
        this.abandoned = List.copyOf(abandoned);
    }

    public List<TextRewrite> rewrites() {
        return rewrites;
    }

    // nodes left untouched because their text is not rewritable
    public List<Span> abandoned() {
        return abandoned;
    }

    public boolean isEmpty() {
        return rewrites.isEmpty();
    }

    public boolean hasAbandoned() {
        return !abandoned.isEmpty();
    }
}
