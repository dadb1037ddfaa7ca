package org.splice.rewrite;

import org.splice.syntax.Span;

import java.util.List;

public final class TextRewrite {

    private final Span oldSpan;
    // dummy for a deletion
    private final Span newSpan;
    private final List<TextRewrite> rewrites;
    private final TextAdjust adjust;

    public TextRewrite(Span oldSpan, Span newSpan, List<TextRewrite> rewrites, TextAdjust adjust) {
        this.oldSpan = oldSpan;
        this.newSpan = newSpan;
        this.rewrites = List.copyOf(rewrites);
        this.adjust = adjust;
    }

    public Span oldSpan() {
        return oldSpan;
    }

    public Span newSpan() {
        return newSpan;
    }

    public List<TextRewrite> rewrites() {
        return rewrites;
    }

    public TextAdjust adjust() {
        return adjust;
    }

    public boolean isDeletion() {
        return newSpan.isDummy();
    }

    public boolean isInsertion() {
        return oldSpan.isEmpty() && !newSpan.isDummy();
    }

    @Override
    public String toString() {
        return "TextRewrite{" + oldSpan + " -> " + (isDeletion() ? "<delete>" : newSpan)
                + (rewrites.isEmpty() ? "" : ", " + rewrites.size() + " nested")
                + (adjust == TextAdjust.NONE ? "" : ", " + adjust) + "}";
    }
}
