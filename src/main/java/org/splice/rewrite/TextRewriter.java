package org.splice.rewrite;

import org.splice.syntax.SourceFile;
import org.splice.syntax.Span;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Turns an edit tree into flat text edits and applies them. Nested rewrites are resolved inside
 * the replacement text they belong to, and adjustments are applied on the way out.
 */
public final class TextRewriter {

    private static final Comparator<TextRewrite> BY_TARGET =
            Comparator.comparingInt((TextRewrite rw) -> rw.oldSpan().lo())
                    .thenComparingInt(rw -> rw.oldSpan().hi());

    private TextRewriter() {
    }

    /**
     * Flattens top-level rewrites into edits ordered by target.
     *
     * @throws IllegalStateException if two targets overlap
     */
    public static List<TextEdit> flatten(List<TextRewrite> rewrites) {
        List<TextRewrite> sorted = sorted(rewrites);
        List<TextEdit> edits = new ArrayList<>(sorted.size());
        TextRewrite previous = null;
        for (TextRewrite rw : sorted) {
            checkOrder(previous, rw);
            edits.add(new TextEdit(rw.oldSpan(), replacementText(rw)));
            previous = rw;
        }
        return edits;
    }

    /** The text of {@code span} with {@code rewrites} applied inside it. */
    public static String render(Span span, List<TextRewrite> rewrites) {
        SourceFile file = span.file();
        StringBuilder out = new StringBuilder();
        int pos = span.lo();
        TextRewrite previous = null;
        for (TextRewrite rw : sorted(rewrites)) {
            Span target = rw.oldSpan();
            if (!span.contains(target)) {
                throw new IllegalStateException("nested rewrite " + target + " lies outside " + span);
            }
            checkOrder(previous, rw);
            out.append(file.slice(pos, target.lo()));
            out.append(replacementText(rw));
            pos = target.hi();
            previous = rw;
        }
        out.append(file.slice(pos, span.hi()));
        return out.toString();
    }

    /**
     * Applies edits to the text of {@code file}.
     *
     * @throws IllegalStateException if an edit targets another file or the edits overlap
     */
    public static String apply(SourceFile file, List<TextEdit> edits) {
        StringBuilder out = new StringBuilder();
        int pos = 0;
        for (TextEdit edit : edits) {
            Span target = edit.target();
            if (target.file() != file) {
                throw new IllegalStateException("edit " + target + " does not target " + file.name());
            }
            if (target.lo() < pos) {
                throw new IllegalStateException("edit " + target + " overlaps a previous edit");
            }
            out.append(file.slice(pos, target.lo()));
            out.append(edit.text());
            pos = target.hi();
        }
        out.append(file.slice(pos, file.length()));
        return out.toString();
    }

    public static String apply(SourceFile file, RewriteResult result) {
        return apply(file, flatten(result.rewrites()));
    }

    private static String replacementText(TextRewrite rw) {
        if (rw.isDeletion()) {
            return "";
        }
        String text = render(rw.newSpan(), rw.rewrites());
        if (rw.adjust() == TextAdjust.PARENTHESIZE && !Layout.isParenthesized(rw.oldSpan())) {
            return "(" + text + ")";
        }
        return text;
    }

    private static void checkOrder(TextRewrite previous, TextRewrite current) {
        if (previous == null) {
            return;
        }
        Span prev = previous.oldSpan();
        Span cur = current.oldSpan();
        if (prev.file() != cur.file()) {
            throw new IllegalStateException("rewrites target different files: " + prev + ", " + cur);
        }
        if (cur.lo() < prev.hi()) {
            throw new IllegalStateException("overlapping rewrites: " + prev + " and " + cur);
        }
    }

    private static List<TextRewrite> sorted(List<TextRewrite> rewrites) {
        List<TextRewrite> sorted = new ArrayList<>(rewrites);
        sorted.sort(BY_TARGET);
        return sorted;
    }
}
