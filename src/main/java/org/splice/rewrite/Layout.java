package org.splice.rewrite;

import org.splice.syntax.SourceFile;
import org.splice.syntax.Span;

/** Whitespace lookups in the text around a span. */
final class Layout {

    private Layout() {
    }

    /** The leading whitespace of the line containing the start of {@code span}. */
    static String lineIndent(Span span) {
        SourceFile file = span.file();
        if (file == null) {
            return "";
        }
        String text = file.text();
        int lineStart = text.lastIndexOf('\n', span.lo() - 1) + 1;
        int end = lineStart;
        while (end < text.length() && (text.charAt(end) == ' ' || text.charAt(end) == '\t')) {
            end++;
        }
        return text.substring(lineStart, end);
    }

    /** The text between two spans of the same file if it is non-empty whitespace, else null. */
    static String blankGap(Span first, Span second) {
        if (first.file() == null || first.file() != second.file() || first.hi() >= second.lo()) {
            return null;
        }
        String gap = first.file().slice(first.hi(), second.lo());
        return gap.isBlank() ? gap : null;
    }

    static Span withPrecedingWhitespace(Span span, int floor) {
        String text = span.file().text();
        int lo = span.lo();
        while (lo > floor && Character.isWhitespace(text.charAt(lo - 1))) {
            lo--;
        }
        return span.withLo(lo);
    }

    static Span withFollowingWhitespace(Span span, int ceiling) {
        String text = span.file().text();
        int hi = span.hi();
        while (hi < ceiling && Character.isWhitespace(text.charAt(hi))) {
            hi++;
        }
        return span.withHi(hi);
    }

    /**
     * Extends {@code span} to the whole lines it covers, including the final line break, if
     * nothing but whitespace shares those lines with it. Returns null otherwise.
     */
    static Span wholeLines(Span span) {
        String text = span.file().text();
        int lo = span.lo();
        while (lo > 0 && (text.charAt(lo - 1) == ' ' || text.charAt(lo - 1) == '\t')) {
            lo--;
        }
        if (lo > 0 && text.charAt(lo - 1) != '\n') {
            return null;
        }
        int hi = span.hi();
        while (hi < text.length() && (text.charAt(hi) == ' ' || text.charAt(hi) == '\t')) {
            hi++;
        }
        if (hi < text.length()) {
            if (text.charAt(hi) != '\n') {
                return null;
            }
            hi++;
        }
        return span.withLo(lo).withHi(hi);
    }

    /** Extends {@code span} over one following space, if there is one. */
    static Span withTrailingSpace(Span span) {
        String text = span.file().text();
        if (span.hi() < text.length() && text.charAt(span.hi()) == ' ') {
            return span.withHi(span.hi() + 1);
        }
        return span;
    }

    /** True if the text just outside {@code span} is a parenthesis pair. */
    static boolean isParenthesized(Span span) {
        SourceFile file = span.file();
        if (file == null || span.lo() == 0 || span.hi() >= file.length()) {
            return false;
        }
        String text = file.text();
        return text.charAt(span.lo() - 1) == '(' && text.charAt(span.hi()) == ')';
    }
}
