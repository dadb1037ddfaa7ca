package org.splice.syntax;

import java.util.Objects;

/**
 * A named piece of source text. Files are compared by identity: two parses of the same text
 * produce two distinct files.
 */
public final class SourceFile {

    private final String name;
    private final String text;
    private final boolean macroExpansion;

    SourceFile(String name, String text, boolean macroExpansion) {
        this.name = Objects.requireNonNull(name, "name");
        this.text = Objects.requireNonNull(text, "text");
        this.macroExpansion = macroExpansion;
    }

    public String name() {
        return name;
    }

    public String text() {
        return text;
    }

    public int length() {
        return text.length();
    }

    /** True for the pseudo-files holding text produced by macro expansion. */
    public boolean isMacroExpansion() {
        return macroExpansion;
    }

    public Span span(int lo, int hi) {
        return new Span(this, lo, hi, Span.ROOT_CONTEXT);
    }

    public Span fullSpan() {
        return span(0, text.length());
    }

    public String slice(int lo, int hi) {
        return text.substring(lo, hi);
    }

    @Override
    public String toString() {
        return name;
    }
}
