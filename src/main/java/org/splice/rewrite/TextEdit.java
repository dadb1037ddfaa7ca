package org.splice.rewrite;

import org.splice.syntax.Span;

public final class TextEdit {

    private final Span target;
    private final String text;

    public TextEdit(Span target, String text) {
        this.target = target;
        this.text = text;
    }

    public Span target() {
        return target;
    }

    public String text() {
        return text;
    }

    @Override
    public String toString() {
        return target + " => \"" + text + "\"";
    }
}
