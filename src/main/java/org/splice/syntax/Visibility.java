package org.splice.syntax;

public enum Visibility {
    INHERITED(""),
    PUBLIC("pub"),
    CRATE("pub(crate)");

    public final String text;

    Visibility(String text) {
        this.text = text;
    }

    @Override
    public String toString() {
        return text;
    }
}
