package org.splice.syntax;

import java.util.Objects;

public final class Token {

    public final TokenKind kind;
    public final String text;
    public final Span span;

    public Token(TokenKind kind, String text, Span span) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.text = Objects.requireNonNull(text, "text");
        this.span = Objects.requireNonNull(span, "span");
    }

    public boolean is(TokenKind expected, String expectedText) {
        return kind == expected && text.equals(expectedText);
    }

    public boolean isPunct(String punct) {
        return is(TokenKind.PUNCT, punct);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenKind.KEYWORD, keyword);
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + span.lo();
    }
}
