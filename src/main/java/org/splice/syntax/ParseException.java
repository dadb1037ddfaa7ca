package org.splice.syntax;

/**
 * Raised when text handed to the parser is not exactly one node of the requested kind. Callers are
 * expected to supply well-formed fragments, so this is not recovered from.
 */
public class ParseException extends RuntimeException {

    private final Span span;

    public ParseException(Span span, String message) {
        super(message + " at " + SourceMap.describe(span));
        this.span = span;
    }

    public Span getSpan() {
        return span;
    }
}
