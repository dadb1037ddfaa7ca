package org.splice.rewrite;

import java.util.Objects;

/**
 * The precedence requirement of the position an expression is spliced into. Besides a minimum
 * precedence, the position may be the head of an {@code if}/{@code while} (where an exterior
 * struct literal would be misread) or the callee of a call (where a field access would be misread
 * as a method call).
 */
public final class ExprPrec {

    public enum Position {
        NORMAL,
        COND,
        CALLEE,
        COND_CALLEE
    }

    private final Position position;
    private final int minPrec;

    private ExprPrec(Position position, int minPrec) {
        this.position = position;
        this.minPrec = minPrec;
    }

    public static ExprPrec normal(int minPrec) {
        return new ExprPrec(Position.NORMAL, minPrec);
    }

    public static ExprPrec cond(int minPrec) {
        return new ExprPrec(Position.COND, minPrec);
    }

    public static ExprPrec callee(int minPrec) {
        return new ExprPrec(Position.CALLEE, minPrec);
    }

    /** The same requirement at a position that is still part of an {@code if}/{@code while} head. */
    public ExprPrec inCond() {
        switch (position) {
            case NORMAL:
                return cond(minPrec);
            case CALLEE:
                return new ExprPrec(Position.COND_CALLEE, minPrec);
            default:
                return this;
        }
    }

    public boolean isCond() {
        return position == Position.COND || position == Position.COND_CALLEE;
    }

    public Position position() {
        return position;
    }

    public int minPrec() {
        return minPrec;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ExprPrec other = (ExprPrec) o;
        return minPrec == other.minPrec && position == other.position;
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, minPrec);
    }

    @Override
    public String toString() {
        return position.name().toLowerCase() + "(" + minPrec + ")";
    }
}
