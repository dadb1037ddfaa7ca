package org.splice.syntax;

public enum UnOp {
    NEG("-"),
    NOT("!"),
    DEREF("*");

    public final String token;

    UnOp(String token) {
        this.token = token;
    }

    public static UnOp fromToken(String text) {
        for (UnOp op : values()) {
            if (op.token.equals(text)) {
                return op;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return token;
    }
}
