package org.splice.syntax;

/** Binary operators with their precedence and associativity. */
public enum BinOp {
    MUL("*", 13, Fixity.LEFT),
    DIV("/", 13, Fixity.LEFT),
    REM("%", 13, Fixity.LEFT),
    ADD("+", 12, Fixity.LEFT),
    SUB("-", 12, Fixity.LEFT),
    SHL("<<", 11, Fixity.LEFT),
    SHR(">>", 11, Fixity.LEFT),
    BIT_AND("&", 10, Fixity.LEFT),
    BIT_XOR("^", 9, Fixity.LEFT),
    BIT_OR("|", 8, Fixity.LEFT),
    EQ("==", 7, Fixity.NONE),
    NE("!=", 7, Fixity.NONE),
    LT("<", 7, Fixity.NONE),
    LE("<=", 7, Fixity.NONE),
    GT(">", 7, Fixity.NONE),
    GE(">=", 7, Fixity.NONE),
    AND("&&", 6, Fixity.LEFT),
    OR("||", 5, Fixity.LEFT);

    public final String token;
    public final int precedence;
    public final Fixity fixity;

    BinOp(String token, int precedence, Fixity fixity) {
        this.token = token;
        this.precedence = precedence;
        this.fixity = fixity;
    }

    public static BinOp fromToken(String text) {
        for (BinOp op : values()) {
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
