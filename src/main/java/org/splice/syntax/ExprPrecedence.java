package org.splice.syntax;

/**
 * Operator precedence of expressions, shared by the printer (which decides where parentheses are
 * needed) and the rewriter (which decides whether spliced text must be parenthesized).
 */
public final class ExprPrecedence {

    public static final int RESET = -100;
    public static final int JUMP = -30;
    public static final int ASSIGN = 2;
    public static final int CAST = 14;
    public static final int PREFIX = 50;
    public static final int POSTFIX = 60;
    public static final int PAREN = 99;

    private ExprPrecedence() {
    }

    public static int of(Node expr) {
        switch (expr.variant()) {
            case EXPR_BINARY:
                return expr.<BinOp>leaf("op").precedence;
            case EXPR_ASSIGN:
                return ASSIGN;
            case EXPR_CAST:
                return CAST;
            case EXPR_UNARY:
            case EXPR_ADDR_OF:
                return PREFIX;
            case EXPR_CALL:
            case EXPR_METHOD_CALL:
            case EXPR_FIELD:
            case EXPR_INDEX:
                return POSTFIX;
            case EXPR_RETURN:
                return JUMP;
            default:
                return PAREN;
        }
    }

    /** Minimum precedence of the left operand of {@code op}. */
    public static int leftPrec(BinOp op) {
        return op.fixity == Fixity.LEFT ? op.precedence : op.precedence + 1;
    }

    /** Minimum precedence of the right operand of {@code op}. */
    public static int rightPrec(BinOp op) {
        return op.fixity == Fixity.RIGHT ? op.precedence : op.precedence + 1;
    }

    /** Assignment is right-associative. */
    public static int assignLeftPrec() {
        return ASSIGN + 1;
    }

    public static int assignRightPrec() {
        return ASSIGN;
    }

    /**
     * True if the leftmost-outermost part of {@code expr} is a struct literal, which would be read
     * as the opening brace of the block in an {@code if} or {@code while} head.
     */
    public static boolean containsExteriorStructLit(Node expr) {
        switch (expr.variant()) {
            case EXPR_STRUCT:
                return true;
            case EXPR_BINARY:
            case EXPR_ASSIGN:
                return containsExteriorStructLit(expr.child("lhs"))
                        || containsExteriorStructLit(expr.child("rhs"));
            case EXPR_UNARY:
            case EXPR_ADDR_OF:
                return containsExteriorStructLit(expr.child("operand"));
            case EXPR_CAST:
                return containsExteriorStructLit(expr.child("expr"));
            case EXPR_FIELD:
            case EXPR_INDEX:
                return containsExteriorStructLit(expr.child("base"));
            case EXPR_METHOD_CALL:
                return containsExteriorStructLit(expr.child("receiver"));
            case EXPR_CALL:
                return containsExteriorStructLit(expr.child("callee"));
            default:
                return false;
        }
    }

    public static boolean isBlockLike(Node expr) {
        switch (expr.variant()) {
            case EXPR_BLOCK:
            case EXPR_IF:
            case EXPR_WHILE:
                return true;
            default:
                return false;
        }
    }

    /**
     * True if {@code expr} is not itself block-like but its text would begin with a block-like
     * expression. At the start of a statement such text is cut short after the block.
     */
    public static boolean startsWithBlockLike(Node expr) {
        if (isBlockLike(expr)) {
            return false;
        }
        Node leftmost = leftmostOperand(expr);
        while (leftmost != null) {
            if (isBlockLike(leftmost)) {
                return true;
            }
            leftmost = leftmostOperand(leftmost);
        }
        return false;
    }

    private static Node leftmostOperand(Node expr) {
        switch (expr.variant()) {
            case EXPR_BINARY:
            case EXPR_ASSIGN:
                return expr.child("lhs");
            case EXPR_CAST:
                return expr.child("expr");
            case EXPR_FIELD:
            case EXPR_INDEX:
                return expr.child("base");
            case EXPR_METHOD_CALL:
                return expr.child("receiver");
            case EXPR_CALL:
                return expr.child("callee");
            default:
                return null;
        }
    }
}
