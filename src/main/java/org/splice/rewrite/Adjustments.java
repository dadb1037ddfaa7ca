package org.splice.rewrite;

import org.splice.syntax.BinOp;
import org.splice.syntax.ExprPrecedence;
import org.splice.syntax.Node;
import org.splice.syntax.NodeKind;
import org.splice.syntax.Slot;
import org.splice.syntax.Variant;

/** Decides where spliced expressions need parentheses. */
final class Adjustments {

    private static final ExprPrec RESET = ExprPrec.normal(ExprPrecedence.RESET);

    private Adjustments() {
    }

    /**
     * The requirement of the child in {@code slot} of {@code parent}, where {@code parent} itself
     * sits at {@code context}. Undelimited operands of a condition head stay in the head.
     */
    static ExprPrec requirementFor(Node parent, Slot slot, ExprPrec context) {
        ExprPrec prec = requirementFor(parent, slot);
        if (context.isCond() && continuesHead(parent, slot)) {
            return prec.inCond();
        }
        return prec;
    }

    /** The precedence requirement of the child in {@code slot} of {@code parent}. */
    static ExprPrec requirementFor(Node parent, Slot slot) {
        if (parent.kind() != NodeKind.EXPR) {
            return RESET;
        }
        switch (parent.variant()) {
            case EXPR_BINARY:
                BinOp op = parent.leaf("op");
                if (slot.name.equals("lhs")) {
                    return ExprPrec.normal(ExprPrecedence.leftPrec(op));
                }
                return ExprPrec.normal(ExprPrecedence.rightPrec(op));
            case EXPR_ASSIGN:
                if (slot.name.equals("lhs")) {
                    return ExprPrec.normal(ExprPrecedence.assignLeftPrec());
                }
                return ExprPrec.normal(ExprPrecedence.assignRightPrec());
            case EXPR_CAST:
                return slot.name.equals("expr") ? ExprPrec.normal(ExprPrecedence.CAST) : RESET;
            case EXPR_UNARY:
            case EXPR_ADDR_OF:
                return ExprPrec.normal(ExprPrecedence.PREFIX);
            case EXPR_CALL:
                return slot.name.equals("callee") ? ExprPrec.callee(ExprPrecedence.POSTFIX) : RESET;
            case EXPR_METHOD_CALL:
                return slot.name.equals("receiver") ? ExprPrec.normal(ExprPrecedence.POSTFIX) : RESET;
            case EXPR_FIELD:
            case EXPR_INDEX:
                return slot.name.equals("base") ? ExprPrec.normal(ExprPrecedence.POSTFIX) : RESET;
            case EXPR_IF:
            case EXPR_WHILE:
                return slot.name.equals("cond") ? ExprPrec.cond(ExprPrecedence.RESET) : RESET;
            default:
                return RESET;
        }
    }

    /** True if the child in {@code slot} is printed without delimiters around it. */
    private static boolean continuesHead(Node parent, Slot slot) {
        switch (parent.variant()) {
            case EXPR_BINARY:
            case EXPR_ASSIGN:
            case EXPR_UNARY:
            case EXPR_ADDR_OF:
            case EXPR_RETURN:
                return true;
            case EXPR_CAST:
                return slot.name.equals("expr");
            case EXPR_CALL:
                return slot.name.equals("callee");
            case EXPR_METHOD_CALL:
                return slot.name.equals("receiver");
            case EXPR_FIELD:
            case EXPR_INDEX:
                return slot.name.equals("base");
            default:
                return false;
        }
    }

    /**
     * The adjustment needed to splice {@code node} into a position with requirement {@code prec}.
     * Only expressions are ever parenthesized.
     */
    static TextAdjust adjustmentFor(Node node, ExprPrec prec) {
        if (node.kind() != NodeKind.EXPR) {
            return TextAdjust.NONE;
        }
        int order = ExprPrecedence.of(node);
        boolean needParens;
        switch (prec.position()) {
            case COND:
                needParens = order < prec.minPrec() || ExprPrecedence.containsExteriorStructLit(node);
                break;
            case CALLEE:
                needParens = node.variant() == Variant.EXPR_FIELD || order < prec.minPrec();
                break;
            case COND_CALLEE:
                needParens = node.variant() == Variant.EXPR_FIELD || order < prec.minPrec()
                        || ExprPrecedence.containsExteriorStructLit(node);
                break;
            default:
                needParens = order < prec.minPrec();
                break;
        }
        return needParens ? TextAdjust.PARENTHESIZE : TextAdjust.NONE;
    }
}
