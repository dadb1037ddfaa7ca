package org.splice.syntax;

import java.util.List;

/**
 * Pretty printer. Output is deterministic, uses four-space indentation, and contains exactly the
 * parentheses that precedence requires, so that parsing the printed text of a node yields a node
 * with the same structure.
 */
public final class Printer {

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private final String baseIndent;
    private int level;

    private Printer(String baseIndent) {
        this.baseIndent = baseIndent;
    }

    public static String print(Node node) {
        return print(node, "");
    }

    /**
     * Prints {@code node}; every line after the first starts with {@code baseIndent}, so that the
     * text can replace a node whose first line is indented by {@code baseIndent}.
     */
    public static String print(Node node, String baseIndent) {
        Printer printer = new Printer(baseIndent);
        printer.node(node);
        return printer.out.toString();
    }

    private void node(Node node) {
        switch (node.kind()) {
            case CRATE:
                crate(node);
                break;
            case ITEM:
            case FOREIGN_ITEM:
                item(node);
                break;
            case ATTR:
                out.append("#[").append(node.<String>leaf("meta")).append(']');
                break;
            case STMT:
                stmt(node);
                break;
            case EXPR:
                expr(node);
                break;
            case PAT:
                pat(node);
                break;
            case TY:
                ty(node);
                break;
            case BLOCK:
                block(node);
                break;
            case PARAM:
                pat(node.child("pat"));
                out.append(": ");
                ty(node.child("ty"));
                break;
            case FIELD_DEF:
                visibility(node.leaf("vis"));
                out.append(node.<String>leaf("name")).append(": ");
                ty(node.child("ty"));
                break;
            case FIELD_INIT:
                out.append(node.<String>leaf("name")).append(": ");
                expr(node.child("expr"));
                break;
            default:
                throw new IllegalArgumentException("unknown node kind " + node.kind());
        }
    }

    private void crate(Node crate) {
        List<Node> items = crate.list("items");
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append('\n');
                newline();
            }
            item(items.get(i));
        }
        if (!items.isEmpty()) {
            out.append('\n');
        }
    }

    // ===== Items =====

    private void item(Node item) {
        for (Node attr : item.list("attrs")) {
            node(attr);
            newline();
        }
        switch (item.variant()) {
            case ITEM_FN:
                visibility(item.leaf("vis"));
                if (item.<Boolean>leaf("constness")) {
                    out.append("const ");
                }
                if (item.<Boolean>leaf("unsafety")) {
                    out.append("unsafe ");
                }
                abi(item.leaf("abi"));
                signature(item);
                out.append(' ');
                block(item.child("body"));
                break;
            case ITEM_STRUCT:
                visibility(item.leaf("vis"));
                out.append("struct ").append(item.<String>leaf("name")).append(' ');
                braced(item.list("fields"), ",");
                break;
            case ITEM_STATIC:
            case FOREIGN_STATIC:
                visibility(item.leaf("vis"));
                out.append("static ");
                if (item.<Boolean>leaf("mutability")) {
                    out.append("mut ");
                }
                out.append(item.<String>leaf("name")).append(": ");
                ty(item.child("ty"));
                if (item.variant() == Variant.ITEM_STATIC) {
                    out.append(" = ");
                    expr(item.child("value"));
                }
                out.append(';');
                break;
            case ITEM_CONST:
                visibility(item.leaf("vis"));
                out.append("const ").append(item.<String>leaf("name")).append(": ");
                ty(item.child("ty"));
                out.append(" = ");
                expr(item.child("value"));
                out.append(';');
                break;
            case ITEM_MOD:
                visibility(item.leaf("vis"));
                out.append("mod ").append(item.<String>leaf("name")).append(' ');
                itemBlock(item.list("items"));
                break;
            case ITEM_TYPE:
                visibility(item.leaf("vis"));
                out.append("type ").append(item.<String>leaf("name")).append(" = ");
                ty(item.child("ty"));
                out.append(';');
                break;
            case ITEM_FOREIGN_MOD:
                abi(item.leaf("abi"));
                itemBlock(item.list("items"));
                break;
            case FOREIGN_FN:
                visibility(item.leaf("vis"));
                signature(item);
                out.append(';');
                break;
            default:
                throw new IllegalArgumentException("not an item: " + item.variant());
        }
    }

    private void signature(Node fn) {
        out.append("fn ").append(fn.<String>leaf("name")).append('(');
        commaSeparated(fn.list("params"));
        out.append(')');
        Node ret = fn.child("ret");
        if (ret != null) {
            out.append(" -> ");
            ty(ret);
        }
    }

    private void visibility(Visibility vis) {
        if (vis != Visibility.INHERITED) {
            out.append(vis.text).append(' ');
        }
    }

    private void abi(String abi) {
        if (abi == null) {
            return;
        }
        out.append("extern ");
        if (!abi.isEmpty()) {
            out.append(abi).append(' ');
        }
    }

    private void itemBlock(List<Node> items) {
        if (items.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append('{');
        level++;
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                out.append('\n');
            }
            newline();
            node(items.get(i));
        }
        level--;
        newline();
        out.append('}');
    }

    private void braced(List<Node> elements, String terminator) {
        if (elements.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append('{');
        level++;
        for (Node element : elements) {
            newline();
            node(element);
            out.append(terminator);
        }
        level--;
        newline();
        out.append('}');
    }

    // ===== Statements =====

    private void block(Node block) {
        braced(block.list("stmts"), "");
    }

    private void stmt(Node stmt) {
        switch (stmt.variant()) {
            case STMT_LOCAL:
                out.append("let ");
                pat(stmt.child("pat"));
                Node ty = stmt.child("ty");
                if (ty != null) {
                    out.append(": ");
                    ty(ty);
                }
                Node init = stmt.child("init");
                if (init != null) {
                    out.append(" = ");
                    expr(init);
                }
                out.append(';');
                break;
            case STMT_SEMI:
                stmtExpr(stmt.child("expr"));
                out.append(';');
                break;
            case STMT_EXPR:
                stmtExpr(stmt.child("expr"));
                break;
            case STMT_ITEM:
                item(stmt.child("item"));
                break;
            default:
                throw new IllegalArgumentException("not a statement: " + stmt.variant());
        }
    }

    private void stmtExpr(Node expr) {
        if (ExprPrecedence.startsWithBlockLike(expr)) {
            out.append('(');
            expr(expr);
            out.append(')');
        } else {
            expr(expr);
        }
    }

    // ===== Expressions =====

    private void expr(Node expr) {
        switch (expr.variant()) {
            case EXPR_LIT:
                out.append(expr.<String>leaf("value"));
                break;
            case EXPR_PATH:
                out.append(expr.<String>leaf("path"));
                break;
            case EXPR_BINARY:
                BinOp op = expr.leaf("op");
                operand(expr.child("lhs"), ExprPrecedence.leftPrec(op));
                out.append(' ').append(op.token).append(' ');
                operand(expr.child("rhs"), ExprPrecedence.rightPrec(op));
                break;
            case EXPR_UNARY:
                out.append(expr.<UnOp>leaf("op").token);
                operand(expr.child("operand"), ExprPrecedence.PREFIX);
                break;
            case EXPR_ADDR_OF:
                out.append(expr.<Boolean>leaf("mutability") ? "&mut " : "&");
                operand(expr.child("operand"), ExprPrecedence.PREFIX);
                break;
            case EXPR_ASSIGN:
                operand(expr.child("lhs"), ExprPrecedence.assignLeftPrec());
                out.append(" = ");
                operand(expr.child("rhs"), ExprPrecedence.assignRightPrec());
                break;
            case EXPR_CAST:
                operand(expr.child("expr"), ExprPrecedence.CAST);
                out.append(" as ");
                ty(expr.child("ty"));
                break;
            case EXPR_CALL:
                Node callee = expr.child("callee");
                if (callee.variant() == Variant.EXPR_FIELD) {
                    parenthesized(callee);
                } else {
                    operand(callee, ExprPrecedence.POSTFIX);
                }
                out.append('(');
                commaSeparated(expr.list("args"));
                out.append(')');
                break;
            case EXPR_METHOD_CALL:
                operand(expr.child("receiver"), ExprPrecedence.POSTFIX);
                out.append('.').append(expr.<String>leaf("method")).append('(');
                commaSeparated(expr.list("args"));
                out.append(')');
                break;
            case EXPR_FIELD:
                operand(expr.child("base"), ExprPrecedence.POSTFIX);
                out.append('.').append(expr.<String>leaf("field"));
                break;
            case EXPR_INDEX:
                operand(expr.child("base"), ExprPrecedence.POSTFIX);
                out.append('[');
                expr(expr.child("index"));
                out.append(']');
                break;
            case EXPR_BLOCK:
                if (expr.<Boolean>leaf("unsafety")) {
                    out.append("unsafe ");
                }
                block(expr.child("block"));
                break;
            case EXPR_IF:
                out.append("if ");
                cond(expr.child("cond"));
                out.append(' ');
                block(expr.child("then"));
                Node otherwise = expr.child("otherwise");
                if (otherwise != null) {
                    out.append(" else ");
                    expr(otherwise);
                }
                break;
            case EXPR_WHILE:
                out.append("while ");
                cond(expr.child("cond"));
                out.append(' ');
                block(expr.child("body"));
                break;
            case EXPR_RETURN:
                out.append("return");
                Node value = expr.child("value");
                if (value != null) {
                    out.append(' ');
                    expr(value);
                }
                break;
            case EXPR_STRUCT:
                out.append(expr.<String>leaf("path"));
                List<Node> fields = expr.list("fields");
                if (fields.isEmpty()) {
                    out.append(" {}");
                } else {
                    out.append(" { ");
                    commaSeparated(fields);
                    out.append(" }");
                }
                break;
            case EXPR_TUPLE:
                tuple(expr.list("elems"));
                break;
            default:
                throw new IllegalArgumentException("not an expression: " + expr.variant());
        }
    }

    private void operand(Node expr, int minPrec) {
        if (ExprPrecedence.of(expr) < minPrec) {
            parenthesized(expr);
        } else {
            expr(expr);
        }
    }

    private void cond(Node expr) {
        if (ExprPrecedence.containsExteriorStructLit(expr)) {
            parenthesized(expr);
        } else {
            expr(expr);
        }
    }

    private void parenthesized(Node expr) {
        out.append('(');
        expr(expr);
        out.append(')');
    }

    // ===== Patterns and types =====

    private void pat(Node pat) {
        switch (pat.variant()) {
            case PAT_IDENT:
                if (pat.<Boolean>leaf("mutability")) {
                    out.append("mut ");
                }
                out.append(pat.<String>leaf("name"));
                break;
            case PAT_WILD:
                out.append('_');
                break;
            case PAT_TUPLE:
                tuple(pat.list("elems"));
                break;
            default:
                throw new IllegalArgumentException("not a pattern: " + pat.variant());
        }
    }

    private void ty(Node ty) {
        switch (ty.variant()) {
            case TY_PATH:
                out.append(ty.<String>leaf("path"));
                break;
            case TY_REF:
                out.append(ty.<Boolean>leaf("mutability") ? "&mut " : "&");
                ty(ty.child("inner"));
                break;
            case TY_PTR:
                out.append(ty.<Boolean>leaf("mutability") ? "*mut " : "*const ");
                ty(ty.child("inner"));
                break;
            case TY_TUPLE:
                tuple(ty.list("elems"));
                break;
            default:
                throw new IllegalArgumentException("not a type: " + ty.variant());
        }
    }

    private void tuple(List<Node> elems) {
        out.append('(');
        commaSeparated(elems);
        if (elems.size() == 1) {
            out.append(',');
        }
        out.append(')');
    }

    private void commaSeparated(List<Node> nodes) {
        for (int i = 0; i < nodes.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            node(nodes.get(i));
        }
    }

    private void newline() {
        out.append('\n').append(baseIndent);
        for (int i = 0; i < level; i++) {
            out.append(INDENT);
        }
    }
}
