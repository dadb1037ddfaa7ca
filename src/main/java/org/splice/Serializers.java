package org.splice;

import org.splice.syntax.Node;
import org.splice.syntax.Slot;

public class Serializers {

    /** ---------- Utilities shared by both serializers ---------- */
    private static String escapeForSexp(String s) {
        if (s == null) return "";
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /** Leaf values in slot order, as {@code name="value"} atoms; false flags are left out. */
    private static String leaves(Node node) {
        StringBuilder sb = new StringBuilder();
        for (Slot slot : node.variant().slots()) {
            if (!slot.type.isLeaf()) continue;
            Object value = node.get(slot);
            if (value == null || Boolean.FALSE.equals(value) || value.toString().isEmpty()) continue;
            sb.append(' ').append(slot.name);
            if (!(value instanceof Boolean)) {
                sb.append("=\"").append(escapeForSexp(value.toString())).append('"');
            }
        }
        return sb.toString();
    }

    private static String head(Node node) {
        return node.variant() + "#" + node.id();
    }

    /** ---------- 1) Lisp S-expression serializer ----------
     * Format:
     *   (VARIANT#id leaf="value" child1 child2 ...)
     * - single-line, compact
     */
    public static String toLisp(Node root) {
        StringBuilder sb = new StringBuilder(256);
        toLispRec(root, sb);
        return sb.toString();
    }

    private static void toLispRec(Node n, StringBuilder sb) {
        sb.append('(').append(head(n)).append(leaves(n));
        for (Node c : n.children()) {
            sb.append(' ');
            toLispRec(c, sb);
        }
        sb.append(')');
    }

    /** ---------- 2) Tree-sitter–style pretty serializer ----------
     * Format:
     *   (VARIANT#id leaf="value" [lo..hi]
     *     (CHILD#id ...))
     * - one node per line with indentation
     * - byte range of the node's span after the leaves
     */
    public static String toTreeSitterString(Node root) {
        StringBuilder sb = new StringBuilder(256);
        toTsRec(root, 0, sb);
        return sb.toString();
    }

    private static void toTsRec(Node n, int depth, StringBuilder sb) {
        indent(sb, depth).append('(').append(head(n)).append(leaves(n));
        if (!n.span().isDummy()) {
            sb.append(" [").append(n.span().lo()).append("..").append(n.span().hi()).append(']');
        }
        if (n.children().isEmpty()) {
            sb.append(')').append('\n');
            return;
        }
        sb.append('\n');
        for (Node c : n.children()) {
            toTsRec(c, depth + 1, sb);
        }
        indent(sb, depth).append(')').append('\n');
    }

    private static StringBuilder indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) sb.append("  ");
        return sb;
    }
}
