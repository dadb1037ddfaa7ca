package org.splice;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.splice.syntax.Node;
import org.splice.syntax.NodeKind;
import org.splice.syntax.Session;

final class SerializersTest {

    private final Session session = new Session();

    @Test
    void lispFormIsOneLineWithLeaves() {
        Node e = session.parse(NodeKind.EXPR, "f(\"a\")");
        String lisp = Serializers.toLisp(e);
        assertEquals("(EXPR_CALL#" + e.id() + " (EXPR_PATH#" + e.child("callee").id() + " path=\"f\")"
                + " (EXPR_LIT#" + e.list("args").get(0).id() + " value=\"\\\"a\\\"\"))", lisp);
    }

    @Test
    void treeFormIndentsChildrenAndShowsSpans() {
        Node e = session.parse(NodeKind.EXPR, "-x");
        String tree = Serializers.toTreeSitterString(e);
        String[] lines = tree.split("\n");
        assertEquals(3, lines.length);
        assertTrue(lines[0].startsWith("(EXPR_UNARY#"));
        assertTrue(lines[0].endsWith("op=\"-\" [0..2]"), lines[0]);
        assertTrue(lines[1].startsWith("  (EXPR_PATH#"));
        assertTrue(lines[1].endsWith("path=\"x\" [1..2])"), lines[1]);
        assertEquals(")", lines[2]);
    }

    @Test
    void falseFlagsAreLeftOut() {
        Node item = session.parse(NodeKind.ITEM, "unsafe fn f() {}");
        String lisp = Serializers.toLisp(item);
        assertTrue(lisp.contains(" unsafety "), lisp);
        assertFalse(lisp.contains("constness"), lisp);
        assertTrue(lisp.contains("name=\"f\""), lisp);
    }
}
