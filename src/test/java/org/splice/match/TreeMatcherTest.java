package org.splice.match;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.splice.syntax.Node;
import org.splice.syntax.NodeKind;
import org.splice.syntax.Session;

import com.github.gumtreediff.tree.Tree;

final class TreeMatcherTest {

    private final Session session = new Session();

    private static Set<Integer> ids(Node root) {
        Set<Integer> ids = new HashSet<>();
        for (Node node : root.preOrder()) {
            ids.add(node.id());
        }
        return ids;
    }

    @Test
    void identicalTreesTakeOverEveryId() {
        String text = "fn f(x: i32) -> i32 {\n    let y = x * 2;\n    y + 1\n}\n";
        Node oldTree = session.parseCrate("old.rs", text);
        Node newTree = session.parseCrate("new.rs", text);

        int mapped = TreeMatcher.assignIds(oldTree, newTree);
        List<Node> oldNodes = oldTree.preOrder();
        List<Node> newNodes = newTree.preOrder();
        assertEquals(oldNodes.size(), mapped);
        for (int i = 0; i < oldNodes.size(); i++) {
            assertEquals(oldNodes.get(i).id(), newNodes.get(i).id(), "node " + newNodes.get(i));
        }
    }

    @Test
    void insertedStatementKeepsAFreshId() {
        Node oldTree = session.parseCrate("old.rs", "fn f() {\n    alpha(1);\n    beta(2);\n}\n");
        Node newTree = session.parseCrate("new.rs",
                "fn f() {\n    alpha(1);\n    gamma(3);\n    beta(2);\n}\n");
        TreeMatcher.assignIds(oldTree, newTree);

        List<Node> oldStmts = oldTree.list("items").get(0).child("body").list("stmts");
        List<Node> newStmts = newTree.list("items").get(0).child("body").list("stmts");
        assertEquals(oldStmts.get(0).id(), newStmts.get(0).id());
        assertEquals(oldStmts.get(1).id(), newStmts.get(2).id());
        assertFalse(ids(oldTree).contains(newStmts.get(1).id()), "unmatched node must not reuse an old id");
    }

    @Test
    void labelsCarryLeafValues() {
        Node fn = session.parse(NodeKind.ITEM, "pub unsafe fn run() {}");
        assertEquals("pub unsafety run", TreeMatcher.label(fn));
        assertEquals("+", TreeMatcher.label(session.parse(NodeKind.EXPR, "a + b")));
        assertEquals("", TreeMatcher.label(session.parse(NodeKind.BLOCK, "{}")));
    }

    @Test
    void gumTreeMirrorsTheSyntaxTree() {
        Node expr = session.parse(NodeKind.EXPR, "f(a, b)");
        IdentityHashMap<Tree, Node> index = new IdentityHashMap<>();
        Tree tree = TreeMatcher.toGumTree(expr, index);
        assertEquals("EXPR_CALL", tree.getType().name);
        assertEquals(3, tree.getChildren().size());
        assertEquals(4, index.size());
        assertEquals(0, tree.getPos());
        assertEquals(7, tree.getLength());
        assertSame(expr, index.get(tree));
    }
}
