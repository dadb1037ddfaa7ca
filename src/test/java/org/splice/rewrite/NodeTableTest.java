package org.splice.rewrite;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.splice.syntax.Node;
import org.splice.syntax.NodeKind;
import org.splice.syntax.Session;

final class NodeTableTest {

    private final Session session = new Session();

    @Test
    void indexesOnlySplicePointKinds() {
        Node root = session.parseCrate("lib.rs", "fn f(x: i32) { let y = x + 1; g(y); }");
        NodeTable table = NodeTable.build(root);
        assertEquals(1, table.size(NodeKind.ITEM));
        assertEquals(2, table.size(NodeKind.STMT));
        assertEquals(6, table.size(NodeKind.EXPR));
        assertEquals(0, table.size(NodeKind.BLOCK));
        assertEquals(0, table.size(NodeKind.PARAM));
        assertEquals(2, table.size(NodeKind.PAT));
        assertEquals(1, table.size(NodeKind.TY));
    }

    @Test
    void duplicateIdsAreRejected() {
        Node root = session.parseCrate("lib.rs", "fn f() { a(); b(); }");
        List<Node> stmts = root.list("items").get(0).child("body").list("stmts");
        stmts.get(1).setId(stmts.get(0).id());
        assertThrows(IllegalStateException.class, () -> NodeTable.build(root));
    }

    @Test
    void missingIdsAreAbsent() {
        Node root = session.parseCrate("lib.rs", "fn f() {}");
        NodeTable table = NodeTable.build(root);
        assertNull(table.get(NodeKind.ITEM, 12345));
        assertNull(table.get(NodeKind.TY, root.id()));
    }
}
