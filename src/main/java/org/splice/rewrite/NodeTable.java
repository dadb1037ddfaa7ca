package org.splice.rewrite;

import org.splice.syntax.Node;
import org.splice.syntax.NodeKind;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Old-tree nodes of every splice-point kind, keyed by identifier. Built once per reconciliation
 * pass and read-only afterwards; identifiers are only unique within one old tree, so a table must
 * not be reused across passes.
 */
public final class NodeTable {

    private final Map<NodeKind, Map<Integer, Node>> tables = new EnumMap<>(NodeKind.class);

    private NodeTable() {
    }

    /**
     * Indexes every splice-point node under {@code oldRoot}.
     *
     * @throws IllegalStateException if two nodes of the same kind share an identifier
     */
    public static NodeTable build(Node oldRoot) {
        NodeTable table = new NodeTable();
        for (Node node : oldRoot.preOrder()) {
            if (!node.kind().isSplicePoint() || node.id() == Node.DUMMY_ID) {
                continue;
            }
            Node previous = table.tables
                    .computeIfAbsent(node.kind(), k -> new HashMap<>())
                    .putIfAbsent(node.id(), node);
            if (previous != null) {
                throw new IllegalStateException("duplicate " + node.kind() + " id " + node.id()
                        + " in old tree: " + previous + " and " + node);
            }
        }
        return table;
    }

    public Node get(NodeKind kind, int id) {
        Map<Integer, Node> table = tables.get(kind);
        return table == null ? null : table.get(id);
    }

    public int size(NodeKind kind) {
        Map<Integer, Node> table = tables.get(kind);
        return table == null ? 0 : table.size();
    }
}
