package org.splice.match;

import com.github.gumtreediff.matchers.MappingStore;
import com.github.gumtreediff.matchers.Matcher;
import com.github.gumtreediff.matchers.Matchers;
import com.github.gumtreediff.tree.DefaultTree;
import com.github.gumtreediff.tree.Tree;
import com.github.gumtreediff.tree.TypeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.splice.syntax.Node;
import org.splice.syntax.Slot;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Identifier assignment for a new tree parsed from edited text. The rewriter recognises unchanged
 * nodes only by identifier, so a tree parsed from scratch must first be told which of its nodes
 * are old ones. GumTree's matcher decides: every new node mapped to an old node of the same kind
 * takes over the old identifier, the rest keep the fresh identifiers the parser gave them.
 */
public final class TreeMatcher {

    private static final Logger logger = LoggerFactory.getLogger(TreeMatcher.class);

    private TreeMatcher() {
    }

    /**
     * Copies old identifiers onto the matching nodes of {@code newRoot}. Both trees must come from
     * the same parse session, so that unmatched new identifiers never collide with old ones.
     *
     * @return the number of new nodes that took an old identifier
     */
    public static int assignIds(Node oldRoot, Node newRoot) {
        Map<Tree, Node> oldNodes = new IdentityHashMap<>();
        Map<Tree, Node> newNodes = new IdentityHashMap<>();
        Tree src = toGumTree(oldRoot, oldNodes);
        Tree dst = toGumTree(newRoot, newNodes);

        Matcher matcher = Matchers.getInstance().getMatcher();
        MappingStore mappings = matcher.match(src, dst);

        int mapped = 0;
        for (Map.Entry<Tree, Node> entry : newNodes.entrySet()) {
            Tree match = mappings.getSrcForDst(entry.getKey());
            if (match == null) {
                continue;
            }
            Node oldNode = oldNodes.get(match);
            Node newNode = entry.getValue();
            if (oldNode.kind() == newNode.kind()) {
                newNode.setId(oldNode.id());
                mapped++;
            }
        }
        logger.debug("matched {} of {} new nodes against {} old nodes", mapped, newNodes.size(), oldNodes.size());
        return mapped;
    }

    /** Converts a syntax tree to a GumTree tree: type from the variant, label from the leaves. */
    static Tree toGumTree(Node node, Map<Tree, Node> index) {
        Tree tree = new DefaultTree(TypeSet.type(node.variant().name()), label(node));
        if (node.span().file() != null) {
            tree.setPos(node.span().lo());
            tree.setLength(node.span().length());
        }
        index.put(tree, node);
        for (Node child : node.children()) {
            tree.addChild(toGumTree(child, index));
        }
        return tree;
    }

    static String label(Node node) {
        StringJoiner label = new StringJoiner(" ");
        for (Slot slot : node.variant().slots()) {
            if (!slot.type.isLeaf()) {
                continue;
            }
            Object value = node.get(slot);
            if (value instanceof Boolean) {
                if ((Boolean) value) {
                    label.add(slot.name);
                }
            } else if (value != null && !value.toString().isEmpty()) {
                label.add(value.toString());
            }
        }
        return label.toString();
    }
}
