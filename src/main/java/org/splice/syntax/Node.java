package org.splice.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * A syntax tree node: a {@link Variant}, a stable identifier, a span, and one value per slot of
 * the variant. Nodes are mutable so that transformations can build a new tree by copying the old
 * one and editing it in place; {@link #deepCopy()} keeps identifiers and spans.
 */
public final class Node {

    /** Identifier of nodes built outside any parse. */
    public static final int DUMMY_ID = -1;

    private final Variant variant;
    private int id;
    private Span span;
    private final Object[] values;
    private List<Token> tokens;

    public Node(Variant variant, int id, Span span, Object... values) {
        this.variant = Objects.requireNonNull(variant, "variant");
        if (values.length != variant.arity()) {
            throw new IllegalArgumentException(variant + " expects " + variant.arity()
                    + " values, got " + values.length);
        }
        this.id = id;
        this.span = Objects.requireNonNull(span, "span");
        this.values = new Object[values.length];
        for (Slot slot : variant.slots()) {
            set(slot, values[slot.index]);
        }
    }

    public Variant variant() {
        return variant;
    }

    public NodeKind kind() {
        return variant.kind();
    }

    public int id() {
        return id;
    }

    public void setId(int id) {
        this.id = id;
    }

    public Span span() {
        return span;
    }

    public void setSpan(Span span) {
        this.span = Objects.requireNonNull(span, "span");
    }

    /** The tokens this node was parsed from, or {@code null} if they were not retained. */
    public List<Token> tokens() {
        return tokens;
    }

    public void setTokens(List<Token> tokens) {
        this.tokens = tokens == null ? null : List.copyOf(tokens);
    }

    public Object get(Slot slot) {
        return values[slot.index];
    }

    @SuppressWarnings("unchecked")
    public <T> T leaf(String name) {
        return (T) values[variant.slot(name).index];
    }

    public Node child(String name) {
        return (Node) values[variant.slot(name).index];
    }

    @SuppressWarnings("unchecked")
    public List<Node> list(String name) {
        return (List<Node>) values[variant.slot(name).index];
    }

    public void set(String name, Object value) {
        set(variant.slot(name), value);
    }

    public void set(Slot slot, Object value) {
        switch (slot.type) {
            case NODE:
                values[slot.index] = Objects.requireNonNull(value, slot.name);
                break;
            case LIST:
            case SEQUENCE:
                List<Node> list = new ArrayList<>();
                if (value != null) {
                    for (Object element : (List<?>) value) {
                        list.add((Node) Objects.requireNonNull(element, slot.name));
                    }
                }
                values[slot.index] = list;
                break;
            default:
                values[slot.index] = value;
                break;
        }
    }

    /** Direct child nodes in slot order. */
    public List<Node> children() {
        List<Node> result = new ArrayList<>();
        for (Slot slot : variant.slots()) {
            Object value = values[slot.index];
            if (value instanceof Node) {
                result.add((Node) value);
            } else if (slot.type.isList()) {
                result.addAll(list(slot.name));
            }
        }
        return result;
    }

    public Node deepCopy() {
        Object[] copied = new Object[values.length];
        for (Slot slot : variant.slots()) {
            Object value = values[slot.index];
            if (value instanceof Node) {
                copied[slot.index] = ((Node) value).deepCopy();
            } else if (slot.type.isList()) {
                List<Node> list = new ArrayList<>();
                for (Node element : list(slot.name)) {
                    list.add(element.deepCopy());
                }
                copied[slot.index] = list;
            } else {
                copied[slot.index] = value;
            }
        }
        Node copy = new Node(variant, id, span, copied);
        copy.tokens = tokens;
        return copy;
    }

    /**
     * True if {@code other} has the same variants and leaf values all the way down. Identifiers,
     * spans and tokens are ignored.
     */
    public boolean sameStructure(Node other) {
        if (variant != other.variant) {
            return false;
        }
        for (Slot slot : variant.slots()) {
            Object mine = values[slot.index];
            Object theirs = other.values[slot.index];
            if (slot.type.isLeaf()) {
                if (!Objects.equals(mine, theirs)) {
                    return false;
                }
            } else if (slot.type.isList()) {
                List<Node> myList = list(slot.name);
                List<Node> theirList = other.list(slot.name);
                if (myList.size() != theirList.size()) {
                    return false;
                }
                for (int i = 0; i < myList.size(); i++) {
                    if (!myList.get(i).sameStructure(theirList.get(i))) {
                        return false;
                    }
                }
            } else if (mine == null || theirs == null) {
                if (mine != theirs) {
                    return false;
                }
            } else if (!((Node) mine).sameStructure((Node) theirs)) {
                return false;
            }
        }
        return true;
    }

    public List<Node> preOrder() {
        List<Node> result = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Node current = stack.pop();
            result.add(current);
            List<Node> children = current.children();
            ListIterator<Node> iterator = children.listIterator(children.size());
            while (iterator.hasPrevious()) {
                stack.push(iterator.previous());
            }
        }
        return result;
    }

    @Override
    public String toString() {
        return variant + "#" + id + " " + span;
    }
}
