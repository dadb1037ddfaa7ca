package org.splice.syntax;

public enum SlotType {
    /** A value compared with {@code equals}: identifiers, operators, literals, flags. */
    LEAF,
    /** A leaf of an item header (visibility, qualifiers, name). */
    HEADER,
    NODE,
    /** A node or {@code null}. */
    OPTIONAL,
    /** A list reconciled position by position. */
    LIST,
    /** A list whose elements are aligned by node identifier. */
    SEQUENCE;

    public boolean isLeaf() {
        return this == LEAF || this == HEADER;
    }

    public boolean isList() {
        return this == LIST || this == SEQUENCE;
    }
}
