package org.splice.syntax;

/**
 * The closed set of node kinds. Splice points are the kinds at which rewriting may switch between
 * reusing original text and printing fresh text; each has its own table of old nodes.
 */
public enum NodeKind {
    CRATE(true),
    ITEM(true),
    FOREIGN_ITEM(true),
    ATTR(false),
    STMT(true),
    EXPR(true),
    PAT(true),
    TY(true),
    BLOCK(false),
    PARAM(false),
    FIELD_DEF(false),
    FIELD_INIT(false);

    private final boolean splicePoint;

    NodeKind(boolean splicePoint) {
        this.splicePoint = splicePoint;
    }

    public boolean isSplicePoint() {
        return splicePoint;
    }
}
