package org.splice.syntax;

import static org.splice.syntax.SlotType.HEADER;
import static org.splice.syntax.SlotType.LEAF;
import static org.splice.syntax.SlotType.LIST;
import static org.splice.syntax.SlotType.NODE;
import static org.splice.syntax.SlotType.OPTIONAL;
import static org.splice.syntax.SlotType.SEQUENCE;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One variant per syntactic construct, each with its kind and its ordered slot table. The slot
 * table is the schema the rewriter walks; nothing else about a variant's shape is hard-coded.
 */
public enum Variant {
    CRATE(NodeKind.CRATE, "items", SEQUENCE),

    ITEM_FN(NodeKind.ITEM, "attrs", SEQUENCE, "vis", HEADER, "constness", HEADER,
            "unsafety", HEADER, "abi", HEADER, "name", HEADER,
            "params", LIST, "ret", OPTIONAL, "body", NODE),
    ITEM_STRUCT(NodeKind.ITEM, "attrs", SEQUENCE, "vis", HEADER, "name", HEADER, "fields", LIST),
    ITEM_STATIC(NodeKind.ITEM, "attrs", SEQUENCE, "vis", HEADER, "mutability", LEAF,
            "name", HEADER, "ty", NODE, "value", NODE),
    ITEM_CONST(NodeKind.ITEM, "attrs", SEQUENCE, "vis", HEADER, "name", HEADER,
            "ty", NODE, "value", NODE),
    ITEM_MOD(NodeKind.ITEM, "attrs", SEQUENCE, "vis", HEADER, "name", HEADER, "items", SEQUENCE),
    ITEM_TYPE(NodeKind.ITEM, "attrs", SEQUENCE, "vis", HEADER, "name", HEADER, "ty", NODE),
    ITEM_FOREIGN_MOD(NodeKind.ITEM, "attrs", SEQUENCE, "abi", LEAF, "items", SEQUENCE),

    FOREIGN_FN(NodeKind.FOREIGN_ITEM, "attrs", SEQUENCE, "vis", LEAF, "name", LEAF,
            "params", LIST, "ret", OPTIONAL),
    FOREIGN_STATIC(NodeKind.FOREIGN_ITEM, "attrs", SEQUENCE, "vis", LEAF, "mutability", LEAF,
            "name", LEAF, "ty", NODE),

    ATTR(NodeKind.ATTR, "meta", LEAF),

    STMT_LOCAL(NodeKind.STMT, "pat", NODE, "ty", OPTIONAL, "init", OPTIONAL),
    STMT_SEMI(NodeKind.STMT, "expr", NODE),
    STMT_EXPR(NodeKind.STMT, "expr", NODE),
    STMT_ITEM(NodeKind.STMT, "item", NODE),

    EXPR_LIT(NodeKind.EXPR, "value", LEAF),
    EXPR_PATH(NodeKind.EXPR, "path", LEAF),
    EXPR_BINARY(NodeKind.EXPR, "op", LEAF, "lhs", NODE, "rhs", NODE),
    EXPR_UNARY(NodeKind.EXPR, "op", LEAF, "operand", NODE),
    EXPR_ADDR_OF(NodeKind.EXPR, "mutability", LEAF, "operand", NODE),
    EXPR_ASSIGN(NodeKind.EXPR, "lhs", NODE, "rhs", NODE),
    EXPR_CAST(NodeKind.EXPR, "expr", NODE, "ty", NODE),
    EXPR_CALL(NodeKind.EXPR, "callee", NODE, "args", LIST),
    EXPR_METHOD_CALL(NodeKind.EXPR, "receiver", NODE, "method", LEAF, "args", LIST),
    EXPR_FIELD(NodeKind.EXPR, "base", NODE, "field", LEAF),
    EXPR_INDEX(NodeKind.EXPR, "base", NODE, "index", NODE),
    EXPR_BLOCK(NodeKind.EXPR, "unsafety", LEAF, "block", NODE),
    EXPR_IF(NodeKind.EXPR, "cond", NODE, "then", NODE, "otherwise", OPTIONAL),
    EXPR_WHILE(NodeKind.EXPR, "cond", NODE, "body", NODE),
    EXPR_RETURN(NodeKind.EXPR, "value", OPTIONAL),
    EXPR_STRUCT(NodeKind.EXPR, "path", LEAF, "fields", LIST),
    EXPR_TUPLE(NodeKind.EXPR, "elems", LIST),

    PAT_IDENT(NodeKind.PAT, "mutability", LEAF, "name", LEAF),
    PAT_WILD(NodeKind.PAT),
    PAT_TUPLE(NodeKind.PAT, "elems", LIST),

    TY_PATH(NodeKind.TY, "path", LEAF),
    TY_REF(NodeKind.TY, "mutability", LEAF, "inner", NODE),
    TY_PTR(NodeKind.TY, "mutability", LEAF, "inner", NODE),
    TY_TUPLE(NodeKind.TY, "elems", LIST),

    BLOCK(NodeKind.BLOCK, "stmts", SEQUENCE),
    PARAM(NodeKind.PARAM, "pat", NODE, "ty", NODE),
    FIELD_DEF(NodeKind.FIELD_DEF, "vis", LEAF, "name", LEAF, "ty", NODE),
    FIELD_INIT(NodeKind.FIELD_INIT, "name", LEAF, "expr", NODE);

    private final NodeKind kind;
    private final Slot[] slots;

    Variant(NodeKind kind, Object... slots) {
        this.kind = kind;
        this.slots = Slot.table(slots);
    }

    public NodeKind kind() {
        return kind;
    }

    public List<Slot> slots() {
        return Collections.unmodifiableList(Arrays.asList(slots));
    }

    public int arity() {
        return slots.length;
    }

    public Slot slot(String name) {
        for (Slot slot : slots) {
            if (slot.name.equals(name)) {
                return slot;
            }
        }
        throw new IllegalArgumentException(this + " has no slot '" + name + "'");
    }
}
