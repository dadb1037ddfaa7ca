package org.splice.rewrite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.splice.syntax.Node;
import org.splice.syntax.Printer;
import org.splice.syntax.Slot;
import org.splice.syntax.SourceFile;
import org.splice.syntax.SourceMap;
import org.splice.syntax.Span;

import java.util.List;
import java.util.Objects;

/**
 * The two-mode reconciliation walk.
 *
 * <p>In recycled mode the output for a node is its original text, and edits record where the new
 * tree departs from it. When a node cannot be reconciled child by child, its original text is
 * replaced by freshly printed text for the new node. In fresh mode the output is that printed
 * text, and edits record where a node copied from the old tree can be reverted to its original
 * text. Both walks are driven by the slot tables of {@link org.splice.syntax.Variant}; items,
 * expressions and sequences get extra handling.
 */
final class SpliceEngine {

    private static final Logger logger = LoggerFactory.getLogger(SpliceEngine.class);

    private final RewriteCtxt rcx;
    private final SequenceRewriter sequences;
    private final HeaderRecovery headers;

    SpliceEngine(RewriteCtxt rcx) {
        this.rcx = rcx;
        this.sequences = new SequenceRewriter(this, rcx);
        this.headers = new HeaderRecovery(this, rcx);
    }

    // ===== Recycled mode =====

    /**
     * Reconciles {@code newNode} against {@code oldNode}, whose original text is the default
     * output. Returns true if the nodes could not be reconciled; the caller must then rewind
     * whatever was recorded. Splice points never fail: they fall back to fresh text instead.
     */
    boolean rewriteRecycled(Node newNode, Node oldNode) {
        if (!newNode.kind().isSplicePoint()) {
            return defaultRewriteRecycled(newNode, oldNode);
        }

        RewriteCtxt.Mark mark = rcx.mark();
        if (!defaultRewriteRecycled(newNode, oldNode)) {
            return false;
        }
        rcx.rewind(mark);

        if (headers.applies(newNode)) {
            mark = rcx.mark();
            if (!headers.recover(newNode, oldNode)) {
                return false;
            }
            rcx.rewind(mark);
        }

        spliceRecycled(newNode, oldNode);
        return false;
    }

    boolean defaultRewriteRecycled(Node newNode, Node oldNode) {
        if (newNode.variant() != oldNode.variant()) {
            return true;
        }
        for (Slot slot : newNode.variant().slots()) {
            if (rewriteSlotRecycled(newNode, oldNode, slot)) {
                return true;
            }
        }
        return false;
    }

    boolean rewriteSlotRecycled(Node newNode, Node oldNode, Slot slot) {
        Object newValue = newNode.get(slot);
        Object oldValue = oldNode.get(slot);
        ExprPrec prec = Adjustments.requirementFor(newNode, slot, rcx.exprPrec());
        switch (slot.type) {
            case LEAF:
            case HEADER:
                return !Objects.equals(newValue, oldValue);
            case OPTIONAL:
                if (newValue == null || oldValue == null) {
                    return newValue != oldValue;
                }
                return rewriteChildRecycled((Node) newValue, (Node) oldValue, prec);
            case NODE:
                return rewriteChildRecycled((Node) newValue, (Node) oldValue, prec);
            case LIST:
                return sequences.rewritePositional(newNode.list(slot.name), oldNode.list(slot.name), prec);
            case SEQUENCE:
                return sequences.rewriteAligned(newNode.list(slot.name), oldNode.list(slot.name));
            default:
                throw new IllegalStateException("unknown slot type " + slot.type);
        }
    }

    boolean rewriteChildRecycled(Node newChild, Node oldChild, ExprPrec prec) {
        ExprPrec saved = rcx.replaceExprPrec(prec);
        try {
            return rewriteRecycled(newChild, oldChild);
        } finally {
            rcx.replaceExprPrec(saved);
        }
    }

    // ===== Fresh mode =====

    /**
     * Walks {@code newNode} together with {@code reparsed}, the node obtained by parsing its
     * printed text, reverting copied subtrees to their original text where possible.
     *
     * @throws IllegalStateException if the two trees differ in shape
     */
    void rewriteFresh(Node newNode, Node reparsed) {
        if (newNode.kind().isSplicePoint() && spliceFresh(newNode, reparsed)) {
            return;
        }
        defaultRewriteFresh(newNode, reparsed);
    }

    private void defaultRewriteFresh(Node newNode, Node reparsed) {
        if (newNode.variant() != reparsed.variant()) {
            throw new IllegalStateException("new and reparsed trees differ: " + newNode.variant()
                    + " vs " + reparsed.variant() + " at " + SourceMap.describe(reparsed.span()));
        }
        for (Slot slot : newNode.variant().slots()) {
            ExprPrec prec = Adjustments.requirementFor(newNode, slot, rcx.exprPrec());
            switch (slot.type) {
                case NODE:
                case OPTIONAL:
                    Node newChild = newNode.child(slot.name);
                    Node reparsedChild = reparsed.child(slot.name);
                    if (newChild == null && reparsedChild == null) {
                        break;
                    }
                    if (newChild == null || reparsedChild == null) {
                        throw new IllegalStateException("new and reparsed trees differ in presence of "
                                + newNode.variant() + "." + slot.name);
                    }
                    rewriteChildFresh(newChild, reparsedChild, prec);
                    break;
                case LIST:
                case SEQUENCE:
                    List<Node> newList = newNode.list(slot.name);
                    List<Node> reparsedList = reparsed.list(slot.name);
                    if (newList.size() != reparsedList.size()) {
                        throw new IllegalStateException("new and reparsed trees differ in length of "
                                + newNode.variant() + "." + slot.name + ": " + newList.size()
                                + " vs " + reparsedList.size());
                    }
                    for (int i = 0; i < newList.size(); i++) {
                        rewriteChildFresh(newList.get(i), reparsedList.get(i), prec);
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private void rewriteChildFresh(Node newChild, Node reparsedChild, ExprPrec prec) {
        ExprPrec saved = rcx.replaceExprPrec(prec);
        try {
            rewriteFresh(newChild, reparsedChild);
        } finally {
            rcx.replaceExprPrec(saved);
        }
    }

    // ===== Mode switches =====

    /**
     * Switches from recycled to fresh mode: the original text of {@code oldNode} is replaced by
     * printed text for {@code newNode}. Gives up, recording nothing, if that text is not
     * rewritable.
     */
    void spliceRecycled(Node newNode, Node oldNode) {
        if (!oldNode.span().isRewritable()) {
            logger.warn("can't splice in fresh text for a non-rewritable node at {}", oldNode.span());
            rcx.abandon(oldNode.span());
            return;
        }
        spliceRecycledSpan(newNode, oldNode.span(), "", "");
    }

    /**
     * Replaces the text at {@code oldSpan} with printed text for {@code newNode}, surrounded by
     * {@code leading} and {@code trailing}, then reverts what it can inside the printed text.
     */
    void spliceRecycledSpan(Node newNode, Span oldSpan, String leading, String trailing) {
        String indent = rcx.options().layoutAware() ? Layout.lineIndent(oldSpan) : "";
        String printed = Printer.print(newNode, indent);
        SourceFile fresh = rcx.session().sourceMap().addFreshFile(leading + printed + trailing);
        Node reparsed = rcx.session().parse(newNode.kind(), fresh);
        Span replacement = fresh.fullSpan();

        if (!oldSpan.isEmpty()) {
            logger.debug("REWRITE {}", SourceMap.describe(oldSpan));
            logger.debug("   INTO {}", SourceMap.describe(replacement));
        } else {
            logger.debug("INSERT AT {}", SourceMap.describe(oldSpan));
            logger.debug("     TEXT {}", SourceMap.describe(replacement));
        }

        List<TextRewrite> saved = rcx.enterNested();
        Span oldFreshStart = rcx.replaceFreshStart(newNode.span());
        try {
            rewriteFresh(newNode, reparsed);
        } finally {
            rcx.replaceFreshStart(oldFreshStart);
        }
        List<TextRewrite> nested = rcx.exitNested(saved);

        TextAdjust adjust = Adjustments.adjustmentFor(newNode, rcx.exprPrec());
        rcx.record(oldSpan, replacement, nested, adjust);
    }

    /**
     * Switches from fresh back to recycled mode: the printed text of {@code reparsed} is replaced
     * by the original text of the old node {@code newNode} was copied from. Returns false, having
     * recorded nothing, if there is no such node or its text cannot be used.
     */
    boolean spliceFresh(Node newNode, Node reparsed) {
        // Reverting the node that opened this fresh subtree would undo the splice and start over.
        if (newNode.span().equals(rcx.freshStart())) {
            return false;
        }
        Node oldNode = rcx.oldNode(newNode.kind(), newNode.id());
        if (oldNode == null) {
            return false;
        }
        if (!oldNode.span().isRewritable() || oldNode.span().file().isMacroExpansion()) {
            return false;
        }

        logger.debug("REVERT {}", SourceMap.describe(reparsed.span()));
        logger.debug("    TO {}", SourceMap.describe(oldNode.span()));

        List<TextRewrite> saved = rcx.enterNested();
        RewriteCtxt.Mark mark = rcx.mark();
        boolean failed = rewriteRecycled(newNode, oldNode);
        if (failed) {
            rcx.rewind(mark);
            rcx.exitNested(saved);
            return false;
        }
        List<TextRewrite> nested = rcx.exitNested(saved);

        TextAdjust adjust = Adjustments.adjustmentFor(newNode, rcx.exprPrec());
        rcx.record(reparsed.span(), oldNode.span(), nested, adjust);
        return true;
    }
}
