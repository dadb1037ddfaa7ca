package org.splice.rewrite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.splice.syntax.ExprPrecedence;
import org.splice.syntax.Node;
import org.splice.syntax.SourceMap;
import org.splice.syntax.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Reconciles list-valued children. Item, statement and attribute lists are aligned by node
 * identifier, so that inserting or deleting one element edits only that element; other lists are
 * reconciled position by position.
 */
final class SequenceRewriter {

    private static final Logger logger = LoggerFactory.getLogger(SequenceRewriter.class);

    private final SpliceEngine engine;
    private final RewriteCtxt rcx;

    SequenceRewriter(SpliceEngine engine, RewriteCtxt rcx) {
        this.engine = engine;
        this.rcx = rcx;
    }

    /** Pairs elements by position. A length change is a failure. */
    boolean rewritePositional(List<Node> newList, List<Node> oldList, ExprPrec prec) {
        if (newList.size() != oldList.size()) {
            return true;
        }
        for (int i = 0; i < newList.size(); i++) {
            if (engine.rewriteChildRecycled(newList.get(i), oldList.get(i), prec)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Aligns the two lists by identifier and walks the edit script: kept elements are reconciled
     * recursively, deleted ones are cut out, inserted ones are spliced in fresh next to a
     * surviving neighbour, and replaced ones are spliced in fresh over the old element.
     */
    boolean rewriteAligned(List<Node> newList, List<Node> oldList) {
        ExprPrec reset = ExprPrec.normal(ExprPrecedence.RESET);
        if (!rcx.options().sequenceAlignment()) {
            return rewritePositional(newList, oldList, reset);
        }
        if (oldList.isEmpty() && !newList.isEmpty()) {
            // No old span to anchor the insertions to.
            return true;
        }

        List<EditScript.Op> script = EditScript.coalesce(EditScript.diff(ids(oldList), ids(newList)));
        int i = 0;
        int j = 0;
        // end of the text already claimed by a deletion
        int consumed = 0;
        boolean previousDeleted = false;
        for (EditScript.Op op : script) {
            switch (op) {
                case KEEP:
                    if (engine.rewriteChildRecycled(newList.get(j), oldList.get(i), reset)) {
                        return true;
                    }
                    previousDeleted = false;
                    i++;
                    j++;
                    break;
                case DELETE:
                    Span deleted = delete(oldList, i, consumed, previousDeleted);
                    if (deleted == null) {
                        return true;
                    }
                    consumed = deleted.hi();
                    previousDeleted = true;
                    i++;
                    break;
                case REPLACE:
                    Node old = oldList.get(i);
                    if (!old.span().isRewritable()) {
                        logger.warn("can't replace a non-rewritable node at {}", old.span());
                        return true;
                    }
                    engine.spliceRecycledSpan(newList.get(j), old.span(), "", "");
                    previousDeleted = false;
                    i++;
                    j++;
                    break;
                case INSERT:
                    if (insert(newList.get(j), oldList, i)) {
                        return true;
                    }
                    j++;
                    break;
                default:
                    throw new IllegalStateException("unknown edit " + op);
            }
        }
        return false;
    }

    /**
     * Records the deletion of {@code oldList[i]} and returns its target, or null on failure. The
     * target takes the whitespace before the element when the previous element survives, and the
     * whitespace after it otherwise. A sole element takes its lines along if it has them to itself.
     */
    private Span delete(List<Node> oldList, int i, int consumed, boolean previousDeleted) {
        Span span = oldList.get(i).span();
        if (!span.isRewritable()) {
            logger.warn("can't delete a non-rewritable node at {}", span);
            return null;
        }
        Span target = span;
        if (rcx.options().layoutAware()) {
            boolean hasPrevious = i > 0 && oldList.get(i - 1).span().file() == span.file();
            boolean hasNext = i + 1 < oldList.size() && oldList.get(i + 1).span().file() == span.file();
            if (hasPrevious && (!previousDeleted || !hasNext)) {
                int floor = Math.max(oldList.get(i - 1).span().hi(), consumed);
                target = Layout.withPrecedingWhitespace(span, Math.min(floor, span.lo()));
            } else if (hasNext) {
                target = Layout.withFollowingWhitespace(span, oldList.get(i + 1).span().lo());
            } else {
                Span lines = Layout.wholeLines(span);
                target = lines != null ? lines : Layout.withFollowingWhitespace(span, span.file().length());
            }
        }
        logger.debug("DELETE {}", SourceMap.describe(target));
        rcx.record(target, Span.DUMMY, List.of(), TextAdjust.NONE);
        return target;
    }

    private boolean insert(Node newNode, List<Node> oldList, int i) {
        Span before = i > 0 ? oldList.get(i - 1).span() : Span.DUMMY;
        Span after = i < oldList.size() ? oldList.get(i).span() : Span.DUMMY;

        Span anchor;
        String leading = "";
        String trailing = "";
        if (before.isRewritable()) {
            anchor = before.endPoint();
            if (rcx.options().layoutAware()) {
                leading = separator(oldList, before);
            }
        } else if (after.isRewritable()) {
            anchor = after.startPoint();
            if (rcx.options().layoutAware()) {
                trailing = separator(oldList, after);
            }
        } else {
            logger.warn("can't insert new node between two non-rewritable nodes");
            return true;
        }

        logger.debug("insert new item at {}", SourceMap.describe(anchor));
        engine.spliceRecycledSpan(newNode, anchor, leading, trailing);
        return false;
    }

    /**
     * The whitespace between the first two old elements, or a line break indented like
     * {@code neighbour}.
     */
    private static String separator(List<Node> oldList, Span neighbour) {
        if (oldList.size() >= 2) {
            String gap = Layout.blankGap(oldList.get(0).span(), oldList.get(1).span());
            if (gap != null) {
                return gap;
            }
        }
        return "\n" + Layout.lineIndent(neighbour);
    }

    private static List<Integer> ids(List<Node> nodes) {
        List<Integer> ids = new ArrayList<>(nodes.size());
        for (Node node : nodes) {
            ids.add(node.id());
        }
        return ids;
    }
}
