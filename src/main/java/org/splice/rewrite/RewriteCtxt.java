package org.splice.rewrite;

import org.splice.syntax.ExprPrecedence;
import org.splice.syntax.Node;
import org.splice.syntax.NodeKind;
import org.splice.syntax.Session;
import org.splice.syntax.Span;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one reconciliation pass: the edit log currently being written, the span of
 * the closest enclosing fresh node, the precedence requirement of the current expression position
 * and the ledger of abandoned spans.
 *
 * <p>The log is append-only. {@link #mark()} saves its length and {@link #rewind(Mark)}
 * truncates back to it, which undoes everything a failed strategy recorded. A strategy must
 * rewind before another one is tried from the same mark.
 */
public final class RewriteCtxt {

    /** A saved position in the edit log and the abandonment ledger. */
    public static final class Mark {
        private final List<TextRewrite> sink;
        private final int rewrites;
        private final int abandoned;

        private Mark(List<TextRewrite> sink, int rewrites, int abandoned) {
            this.sink = sink;
            this.rewrites = rewrites;
            this.abandoned = abandoned;
        }
    }

    private final Session session;
    private final NodeTable oldNodes;
    private final RewriteOptions options;
    private final List<Span> abandoned = new ArrayList<>();
    private List<TextRewrite> rewrites;
    private Span freshStart = Span.DUMMY;
    private ExprPrec exprPrec = ExprPrec.normal(ExprPrecedence.RESET);

    public RewriteCtxt(Session session, NodeTable oldNodes, RewriteOptions options,
                       List<TextRewrite> rewrites) {
        this.session = session;
        this.oldNodes = oldNodes;
        this.options = options;
        this.rewrites = rewrites;
    }

    public Session session() {
        return session;
    }

    public RewriteOptions options() {
        return options;
    }

    public Node oldNode(NodeKind kind, int id) {
        return oldNodes.get(kind, id);
    }

    public void record(Span oldSpan, Span newSpan, List<TextRewrite> nested, TextAdjust adjust) {
        rewrites.add(new TextRewrite(oldSpan, newSpan, nested, adjust));
    }

    public Mark mark() {
        return new Mark(rewrites, rewrites.size(), abandoned.size());
    }

    public void rewind(Mark mark) {
        if (mark.sink != rewrites) {
            throw new IllegalStateException("rewind to a mark taken on another edit log");
        }
        truncate(rewrites, mark.rewrites);
        truncate(abandoned, mark.abandoned);
    }

    private static <T> void truncate(List<T> list, int size) {
        if (list.size() > size) {
            list.subList(size, list.size()).clear();
        }
    }

    /**
     * Redirects recording into a fresh list, for the nested rewrites of one edit. Returns the
     * list that was active, to be passed back to {@link #exitNested(List)}.
     */
    public List<TextRewrite> enterNested() {
        List<TextRewrite> saved = rewrites;
        rewrites = new ArrayList<>();
        return saved;
    }

    /** Restores {@code saved} and returns the nested rewrites recorded since entering. */
    public List<TextRewrite> exitNested(List<TextRewrite> saved) {
        List<TextRewrite> nested = rewrites;
        rewrites = saved;
        return nested;
    }

    public Span freshStart() {
        return freshStart;
    }

    public Span replaceFreshStart(Span span) {
        Span previous = freshStart;
        freshStart = span;
        return previous;
    }

    public ExprPrec exprPrec() {
        return exprPrec;
    }

    public ExprPrec replaceExprPrec(ExprPrec prec) {
        ExprPrec previous = exprPrec;
        exprPrec = prec;
        return previous;
    }

    public void abandon(Span span) {
        abandoned.add(span);
    }

    public List<Span> abandoned() {
        return abandoned;
    }
}
