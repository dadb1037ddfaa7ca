package org.splice.rewrite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.splice.syntax.Node;
import org.splice.syntax.Session;
import org.splice.syntax.SourceFile;

import java.util.ArrayList;
import java.util.List;

/**
 * Computes the text edits that turn the source of an old tree into text for a new tree, keeping
 * the original text of every part that did not change.
 *
 * <p>The new tree must reuse the identifiers of nodes it copied from the old tree; identifiers
 * are the only thing that ties a new node to an old one. Both trees must come from the same
 * {@link Session}, which also receives the printed text of fresh nodes.
 */
public final class Rewriter {

    private static final Logger logger = LoggerFactory.getLogger(Rewriter.class);

    private final Session session;
    private final RewriteOptions options;

    public Rewriter(Session session) {
        this(session, RewriteOptions.defaults());
    }

    public Rewriter(Session session, RewriteOptions options) {
        this.session = session;
        this.options = options;
    }

    /**
     * Reconciles {@code newRoot} against {@code oldRoot}. The roots must be of the same kind and
     * that kind must be one the parser accepts on its own.
     */
    public RewriteResult rewrite(Node oldRoot, Node newRoot) {
        if (oldRoot.kind() != newRoot.kind()) {
            throw new IllegalArgumentException("cannot rewrite a " + oldRoot.kind() + " into a "
                    + newRoot.kind());
        }
        List<TextRewrite> rewrites = new ArrayList<>();
        RewriteCtxt rcx = new RewriteCtxt(session, NodeTable.build(oldRoot), options, rewrites);
        SpliceEngine engine = new SpliceEngine(rcx);

        RewriteCtxt.Mark mark = rcx.mark();
        if (engine.rewriteRecycled(newRoot, oldRoot)) {
            // Only roots that are not splice points can fail.
            rcx.rewind(mark);
            engine.spliceRecycled(newRoot, oldRoot);
        }

        logger.debug("{} top-level rewrites, {} abandoned nodes", rewrites.size(), rcx.abandoned().size());
        return new RewriteResult(rewrites, rcx.abandoned());
    }

    /** Rewrites the source of {@code oldRoot} into text for {@code newRoot}. */
    public String rewriteText(Node oldRoot, Node newRoot) {
        RewriteResult result = rewrite(oldRoot, newRoot);
        SourceFile file = oldRoot.span().file();
        return TextRewriter.apply(file, result);
    }
}
