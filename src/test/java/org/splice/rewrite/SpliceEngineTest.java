package org.splice.rewrite;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.splice.syntax.Node;
import org.splice.syntax.NodeKind;
import org.splice.syntax.Session;
import org.splice.syntax.SourceFile;

final class SpliceEngineTest {

    private final Session session = new Session();
    private final List<TextRewrite> rewrites = new ArrayList<>();
    private Node old;
    private Node oldArg;

    @BeforeEach
    void setUp() {
        old = session.parseCrate("lib.rs", "fn f() {\n    g(alpha);\n}\n");
        Node call = old.list("items").get(0).child("body").list("stmts").get(0).child("expr");
        oldArg = call.list("args").get(0);
    }

    private RewriteCtxt context() {
        return new RewriteCtxt(session, NodeTable.build(old), RewriteOptions.defaults(), rewrites);
    }

    @Test
    void copiedNodeRevertsToItsOriginalText() {
        SpliceEngine engine = new SpliceEngine(context());
        Node reparsed = session.parse(NodeKind.EXPR, "alpha");

        assertTrue(engine.spliceFresh(oldArg.deepCopy(), reparsed));
        assertEquals(1, rewrites.size());
        assertEquals(reparsed.span(), rewrites.get(0).oldSpan());
        assertEquals(oldArg.span(), rewrites.get(0).newSpan());
    }

    @Test
    void nodeWithoutOldCounterpartStaysFresh() {
        SpliceEngine engine = new SpliceEngine(context());
        Node unknown = session.parse(NodeKind.EXPR, "alpha");

        assertFalse(engine.spliceFresh(unknown, session.parse(NodeKind.EXPR, "alpha")));
        assertTrue(rewrites.isEmpty());
    }

    @Test
    void nodeThatOpenedTheFreshTextIsNotReverted() {
        RewriteCtxt rcx = context();
        SpliceEngine engine = new SpliceEngine(rcx);
        Node copy = oldArg.deepCopy();
        rcx.replaceFreshStart(copy.span());

        assertFalse(engine.spliceFresh(copy, session.parse(NodeKind.EXPR, "alpha")));
        assertTrue(rewrites.isEmpty());
    }

    @Test
    void oldTextInsideMacroFileIsNotReused() {
        SourceFile macro = session.sourceMap().addMacroFile("alpha");
        oldArg.setSpan(macro.fullSpan());
        SpliceEngine engine = new SpliceEngine(context());

        assertTrue(oldArg.span().isRewritable());
        assertFalse(engine.spliceFresh(oldArg.deepCopy(), session.parse(NodeKind.EXPR, "alpha")));
        assertTrue(rewrites.isEmpty());
    }

    @Test
    void oldTextWithExpansionContextIsNotReused() {
        oldArg.setSpan(oldArg.span().withCtxt(1));
        SpliceEngine engine = new SpliceEngine(context());

        assertFalse(engine.spliceFresh(oldArg.deepCopy(), session.parse(NodeKind.EXPR, "alpha")));
        assertTrue(rewrites.isEmpty());
    }
}
