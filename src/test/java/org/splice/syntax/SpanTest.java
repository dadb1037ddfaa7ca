package org.splice.syntax;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

final class SpanTest {

    private final SourceFile file = new SourceMap().addFile("t.rs", "fn main() {}");

    @Test
    void dummyAndExpandedSpansAreNotRewritable() {
        assertFalse(Span.DUMMY.isRewritable());
        assertTrue(Span.DUMMY.isDummy());
        assertTrue(file.span(0, 2).isRewritable());
        assertFalse(file.span(0, 2).withCtxt(3).isRewritable(), "macro-generated text");
    }

    @Test
    void startPointIsEmptyAtLo() {
        Span span = file.span(3, 7);
        Span start = span.startPoint();
        assertTrue(start.isEmpty());
        assertEquals(3, start.lo());
        assertEquals(3, start.hi());
        assertEquals(7, span.endPoint().lo());
        assertFalse(span.isEmpty());
    }

    @Test
    void overlapIsStrict() {
        Span a = file.span(0, 4);
        assertTrue(a.overlaps(file.span(3, 6)));
        assertFalse(a.overlaps(file.span(4, 6)), "touching spans");
        assertFalse(a.overlaps(file.span(4, 4)), "insertion point at the boundary");
        assertFalse(a.overlaps(file.span(2, 2)), "empty span has no interior");
    }

    @Test
    void toJoinsAndSliceReadsText() {
        Span joined = file.span(0, 2).to(file.span(3, 7));
        assertEquals("fn main", joined.text());
        assertTrue(joined.contains(file.span(3, 7)));
        assertEquals("t.rs[0..7]", joined.toString());
    }

    @Test
    void invalidRangesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> file.span(4, 2));
        assertThrows(IllegalArgumentException.class, () -> file.span(0, 100));
    }

    @Test
    void describeShowsFileOffsetsAndText() {
        assertEquals("t.rs: 3 .. 7 = main", SourceMap.describe(file.span(3, 7)));
    }
}
