package org.splice.rewrite;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.splice.syntax.SourceFile;
import org.splice.syntax.SourceMap;
import org.splice.syntax.Span;

final class TextRewriterTest {

    private final SourceMap sourceMap = new SourceMap();

    private static String applyAll(SourceFile file, TextRewrite... rewrites) {
        return TextRewriter.apply(file, TextRewriter.flatten(List.of(rewrites)));
    }

    private static TextRewrite replace(Span target, Span text, TextAdjust adjust) {
        return new TextRewrite(target, text, List.of(), adjust);
    }

    @Test
    void replacementAndDeletion() {
        SourceFile file = sourceMap.addFile("a.rs", "x * y + z");
        SourceFile fresh = sourceMap.addFreshFile("w");
        assertEquals("w * y", applyAll(file,
                replace(file.span(0, 1), fresh.fullSpan(), TextAdjust.NONE),
                new TextRewrite(file.span(5, 9), Span.DUMMY, List.of(), TextAdjust.NONE)));
    }

    @Test
    void parenthesizeWrapsTheReplacement() {
        SourceFile file = sourceMap.addFile("a.rs", "x * y");
        SourceFile fresh = sourceMap.addFreshFile("a + b");
        assertEquals("(a + b) * y",
                applyAll(file, replace(file.span(0, 1), fresh.fullSpan(), TextAdjust.PARENTHESIZE)));
    }

    @Test
    void existingParenthesesAreNotDoubled() {
        SourceFile file = sourceMap.addFile("a.rs", "(x) * y");
        SourceFile fresh = sourceMap.addFreshFile("a + b");
        assertEquals("(a + b) * y",
                applyAll(file, replace(file.span(1, 2), fresh.fullSpan(), TextAdjust.PARENTHESIZE)));
    }

    @Test
    void nestedRewritesAreRenderedInsideTheReplacement() {
        SourceFile file = sourceMap.addFile("a.rs", "x * long_name");
        SourceFile fresh = sourceMap.addFreshFile("f(q)");
        TextRewrite revert = replace(fresh.span(2, 3), file.span(4, 13), TextAdjust.NONE);
        TextRewrite outer = new TextRewrite(file.span(0, 1), fresh.fullSpan(), List.of(revert), TextAdjust.NONE);
        assertEquals("f(long_name)", TextRewriter.render(fresh.fullSpan(), List.of(revert)));
        assertEquals("f(long_name) * long_name", applyAll(file, outer));
    }

    @Test
    void insertionsAtOnePointKeepRecordingOrder() {
        SourceFile file = sourceMap.addFile("a.rs", "fn f() {}");
        SourceFile first = sourceMap.addFreshFile("pub ");
        SourceFile second = sourceMap.addFreshFile("unsafe ");
        assertEquals("pub unsafe fn f() {}", applyAll(file,
                replace(file.span(0, 0), first.fullSpan(), TextAdjust.NONE),
                replace(file.span(0, 0), second.fullSpan(), TextAdjust.NONE)));
    }

    @Test
    void editsAreOrderedByTarget() {
        SourceFile file = sourceMap.addFile("a.rs", "a b c");
        SourceFile x = sourceMap.addFreshFile("X");
        SourceFile y = sourceMap.addFreshFile("Y");
        List<TextEdit> edits = TextRewriter.flatten(List.of(
                replace(file.span(4, 5), y.fullSpan(), TextAdjust.NONE),
                replace(file.span(0, 1), x.fullSpan(), TextAdjust.NONE)));
        assertEquals(0, edits.get(0).target().lo());
        assertEquals("X b Y", TextRewriter.apply(file, edits));
    }

    @Test
    void overlappingTargetsAreRejected() {
        SourceFile file = sourceMap.addFile("a.rs", "abcdef");
        List<TextRewrite> rewrites = List.of(
                new TextRewrite(file.span(0, 3), Span.DUMMY, List.of(), TextAdjust.NONE),
                new TextRewrite(file.span(2, 5), Span.DUMMY, List.of(), TextAdjust.NONE));
        assertThrows(IllegalStateException.class, () -> TextRewriter.flatten(rewrites));
    }

    @Test
    void editsForAnotherFileAreRejected() {
        SourceFile file = sourceMap.addFile("a.rs", "abc");
        SourceFile other = sourceMap.addFile("b.rs", "abc");
        List<TextEdit> edits = List.of(new TextEdit(other.span(0, 1), "x"));
        assertThrows(IllegalStateException.class, () -> TextRewriter.apply(file, edits));
    }

    @Test
    void nestedRewriteOutsideItsParentIsRejected() {
        SourceFile file = sourceMap.addFile("a.rs", "abc");
        SourceFile fresh = sourceMap.addFreshFile("xyz");
        TextRewrite stray = replace(file.span(0, 1), file.span(1, 2), TextAdjust.NONE);
        assertThrows(IllegalStateException.class,
                () -> TextRewriter.render(fresh.fullSpan(), List.of(stray)));
    }
}
