package org.splice.rewrite;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.splice.syntax.Lexer;
import org.splice.syntax.Node;
import org.splice.syntax.NodeKind;
import org.splice.syntax.ParseException;
import org.splice.syntax.Printer;
import org.splice.syntax.Slot;
import org.splice.syntax.SlotType;
import org.splice.syntax.SourceMap;
import org.splice.syntax.Span;
import org.splice.syntax.Token;
import org.splice.syntax.Variant;

import java.util.List;
import java.util.Objects;

/**
 * Fallback for items whose only differences are in the header: visibility, qualifiers and name.
 * Instead of reprinting the whole item, each differing qualifier of the old header is replaced by
 * the corresponding text of the printed new header.
 */
final class HeaderRecovery {

    private static final Logger logger = LoggerFactory.getLogger(HeaderRecovery.class);

    private final SpliceEngine engine;
    private final RewriteCtxt rcx;

    HeaderRecovery(SpliceEngine engine, RewriteCtxt rcx) {
        this.engine = engine;
        this.rcx = rcx;
    }

    boolean applies(Node node) {
        return node.kind() == NodeKind.ITEM && rcx.options().headerRecovery();
    }

    /**
     * Reconciles everything but the header slots, then edits the header qualifiers that differ.
     * Returns true on failure, including when the old item kept no tokens to scan.
     */
    boolean recover(Node newItem, Node oldItem) {
        if (oldItem.tokens() == null) {
            return true;
        }
        if (newItem.variant() != oldItem.variant()) {
            return true;
        }
        for (Slot slot : newItem.variant().slots()) {
            if (slot.type != SlotType.HEADER && engine.rewriteSlotRecycled(newItem, oldItem, slot)) {
                return true;
            }
        }

        List<Token> newTokens = Lexer.lex(rcx.session().sourceMap().addFreshFile(Printer.print(newItem)));
        List<Token> oldTokens = oldItem.tokens();

        if (newItem.variant() == Variant.ITEM_FN) {
            // Printed function headers always scan; a failure here is a printer bug.
            HeaderScanner.FnHeaderSpans newSpans = HeaderScanner.scanFn(newTokens);
            HeaderScanner.FnHeaderSpans oldSpans = HeaderScanner.scanFn(oldTokens);

            // Source order, so that several insertions at one point come out in the right order.
            if (differs(newItem, oldItem, "vis")) {
                recordQualifierRewrite(oldSpans.vis, newSpans.vis);
            }
            if (differs(newItem, oldItem, "constness")) {
                recordQualifierRewrite(oldSpans.constness, newSpans.constness);
            }
            if (differs(newItem, oldItem, "unsafety")) {
                recordQualifierRewrite(oldSpans.unsafety, newSpans.unsafety);
            }
            if (differs(newItem, oldItem, "abi")) {
                recordQualifierRewrite(oldSpans.abi, newSpans.abi);
            }
            if (differs(newItem, oldItem, "name")) {
                recordQualifierRewrite(oldSpans.ident, newSpans.ident);
            }
            return false;
        }

        HeaderScanner.ItemHeaderSpans newSpans;
        HeaderScanner.ItemHeaderSpans oldSpans;
        try {
            newSpans = HeaderScanner.scanItem(newTokens);
            oldSpans = HeaderScanner.scanItem(oldTokens);
        } catch (ParseException e) {
            logger.debug("no recoverable header for {}: {}", newItem.variant(), e.getMessage());
            return true;
        }
        if (differs(newItem, oldItem, "vis")) {
            recordQualifierRewrite(oldSpans.vis, newSpans.vis);
        }
        if (differs(newItem, oldItem, "name")) {
            recordQualifierRewrite(oldSpans.ident, newSpans.ident);
        }
        return false;
    }

    private static boolean differs(Node newItem, Node oldItem, String slot) {
        return !Objects.equals(newItem.leaf(slot), oldItem.leaf(slot));
    }

    /**
     * Replaces the qualifier at {@code oldSpan} by the text at {@code newSpan}. An absent old
     * qualifier has an empty span at the start of the following token, so an inserted qualifier
     * takes its trailing space along; a deleted one drops the space after it.
     */
    private void recordQualifierRewrite(Span oldSpan, Span newSpan) {
        Span target = oldSpan;
        Span source = newSpan;
        if (oldSpan.isEmpty() && !newSpan.isEmpty()) {
            source = newSpan.withHi(newSpan.hi() + 1);
        } else if (!oldSpan.isEmpty() && newSpan.isEmpty()) {
            target = Layout.withTrailingSpace(oldSpan);
        }

        if (oldSpan.isEmpty()) {
            logger.debug("INSERT (QUAL) {}", SourceMap.describe(target));
            logger.debug("    AT (QUAL) {}", SourceMap.describe(source));
        } else if (newSpan.isEmpty()) {
            logger.debug("DELETE (QUAL) {}", SourceMap.describe(target));
        } else {
            logger.debug("REWRITE (QUAL) {}", SourceMap.describe(target));
            logger.debug("   INTO (QUAL) {}", SourceMap.describe(source));
        }
        rcx.record(target, source, List.of(), TextAdjust.NONE);
    }
}
