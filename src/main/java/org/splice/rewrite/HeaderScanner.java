package org.splice.rewrite;

import org.splice.syntax.ParseException;
import org.splice.syntax.Span;
import org.splice.syntax.Token;
import org.splice.syntax.TokenKind;

import java.util.List;

/**
 * Finds the spans of the qualifiers in the header of an item's token stream. A qualifier that is
 * absent gets the empty span at the start of the token where it would be inserted.
 */
final class HeaderScanner {

    /** Qualifier spans of {@code vis const unsafe extern "abi" fn name}. */
    static final class FnHeaderSpans {
        final Span vis;
        final Span constness;
        final Span unsafety;
        final Span abi;
        final Span ident;

        FnHeaderSpans(Span vis, Span constness, Span unsafety, Span abi, Span ident) {
            this.vis = vis;
            this.constness = constness;
            this.unsafety = unsafety;
            this.abi = abi;
            this.ident = ident;
        }
    }

    /** Qualifier spans of {@code vis keyword name}. */
    static final class ItemHeaderSpans {
        final Span vis;
        final Span ident;

        ItemHeaderSpans(Span vis, Span ident) {
            this.vis = vis;
            this.ident = ident;
        }
    }

    private static final List<String> ITEM_KEYWORDS = List.of(
            "static", "const", "fn", "mod", "type", "enum", "struct", "union", "trait");

    private final List<Token> tokens;
    private int pos;

    private HeaderScanner(List<Token> tokens) {
        this.tokens = tokens;
    }

    /** @throws ParseException if the tokens do not start with a function header */
    static FnHeaderSpans scanFn(List<Token> tokens) {
        HeaderScanner p = new HeaderScanner(tokens);
        p.skipAttributes();
        Span vis = p.visibility();
        Span constness = p.eatKeyword("const") ? p.prevSpan() : p.startPoint();
        Span unsafety = p.eatKeyword("unsafe") ? p.prevSpan() : p.startPoint();
        Span abi;
        if (p.eatKeyword("extern")) {
            Span externSpan = p.prevSpan();
            if (p.peek().kind == TokenKind.STR) {
                p.pos++;
                abi = externSpan.to(p.prevSpan());
            } else {
                abi = externSpan;
            }
        } else {
            abi = p.startPoint();
        }
        p.expectKeyword("fn");
        Span ident = p.ident();
        return new FnHeaderSpans(vis, constness, unsafety, abi, ident);
    }

    /** @throws ParseException if the tokens do not start with {@code vis keyword name} */
    static ItemHeaderSpans scanItem(List<Token> tokens) {
        HeaderScanner p = new HeaderScanner(tokens);
        p.skipAttributes();
        Span vis = p.visibility();
        Token keyword = p.peek();
        if (keyword.kind != TokenKind.KEYWORD && keyword.kind != TokenKind.IDENT
                || !ITEM_KEYWORDS.contains(keyword.text)) {
            throw new ParseException(keyword.span, "expected one of " + ITEM_KEYWORDS
                    + ", found '" + keyword.text + "'");
        }
        p.pos++;
        Span ident = p.ident();
        return new ItemHeaderSpans(vis, ident);
    }

    private void skipAttributes() {
        while (peek().isPunct("#")) {
            pos++;
            expectPunct("[");
            int depth = 1;
            while (depth > 0) {
                Token t = next();
                if (t.isPunct("[")) {
                    depth++;
                } else if (t.isPunct("]")) {
                    depth--;
                }
            }
        }
    }

    private Span visibility() {
        if (!eatKeyword("pub")) {
            // Inherited visibility has no tokens; a new one goes just before the next token.
            return startPoint();
        }
        Span pub = prevSpan();
        if (peek().isPunct("(") && peekAt(1).isKeyword("crate") && peekAt(2).isPunct(")")) {
            pos += 3;
            return pub.to(prevSpan());
        }
        return pub;
    }

    private Span ident() {
        Token t = next();
        if (t.kind != TokenKind.IDENT) {
            throw new ParseException(t.span, "expected identifier, found '" + t.text + "'");
        }
        return t.span;
    }

    private Token peek() {
        return peekAt(0);
    }

    private Token peekAt(int offset) {
        int index = pos + offset;
        if (index >= tokens.size()) {
            Span end = tokens.isEmpty() ? Span.DUMMY : tokens.get(tokens.size() - 1).span.endPoint();
            return new Token(TokenKind.EOF, "", end);
        }
        return tokens.get(index);
    }

    private Token next() {
        Token t = peek();
        if (t.kind == TokenKind.EOF) {
            throw new ParseException(t.span, "unexpected end of item header");
        }
        pos++;
        return t;
    }

    private boolean eatKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            pos++;
            return true;
        }
        return false;
    }

    private void expectKeyword(String keyword) {
        if (!eatKeyword(keyword)) {
            throw new ParseException(peek().span, "expected '" + keyword + "', found '" + peek().text + "'");
        }
    }

    private void expectPunct(String punct) {
        Token t = next();
        if (!t.isPunct(punct)) {
            throw new ParseException(t.span, "expected '" + punct + "', found '" + t.text + "'");
        }
    }

    private Span prevSpan() {
        return tokens.get(pos - 1).span;
    }

    private Span startPoint() {
        return peek().span.startPoint();
    }
}
