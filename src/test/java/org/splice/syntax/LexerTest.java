package org.splice.syntax;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class LexerTest {

    private static List<Token> lex(String text) {
        return Lexer.lex(new SourceMap().addFile("t.rs", text));
    }

    private static List<String> texts(String text) {
        return lex(text).stream().map(t -> t.text).collect(Collectors.toList());
    }

    @Test
    void commentsAndWhitespaceAreTrivia() {
        assertEquals(List.of("fn", "f", "(", ")", "{", "}", ""),
                texts("fn /* a /* nested */ comment */ f() // tail\n{}"));
    }

    @Test
    void keywordsAreSeparatedFromIdentifiers() {
        List<Token> tokens = lex("pub fn pubx");
        assertEquals(TokenKind.KEYWORD, tokens.get(0).kind);
        assertEquals(TokenKind.KEYWORD, tokens.get(1).kind);
        assertEquals(TokenKind.IDENT, tokens.get(2).kind);
        assertEquals(TokenKind.EOF, tokens.get(3).kind);
    }

    @Test
    void floatNeedsDigitAfterDot() {
        List<Token> tokens = lex("1.5 1.foo 2u8");
        assertEquals(TokenKind.FLOAT, tokens.get(0).kind);
        assertEquals("1.5", tokens.get(0).text);
        assertEquals(TokenKind.INT, tokens.get(1).kind, "method call on an integer");
        assertTrue(tokens.get(2).isPunct("."));
        assertEquals("foo", tokens.get(3).text);
        assertEquals("2u8", tokens.get(4).text, "suffix belongs to the literal");
    }

    @Test
    void longestPunctuationWins() {
        assertEquals(List.of("a", "::", "b", "->", "c", "<=", "d", "&&", "e", ""),
                texts("a::b -> c <= d && e"));
    }

    @Test
    void standaloneUnderscoreIsPunctuation() {
        List<Token> tokens = lex("_ _x");
        assertTrue(tokens.get(0).isPunct("_"));
        assertEquals(TokenKind.IDENT, tokens.get(1).kind);
        assertEquals("_x", tokens.get(1).text);
    }

    @Test
    void stringsKeepEscapesAndQuotes() {
        List<Token> tokens = lex("\"a\\\"b\" x");
        assertEquals(TokenKind.STR, tokens.get(0).kind);
        assertEquals("\"a\\\"b\"", tokens.get(0).text);
        assertEquals("x", tokens.get(1).text);
    }

    @Test
    void tokenSpansPointIntoTheFile() {
        Token x = lex("let  x;").get(1);
        assertEquals(5, x.span.lo());
        assertEquals(6, x.span.hi());
        assertEquals("x", x.span.text());
    }

    @Test
    void malformedInputFailsLoudly() {
        assertThrows(ParseException.class, () -> lex("\"open"));
        assertThrows(ParseException.class, () -> lex("/* open"));
        assertThrows(ParseException.class, () -> lex("a @ b"));
    }
}
