package org.splice.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Splits a source file into tokens. Whitespace, line comments and block comments are trivia and
 * produce no tokens. The returned list always ends with an {@link TokenKind#EOF} token.
 */
public final class Lexer {

    static final Set<String> KEYWORDS = Set.of(
            "as", "const", "crate", "else", "extern", "false", "fn", "if", "let", "mod", "mut",
            "pub", "return", "static", "struct", "true", "type", "unsafe", "while");

    // Longest first.
    private static final String[] PUNCTS = {
            "<<=", ">>=",
            "::", "->", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>",
            "(", ")", "{", "}", "[", "]", ",", ";", ":", ".", "#", "!", "=", "<", ">",
            "+", "-", "*", "/", "%", "&", "|", "^", "_"
    };

    private final SourceFile file;
    private final String src;
    private int pos;

    private Lexer(SourceFile file) {
        this.file = file;
        this.src = file.text();
    }

    public static List<Token> lex(SourceFile file) {
        return new Lexer(file).run();
    }

    private List<Token> run() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (pos >= src.length()) {
                tokens.add(new Token(TokenKind.EOF, "", file.span(pos, pos)));
                return tokens;
            }
            tokens.add(next());
        }
    }

    private void skipTrivia() {
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (Character.isWhitespace(c)) {
                pos++;
            } else if (src.startsWith("//", pos)) {
                int nl = src.indexOf('\n', pos);
                pos = nl < 0 ? src.length() : nl + 1;
            } else if (src.startsWith("/*", pos)) {
                int depth = 0;
                do {
                    if (src.startsWith("/*", pos)) {
                        depth++;
                        pos += 2;
                    } else if (src.startsWith("*/", pos)) {
                        depth--;
                        pos += 2;
                    } else if (pos >= src.length()) {
                        throw new ParseException(file.span(pos, pos), "unterminated block comment");
                    } else {
                        pos++;
                    }
                } while (depth > 0);
            } else {
                return;
            }
        }
    }

    private Token next() {
        int start = pos;
        char c = src.charAt(pos);
        if (isIdentStart(c) && !(c == '_' && !isIdentPart(peekChar(1)))) {
            while (pos < src.length() && isIdentPart(src.charAt(pos))) {
                pos++;
            }
            String word = src.substring(start, pos);
            TokenKind kind = KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENT;
            return new Token(kind, word, file.span(start, pos));
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '"') {
            return string(start);
        }
        for (String punct : PUNCTS) {
            if (src.startsWith(punct, pos)) {
                pos += punct.length();
                return new Token(TokenKind.PUNCT, punct, file.span(start, pos));
            }
        }
        throw new ParseException(file.span(start, start + 1), "unexpected character '" + c + "'");
    }

    private Token number(int start) {
        while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
            pos++;
        }
        TokenKind kind = TokenKind.INT;
        if (pos + 1 < src.length() && src.charAt(pos) == '.' && Character.isDigit(src.charAt(pos + 1))) {
            kind = TokenKind.FLOAT;
            pos++;
            while (pos < src.length() && Character.isDigit(src.charAt(pos))) {
                pos++;
            }
        }
        // Type suffix, e.g. 1u32 or 2.0f64.
        while (pos < src.length() && isIdentPart(src.charAt(pos))) {
            pos++;
        }
        return new Token(kind, src.substring(start, pos), file.span(start, pos));
    }

    private Token string(int start) {
        pos++;
        while (pos < src.length() && src.charAt(pos) != '"') {
            if (src.charAt(pos) == '\\') {
                pos++;
            }
            pos++;
        }
        if (pos >= src.length()) {
            throw new ParseException(file.span(start, src.length()), "unterminated string literal");
        }
        pos++;
        return new Token(TokenKind.STR, src.substring(start, pos), file.span(start, pos));
    }

    private char peekChar(int offset) {
        int i = pos + offset;
        return i < src.length() ? src.charAt(i) : '\0';
    }

    private static boolean isIdentStart(char c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
