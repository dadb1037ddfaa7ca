package org.splice.syntax;

public enum TokenKind {
    IDENT,
    KEYWORD,
    INT,
    FLOAT,
    STR,
    PUNCT,
    EOF
}
