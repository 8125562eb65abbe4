package com.containsquery.query;

public record LexToken(TokenType type, String value, int position) {
}

enum TokenType {
    TERM,
    SINGLE_QUOTED_PHRASE,
    DOUBLE_QUOTED_PHRASE,
    OR,
    AND,
    MINUS,
    TILDE,
    PLUS,
    LPAREN,
    RPAREN,
    LANGLE,
    RANGLE,
    EOF
}
