package com.posindex.query;

public record LexToken(TokenType type, String value, int position) {
}

enum TokenType {
    TERM,
    PHRASE,
    LPAREN,
    RPAREN,
    AND,
    OR,
    NOT,
    MINUS,
    EOF
}
