package com.spreadsheet.formula.parser;

enum TokenType {
    NUMBER,
    STRING,
    IDENT,
    PLUS,
    MINUS,
    STAR,
    SLASH,
    CARET,
    PERCENT,
    EQ,
    NE,
    LT,
    GT,
    LE,
    GE,
    LPAREN,
    RPAREN,
    COMMA,
    COLON,
    EOF
}
