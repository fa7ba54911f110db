package com.spreadsheet.formula.parser;

/**
 * One lexical token of formula text, with the offset it started at.
 */
final class Token {
    final TokenType type;
    final String text;
    final int position;

    Token(TokenType type, String text, int position) {
        this.type = type;
        this.text = text;
        this.position = position;
    }

    String describe() {
        return type == TokenType.EOF ? "end of formula" : "'" + text + "'";
    }
}
