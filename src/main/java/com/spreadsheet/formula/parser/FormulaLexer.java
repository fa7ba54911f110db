package com.spreadsheet.formula.parser;

import com.spreadsheet.formula.exceptions.FormulaParseException;

/**
 * Splits formula text into tokens on demand.
 */
final class FormulaLexer {
    private final String text;
    private int pos;

    FormulaLexer(String text) {
        this.text = text;
    }

    Token next() {
        skipWhitespace();
        if (pos >= text.length()) {
            return new Token(TokenType.EOF, "", pos);
        }
        int start = pos;
        char c = text.charAt(pos);

        if (isDigit(c) || (c == '.' && pos + 1 < text.length() && isDigit(text.charAt(pos + 1)))) {
            return number(start);
        }
        if (Character.isLetter(c) || c == '_') {
            while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
                pos++;
            }
            return new Token(TokenType.IDENT, text.substring(start, pos), start);
        }
        if (c == '"') {
            return string(start);
        }

        pos++;
        switch (c) {
            case '+': return new Token(TokenType.PLUS, "+", start);
            case '-': return new Token(TokenType.MINUS, "-", start);
            case '*': return new Token(TokenType.STAR, "*", start);
            case '/': return new Token(TokenType.SLASH, "/", start);
            case '^': return new Token(TokenType.CARET, "^", start);
            case '%': return new Token(TokenType.PERCENT, "%", start);
            case '=': return new Token(TokenType.EQ, "=", start);
            case '(': return new Token(TokenType.LPAREN, "(", start);
            case ')': return new Token(TokenType.RPAREN, ")", start);
            case ',': return new Token(TokenType.COMMA, ",", start);
            case ':': return new Token(TokenType.COLON, ":", start);
            case '<':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.LE, "<=", start);
                }
                if (peek('>')) {
                    pos++;
                    return new Token(TokenType.NE, "<>", start);
                }
                return new Token(TokenType.LT, "<", start);
            case '>':
                if (peek('=')) {
                    pos++;
                    return new Token(TokenType.GE, ">=", start);
                }
                return new Token(TokenType.GT, ">", start);
            default:
                throw new FormulaParseException("Unexpected character '" + c + "'", start);
        }
    }

    private Token number(int start) {
        while (pos < text.length() && isDigit(text.charAt(pos))) {
            pos++;
        }
        if (pos < text.length() && text.charAt(pos) == '.') {
            pos++;
            while (pos < text.length() && isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < text.length() && (text.charAt(pos) == '+' || text.charAt(pos) == '-')) {
                pos++;
            }
            if (pos >= text.length() || !isDigit(text.charAt(pos))) {
                throw new FormulaParseException("Malformed exponent", mark);
            }
            while (pos < text.length() && isDigit(text.charAt(pos))) {
                pos++;
            }
        }
        return new Token(TokenType.NUMBER, text.substring(start, pos), start);
    }

    // "" inside a string literal is an escaped quote
    private Token string(int start) {
        StringBuilder sb = new StringBuilder();
        pos++;
        while (pos < text.length()) {
            char c = text.charAt(pos++);
            if (c == '"') {
                if (peek('"')) {
                    sb.append('"');
                    pos++;
                } else {
                    return new Token(TokenType.STRING, sb.toString(), start);
                }
            } else {
                sb.append(c);
            }
        }
        throw new FormulaParseException("Unterminated string literal", start);
    }

    private boolean peek(char expected) {
        return pos < text.length() && text.charAt(pos) == expected;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    // ASCII only: Character.isDigit also accepts digits of other scripts
    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.';
    }
}
