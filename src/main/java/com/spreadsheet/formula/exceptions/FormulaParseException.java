package com.spreadsheet.formula.exceptions;

/**
 * Thrown when formula text cannot be turned into a syntax tree,
 * e.g. "SUM(c1,", "1 +* 2" or an unterminated string literal.
 */
public class FormulaParseException extends RuntimeException {
    private final int position;

    public FormulaParseException(String message, int position) {
        super(message + " at position " + position);
        this.position = position;
    }

    // 0-based offset into the formula text
    public int getPosition() {
        return position;
    }
}
