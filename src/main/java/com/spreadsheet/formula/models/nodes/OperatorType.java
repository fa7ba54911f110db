package com.spreadsheet.formula.models.nodes;

/**
 * Classifies a binary operator token as arithmetic or comparison.
 */
public enum OperatorType {
    UNSUPPORTED,
    MATH,
    COMPARISON;

    public static OperatorType of(String operator) {
        if (operator == null) {
            return UNSUPPORTED;
        }
        switch (operator) {
            case "+":
            case "-":
            case "*":
            case "/":
            case "^":
            case "%":
                return MATH;
            case "=":
            case "<>":
            case ">":
            case "<":
            case ">=":
            case "<=":
                return COMPARISON;
            default:
                return UNSUPPORTED;
        }
    }
}
