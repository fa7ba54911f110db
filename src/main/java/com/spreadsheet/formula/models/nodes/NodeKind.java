package com.spreadsheet.formula.models.nodes;

/**
 * The fixed set of syntax-tree node kinds the evaluator understands.
 */
public enum NodeKind {
    LITERAL,
    CELL,
    CELL_RANGE,
    BINARY,
    COMPARISON,
    UNARY,
    FUNCTION
}
