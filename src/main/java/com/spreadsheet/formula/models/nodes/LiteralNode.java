package com.spreadsheet.formula.models.nodes;

import java.util.Collections;
import java.util.List;

/**
 * A number, string or boolean written directly in the formula.
 */
public class LiteralNode extends FormulaNode {
    private final Object value;

    public LiteralNode(Object value) {
        this.value = value;
    }

    public Object getValue() {
        return value;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.LITERAL;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return value instanceof String ? "\"" + value + "\"" : String.valueOf(value);
    }
}
