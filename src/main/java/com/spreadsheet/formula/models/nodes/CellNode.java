package com.spreadsheet.formula.models.nodes;

import java.util.Collections;
import java.util.List;

/**
 * A single column reference such as {@code c3}.
 * The key is kept as written; it is validated when the node is evaluated.
 */
public class CellNode extends FormulaNode {
    private final String key;

    public CellNode(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CELL;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return key;
    }
}
