package com.spreadsheet.formula.models.nodes;

import java.util.Collections;
import java.util.List;

/**
 * An inclusive span of columns such as {@code c1:c4}.
 * The endpoints are resolved by the range itself, so they are not
 * reported as children.
 */
public class CellRangeNode extends FormulaNode {
    private final CellNode start;
    private final CellNode end;

    public CellRangeNode(CellNode start, CellNode end) {
        this.start = start;
        this.end = end;
    }

    public CellNode getStart() {
        return start;
    }
    public CellNode getEnd() {
        return end;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.CELL_RANGE;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return Collections.emptyList();
    }

    @Override
    public String toString() {
        return start + ":" + end;
    }
}
