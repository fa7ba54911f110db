package com.spreadsheet.formula.models.nodes;

import java.util.List;

/**
 * Base class for every node of a parsed formula.
 * Nodes are compared by identity: two structurally equal subtrees are still
 * distinct slots in a {@code ResultCache}, so subclasses must not override
 * equals/hashCode.
 */
public abstract class FormulaNode {

    public abstract NodeKind getKind();

    /**
     * The nodes that must be evaluated before this one, in evaluation order.
     */
    public abstract List<FormulaNode> getChildren();
}
