package com.spreadsheet.formula.models.nodes;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * An infix operator applied to two operands.
 * Reports {@link NodeKind#COMPARISON} for comparison operators and
 * {@link NodeKind#BINARY} for everything else.
 */
public class BinaryNode extends FormulaNode {
    private final String operator;
    private final FormulaNode left;
    private final FormulaNode right;

    public BinaryNode(String operator, FormulaNode left, FormulaNode right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public String getOperator() {
        return operator;
    }
    public FormulaNode getLeft() {
        return left;
    }
    public FormulaNode getRight() {
        return right;
    }

    public OperatorType getOperatorType() {
        return OperatorType.of(operator);
    }

    @Override
    public NodeKind getKind() {
        return getOperatorType() == OperatorType.COMPARISON ? NodeKind.COMPARISON : NodeKind.BINARY;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return Collections.unmodifiableList(Arrays.asList(left, right));
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator + " " + right + ")";
    }
}
