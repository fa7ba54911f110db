package com.spreadsheet.formula.models.nodes;

import java.util.Collections;
import java.util.List;

/**
 * A prefix {@code +} or {@code -} applied to one operand.
 */
public class UnaryNode extends FormulaNode {
    private final String operator;
    private final FormulaNode operand;

    public UnaryNode(String operator, FormulaNode operand) {
        this.operator = operator;
        this.operand = operand;
    }

    public String getOperator() {
        return operator;
    }
    public FormulaNode getOperand() {
        return operand;
    }

    @Override
    public NodeKind getKind() {
        return NodeKind.UNARY;
    }

    @Override
    public List<FormulaNode> getChildren() {
        return Collections.singletonList(operand);
    }

    @Override
    public String toString() {
        return operator + operand;
    }
}
