package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.EvaluationResult;
import com.spreadsheet.formula.models.nodes.BinaryNode;
import com.spreadsheet.formula.models.nodes.CellNode;
import com.spreadsheet.formula.models.nodes.CellRangeNode;
import com.spreadsheet.formula.models.nodes.FormulaNode;
import com.spreadsheet.formula.models.nodes.FunctionNode;
import com.spreadsheet.formula.models.nodes.LiteralNode;
import com.spreadsheet.formula.models.nodes.UnaryNode;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Drives one evaluation: visits the tree children-first, hands each node to the
 * matching {@link FormulaEvaluator} operation and records the result in the
 * evaluator's {@link ResultCache}.
 * <p>
 * Uses an explicit stack, so nesting depth is bounded by heap rather than thread stack.
 */
public class FormulaTreeWalker {

    private static final class Frame {
        final FormulaNode node;
        boolean expanded;

        Frame(FormulaNode node) {
            this.node = node;
        }
    }

    /**
     * Evaluates every node under {@code root} and returns the root's result.
     */
    public EvaluationResult walk(FormulaNode root, FormulaEvaluator evaluator) {
        ResultCache cache = evaluator.getResultCache();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(root));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (cache.contains(frame.node)) {
                // shared subtree, already evaluated through another parent
                stack.pop();
                continue;
            }
            if (!frame.expanded) {
                frame.expanded = true;
                List<FormulaNode> children = frame.node.getChildren();
                // pushed in reverse so the leftmost child is evaluated first
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(children.get(i)));
                }
                continue;
            }
            stack.pop();
            cache.set(frame.node, evaluateNode(frame.node, evaluator, cache));
        }
        return cache.get(root);
    }

    private EvaluationResult evaluateNode(FormulaNode node, FormulaEvaluator evaluator, ResultCache cache) {
        switch (node.getKind()) {
            case LITERAL:
                return EvaluationResult.ok(((LiteralNode) node).getValue());
            case CELL:
                return evaluator.resolveColumnValue(((CellNode) node).getKey());
            case CELL_RANGE: {
                CellRangeNode range = (CellRangeNode) node;
                return evaluator.resolveRange(range.getStart().getKey(), range.getEnd().getKey());
            }
            case BINARY: {
                BinaryNode binary = (BinaryNode) node;
                return evaluator.evalBinary(binary.getOperator(),
                        cache.get(binary.getLeft()), cache.get(binary.getRight()));
            }
            case COMPARISON: {
                BinaryNode comparison = (BinaryNode) node;
                return evaluator.evalComparison(comparison.getOperator(),
                        cache.get(comparison.getLeft()), cache.get(comparison.getRight()));
            }
            case UNARY: {
                UnaryNode unary = (UnaryNode) node;
                return evaluator.evalUnary(unary.getOperator(), cache.get(unary.getOperand()));
            }
            case FUNCTION: {
                FunctionNode function = (FunctionNode) node;
                return evaluator.evalFunction(function.getName(), function.getArguments());
            }
            default:
                throw new IllegalStateException("Unknown node kind: " + node.getKind());
        }
    }
}
