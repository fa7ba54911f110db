package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.EvaluationResult;
import com.spreadsheet.formula.models.nodes.FormulaNode;

import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Per-evaluation memo of node results, keyed by node identity.
 * <p>
 * Filled children-first by {@link FormulaTreeWalker} and read back by
 * {@link FormulaEvaluator} when it combines operands. Each node is written once;
 * reading a node that has not been evaluated yet breaks the post-order contract
 * and fails fast. Not thread-safe: one cache belongs to one evaluation.
 */
public class ResultCache {

    private final Map<FormulaNode, EvaluationResult> results = new IdentityHashMap<>();

    /**
     * @throws IllegalStateException if the node has not been evaluated
     */
    public EvaluationResult get(FormulaNode node) {
        EvaluationResult result = results.get(node);
        if (result == null) {
            throw new IllegalStateException("Node has not been evaluated yet: " + describe(node));
        }
        return result;
    }

    /**
     * @throws IllegalStateException if the node already has a result
     */
    public void set(FormulaNode node, EvaluationResult result) {
        if (result == null) {
            throw new IllegalArgumentException("Result must not be null for node " + describe(node));
        }
        if (results.putIfAbsent(node, result) != null) {
            throw new IllegalStateException("Node was already evaluated: " + describe(node));
        }
    }

    public boolean contains(FormulaNode node) {
        return results.containsKey(node);
    }

    public Collection<EvaluationResult> values() {
        return Collections.unmodifiableCollection(results.values());
    }

    public int size() {
        return results.size();
    }

    // Kind and identity only; rendering a whole subtree can be arbitrarily deep
    private static String describe(FormulaNode node) {
        return node.getKind() + "@" + Integer.toHexString(System.identityHashCode(node));
    }
}
