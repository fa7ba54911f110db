package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.EvaluationResult;
import com.spreadsheet.formula.models.nodes.BinaryNode;
import com.spreadsheet.formula.models.nodes.CellNode;
import com.spreadsheet.formula.models.nodes.CellRangeNode;
import com.spreadsheet.formula.models.nodes.FormulaNode;
import com.spreadsheet.formula.models.nodes.FunctionNode;
import com.spreadsheet.formula.models.nodes.LiteralNode;
import com.spreadsheet.formula.models.nodes.UnaryNode;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests the post-order driver over hand-built trees.
 */
class FormulaTreeWalkerTest {

    private final FormulaTreeWalker walker = new FormulaTreeWalker();

    @Test
    void testEveryNodeIsCached() {
        // SUM(c1:c2, -c3) * 2
        FormulaNode range = new CellRangeNode(new CellNode("c1"), new CellNode("c2"));
        FormulaNode negated = new UnaryNode("-", new CellNode("c3"));
        FormulaNode sum = new FunctionNode("SUM", Arrays.asList(range, negated));
        FormulaNode root = new BinaryNode("*", sum, new LiteralNode(2.0));

        ResultCache cache = new ResultCache();
        EvaluationResult result = walker.walk(root, new FormulaEvaluator(Arrays.asList(1, 2, 4), cache));

        assertEquals(EvaluationResult.ok(-2.0), result);
        assertEquals(EvaluationResult.ok(Arrays.asList(1.0, 2.0)), cache.get(range));
        assertEquals(EvaluationResult.ok(-4.0), cache.get(negated));
        assertEquals(EvaluationResult.ok(-1.0), cache.get(sum));
        assertSame(result, cache.get(root));
        // range endpoints are resolved by the range, not cached on their own
        assertEquals(6, cache.size());
    }

    @Test
    void testComparisonDispatch() {
        FormulaNode root = new BinaryNode(">=", new CellNode("c1"), new LiteralNode(3.0));
        EvaluationResult result = walker.walk(root, new FormulaEvaluator(Arrays.asList(3), new ResultCache()));
        assertEquals(EvaluationResult.ok(true), result);
    }

    /**
     * Nesting far deeper than a recursive walk could handle.
     */
    @Test
    void testDeepNesting() {
        FormulaNode node = new LiteralNode(1.0);
        for (int i = 0; i < 100_000; i++) {
            node = new UnaryNode("-", node);
        }
        EvaluationResult result = walker.walk(node, new FormulaEvaluator(Arrays.asList(), new ResultCache()));
        assertEquals(EvaluationResult.ok(1.0), result);
    }

    /**
     * A subtree reachable from two parents is evaluated once.
     */
    @Test
    void testSharedSubtree() {
        FormulaNode shared = new BinaryNode("+", new CellNode("c1"), new LiteralNode(1.0));
        FormulaNode root = new BinaryNode("*", shared, shared);

        ResultCache cache = new ResultCache();
        EvaluationResult result = walker.walk(root, new FormulaEvaluator(Arrays.asList(2), cache));
        assertEquals(EvaluationResult.ok(9.0), result);
        assertEquals(4, cache.size());
    }

    @Test
    void testFreshCachesGiveIdenticalResults() {
        FormulaNode root = new FunctionNode("IF", Arrays.asList(
                new BinaryNode(">", new CellNode("c1"), new LiteralNode(0.0)),
                new BinaryNode("/", new LiteralNode(1.0), new CellNode("c1")),
                new LiteralNode("non-positive")));
        List<Object> row = Arrays.asList(4);

        EvaluationResult first = walker.walk(root, new FormulaEvaluator(row, new ResultCache()));
        EvaluationResult second = walker.walk(root, new FormulaEvaluator(row, new ResultCache()));
        assertEquals(EvaluationResult.ok(0.25), first);
        assertEquals(first, second);
    }
}
