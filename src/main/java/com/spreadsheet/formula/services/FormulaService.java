package com.spreadsheet.formula.services;

import com.spreadsheet.formula.config.FormulaProperties;
import com.spreadsheet.formula.exceptions.InvalidRequestException;
import com.spreadsheet.formula.models.EvaluationResult;
import com.spreadsheet.formula.models.nodes.FormulaNode;
import com.spreadsheet.formula.parser.FormulaParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for evaluating formulas against rows of column values.
 * Every evaluation gets its own {@link FormulaEvaluator} and {@link ResultCache},
 * so this service holds no per-evaluation state and is safe to share across threads.
 */
@Service
public class FormulaService {

    private static final Logger log = LoggerFactory.getLogger(FormulaService.class);

    private final FormulaProperties properties;
    private final FormulaTreeWalker walker = new FormulaTreeWalker();

    @Autowired
    public FormulaService(FormulaProperties properties) {
        this.properties = properties;
    }

    // Default settings, for use outside a Spring context
    public FormulaService() {
        this(new FormulaProperties());
    }

    /**
     * Parses the formula and evaluates it against one row.
     * Throws FormulaParseException if the text is not a valid formula;
     * evaluation problems come back as an error result instead.
     */
    public EvaluationResult evaluate(List<?> columns, String formula) {
        requireFormula(formula);
        log.debug("Evaluating '{}' against {} columns", formula, columns == null ? 0 : columns.size());
        return evaluate(columns, FormulaParser.parse(formula, properties.getMaxDepth()));
    }

    /**
     * Evaluates an already parsed tree against one row, with a fresh cache.
     */
    public EvaluationResult evaluate(List<?> columns, FormulaNode tree) {
        if (columns == null) {
            throw new InvalidRequestException("Columns are required");
        }
        FormulaEvaluator evaluator = new FormulaEvaluator(columns, new ResultCache());
        EvaluationResult result = walker.walk(tree, evaluator);
        if (result.isError() && properties.isLogEvaluationErrors()) {
            // the tree itself is not logged: its toString recurses through every level
            log.debug("{} formula evaluated to {}", tree.getKind(), result);
        }
        return result;
    }

    /**
     * Parses the formula once and evaluates it against each row in order.
     */
    public List<EvaluationResult> evaluateRows(List<? extends List<?>> rows, String formula) {
        requireFormula(formula);
        if (rows == null) {
            throw new InvalidRequestException("Rows are required");
        }
        if (rows.size() > properties.getMaxBatchRows()) {
            throw new InvalidRequestException("Too many rows: " + rows.size()
                    + " (limit is " + properties.getMaxBatchRows() + ")");
        }

        FormulaNode tree = FormulaParser.parse(formula, properties.getMaxDepth());
        log.debug("Evaluating '{}' against {} rows", formula, rows.size());
        List<EvaluationResult> results = new ArrayList<>(rows.size());
        for (List<?> row : rows) {
            results.add(evaluate(row, tree));
        }
        return results;
    }

    public List<String> getSupportedFunctions() {
        return FormulaEvaluator.SUPPORTED_FUNCTIONS;
    }

    private void requireFormula(String formula) {
        if (formula == null) {
            throw new InvalidRequestException("Formula is required");
        }
    }
}
