package com.spreadsheet.formula.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings bound from the "formula.*" keys in application.properties.
 */
@ConfigurationProperties(prefix = "formula")
public class FormulaProperties {

    // Upper bound on rows accepted by one batch evaluation
    private int maxBatchRows = 10_000;

    // Deepest nesting of parentheses, function calls and prefix operators the parser accepts
    private int maxDepth = 200;

    // When true, every error result is logged at DEBUG
    private boolean logEvaluationErrors = false;

    public int getMaxBatchRows() {
        return maxBatchRows;
    }
    public void setMaxBatchRows(int maxBatchRows) {
        this.maxBatchRows = maxBatchRows;
    }
    public int getMaxDepth() {
        return maxDepth;
    }
    public void setMaxDepth(int maxDepth) {
        this.maxDepth = maxDepth;
    }
    public boolean isLogEvaluationErrors() {
        return logEvaluationErrors;
    }
    public void setLogEvaluationErrors(boolean logEvaluationErrors) {
        this.logEvaluationErrors = logEvaluationErrors;
    }
}
