package com.spreadsheet.formula.models;

import java.util.List;

/**
 * Request body for evaluating one formula against one row:
 * { "formula": "=SUM(c1:c3)", "columns": [1, 2, 3] }
 */
public class FormulaRequest {
    private String formula;
    private List<Object> columns;

    // Default constructor needed for JSON deserialization
    public FormulaRequest() {
    }

    public FormulaRequest(String formula, List<Object> columns) {
        this.formula = formula;
        this.columns = columns;
    }

    public String getFormula() {
        return formula;
    }
    public List<Object> getColumns() {
        return columns;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setColumns(List<Object> columns) {
        this.columns = columns;
    }
}
