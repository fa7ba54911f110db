package com.spreadsheet.formula.models;

import java.util.List;

/**
 * Request body for evaluating one formula against many rows:
 * { "formula": "c1*2", "rows": [[1], [2], [3]] }
 */
public class FormulaBatchRequest {
    private String formula;
    private List<List<Object>> rows;

    public FormulaBatchRequest() {
    }

    public FormulaBatchRequest(String formula, List<List<Object>> rows) {
        this.formula = formula;
        this.rows = rows;
    }

    public String getFormula() {
        return formula;
    }
    public List<List<Object>> getRows() {
        return rows;
    }
    public void setFormula(String formula) {
        this.formula = formula;
    }
    public void setRows(List<List<Object>> rows) {
        this.rows = rows;
    }
}
