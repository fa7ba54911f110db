package com.spreadsheet.formula.controllers;

import com.spreadsheet.formula.models.EvaluationResult;
import com.spreadsheet.formula.models.FormulaBatchRequest;
import com.spreadsheet.formula.models.FormulaRequest;
import com.spreadsheet.formula.services.FormulaService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST endpoints for evaluating formulas.
 * "/formula" is the base path.
 */
@RestController
@RequestMapping("/formula")
public class FormulaController {

    @Autowired
    private FormulaService formulaService;

    /**
     * POST /formula/evaluate
     * Body: { "formula": "...", "columns": [...] }.
     * Always 200 once the formula parses; an evaluation error is reported
     * in the "error" field of the result. Unparseable formulas are a 400.
     */
    @PostMapping("/evaluate")
    public ResponseEntity<EvaluationResult> evaluate(@RequestBody FormulaRequest request) {
        EvaluationResult result = formulaService.evaluate(request.getColumns(), request.getFormula());
        return ResponseEntity.ok(result);
    }

    /**
     * POST /formula/evaluate/rows
     * Body: { "formula": "...", "rows": [[...], [...]] }.
     * Returns one result per row, in row order.
     */
    @PostMapping("/evaluate/rows")
    public ResponseEntity<List<EvaluationResult>> evaluateRows(@RequestBody FormulaBatchRequest request) {
        List<EvaluationResult> results = formulaService.evaluateRows(request.getRows(), request.getFormula());
        return ResponseEntity.ok(results);
    }

    /**
     * GET /formula/functions
     * Lists the function names formulas may call.
     */
    @GetMapping("/functions")
    public ResponseEntity<List<String>> getFunctions() {
        return ResponseEntity.ok(formulaService.getSupportedFunctions());
    }
}
