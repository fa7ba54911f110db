package com.spreadsheet.formula.services;

import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.EvaluationResult;
import com.spreadsheet.formula.models.nodes.FormulaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates individual formula nodes against one row of column values.
 * <p>
 * Every operation returns an {@link EvaluationResult}; errors are data and are
 * never thrown. Operands arrive already evaluated, either as results or as
 * nodes whose results are read from the shared {@link ResultCache}.
 * One instance serves exactly one evaluation.
 */
public class FormulaEvaluator {

    private static final Logger log = LoggerFactory.getLogger(FormulaEvaluator.class);

    // "c" or "C" followed by the 1-based column number; anything after the digits is ignored
    private static final Pattern CELL_KEY_PATTERN = Pattern.compile("^[cC](\\d+)");

    public static final List<String> SUPPORTED_FUNCTIONS = Collections.unmodifiableList(Arrays.asList(
            "ABS", "AND", "AVG", "COUNT", "IF", "IFERROR", "MAX", "MIN", "MOD", "OR", "SUM"));

    private static final String AT_LEAST_ONE_ARGUMENT = "requires at least 1 argument";

    private final List<?> columns;
    private final ResultCache cache;

    public FormulaEvaluator(List<?> columns, ResultCache cache) {
        this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
        this.cache = cache;
    }

    public ResultCache getResultCache() {
        return cache;
    }

    // ----------------------------------------------------------------
    // References
    // ----------------------------------------------------------------

    /**
     * Resolves a reference such as {@code c3} to its 0-based column index (as an Integer value).
     */
    public EvaluationResult resolveColumnIndex(String key) {
        Matcher matcher = key == null ? null : CELL_KEY_PATTERN.matcher(key);
        if (matcher == null || !matcher.lookingAt()) {
            return EvaluationResult.error(ErrorKind.INVALID_REFERENCE, "invalid reference");
        }
        int index;
        try {
            index = Integer.parseInt(matcher.group(1)) - 1;
        } catch (NumberFormatException e) {
            // more digits than an int holds, certainly past the last column
            return columnOutOfRange();
        }
        if (index < 0 || index >= columns.size()) {
            return columnOutOfRange();
        }
        return EvaluationResult.ok(index);
    }

    public EvaluationResult resolveColumnValue(String key) {
        EvaluationResult index = resolveColumnIndex(key);
        if (index.isError()) {
            return index;
        }
        return EvaluationResult.ok(columnAt((Integer) index.getValue()));
    }

    /**
     * Returns the values from the start column through the end column, inclusive.
     * An end before the start yields an empty list.
     */
    public EvaluationResult resolveRange(String startKey, String endKey) {
        EvaluationResult start = resolveColumnIndex(startKey);
        if (start.isError()) {
            return start;
        }
        EvaluationResult end = resolveColumnIndex(endKey);
        if (end.isError()) {
            return end;
        }

        List<Object> values = new ArrayList<>();
        for (int i = (Integer) start.getValue(); i <= (Integer) end.getValue(); i++) {
            values.add(columnAt(i));
        }
        return EvaluationResult.ok(Collections.unmodifiableList(values));
    }

    // ----------------------------------------------------------------
    // Operators
    // ----------------------------------------------------------------

    /**
     * Applies {@code + - * / ^ %} to two numeric operands.
     * Infinite or NaN results become errors whose message is the quoted value.
     */
    public EvaluationResult evalBinary(String operator, EvaluationResult left, EvaluationResult right) {
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }
        Object a = left.getValue();
        Object b = right.getValue();

        if (!FormulaValues.isNumber(a) || !FormulaValues.isNumber(b)) {
            return EvaluationResult.notImplemented();
        }

        double x = FormulaValues.toDouble(a);
        double y = FormulaValues.toDouble(b);
        double value;
        switch (operator) {
            case "+":
                value = x + y;
                break;
            case "-":
                value = x - y;
                break;
            case "*":
                value = x * y;
                break;
            case "/":
                value = x / y;
                break;
            case "^":
                value = Math.pow(x, y);
                break;
            case "%":
                value = x % y;
                break;
            default:
                return EvaluationResult.notImplemented();
        }

        if (Double.isInfinite(value) || Double.isNaN(value)) {
            return EvaluationResult.error(ErrorKind.ARITHMETIC_INVALID, "'" + value + "'");
        }
        return EvaluationResult.ok(value);
    }

    public EvaluationResult evalComparison(String operator, EvaluationResult left, EvaluationResult right) {
        if (left.isError()) {
            return left;
        }
        if (right.isError()) {
            return right;
        }
        Object a = left.getValue();
        Object b = right.getValue();
        if (!FormulaValues.isNumber(a) || !FormulaValues.isNumber(b)) {
            return EvaluationResult.notImplemented();
        }

        double x = FormulaValues.toDouble(a);
        double y = FormulaValues.toDouble(b);
        switch (operator) {
            case "=":
                return EvaluationResult.ok(x == y);
            case "<>":
                return EvaluationResult.ok(x != y);
            case ">":
                return EvaluationResult.ok(x > y);
            case "<":
                return EvaluationResult.ok(x < y);
            case ">=":
                return EvaluationResult.ok(x >= y);
            case "<=":
                return EvaluationResult.ok(x <= y);
            default:
                return EvaluationResult.notImplemented();
        }
    }

    /**
     * Prefix {@code +} and {@code -}. A non-numeric operand is not implemented.
     */
    public EvaluationResult evalUnary(String operator, EvaluationResult operand) {
        if (operand.isError()) {
            return operand;
        }
        Object a = operand.getValue();
        if (!FormulaValues.isNumber(a)) {
            return EvaluationResult.notImplemented();
        }
        double x = FormulaValues.toDouble(a);
        switch (operator) {
            case "+":
                return EvaluationResult.ok(x);
            case "-":
                return EvaluationResult.ok(-x);
            default:
                return EvaluationResult.notImplemented();
        }
    }

    // ----------------------------------------------------------------
    // Functions
    // ----------------------------------------------------------------

    /**
     * Applies a named function to already-evaluated argument nodes.
     * Any runtime failure inside a function body becomes an {@link ErrorKind#INTERNAL_FAILURE} result.
     * IF and IFERROR read their branches straight from the cache instead of gathering arguments.
     */
    public EvaluationResult evalFunction(String name, List<FormulaNode> argNodes) {
        String function = name == null ? "" : name.toUpperCase(Locale.ROOT);
        if ("IF".equals(function)) {
            return evalIf(argNodes);
        }
        if ("IFERROR".equals(function)) {
            return evalIfError(argNodes);
        }

        List<Object> args = getArgs(argNodes);
        try {
            return evalOverArguments(function, args);
        } catch (RuntimeException ex) {
            log.warn("Function {} failed", function, ex);
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getName();
            return EvaluationResult.error(ErrorKind.INTERNAL_FAILURE, message);
        }
    }

    /**
     * Collects the values of the argument nodes. If any argument is an error the
     * whole list is empty; the individual error is not reported.
     */
    List<Object> getArgs(List<FormulaNode> argNodes) {
        List<Object> args = new ArrayList<>();
        for (FormulaNode node : argNodes) {
            EvaluationResult result = cache.get(node);
            if (result.isError()) {
                return Collections.emptyList();
            }
            args.add(result.getValue());
        }
        return args;
    }

    private EvaluationResult evalOverArguments(String function, List<Object> args) {
        List<Object> flat = FormulaValues.flatten(args);
        switch (function) {
            case "SUM":
                return EvaluationResult.ok(sum(FormulaValues.numbers(flat)));

            case "AVG": {
                List<Double> numbers = FormulaValues.numbers(flat);
                if (numbers.isEmpty()) {
                    return arityError(AT_LEAST_ONE_ARGUMENT);
                }
                return EvaluationResult.ok(sum(numbers) / numbers.size());
            }

            case "MOD": {
                List<Double> numbers = FormulaValues.numbers(flat);
                if (numbers.size() != 2) {
                    return arityError("too many arguments or not numbers");
                }
                return EvaluationResult.ok(numbers.get(0) % numbers.get(1));
            }

            case "ABS": {
                // Broader than "several arguments and a non-numeric first": a missing or lone
                // non-numeric first argument is rejected too, rather than yielding NaN
                Object first = args.isEmpty() ? null : args.get(0);
                if (!FormulaValues.isNumber(first)) {
                    return arityError("too many arguments or not a number");
                }
                return EvaluationResult.ok(Math.abs(FormulaValues.toDouble(first)));
            }

            case "MIN":
            case "MAX": {
                List<Double> numbers = FormulaValues.numbers(flat);
                if (numbers.isEmpty()) {
                    return arityError(AT_LEAST_ONE_ARGUMENT);
                }
                return EvaluationResult.ok("MIN".equals(function) ? Collections.min(numbers) : Collections.max(numbers));
            }

            case "COUNT":
                return EvaluationResult.ok((double) flat.size());

            case "OR":
                if (flat.isEmpty()) {
                    return arityError(AT_LEAST_ONE_ARGUMENT);
                }
                return EvaluationResult.ok(flat.stream().anyMatch(FormulaValues::isTruthy));

            case "AND":
                if (flat.isEmpty()) {
                    return arityError(AT_LEAST_ONE_ARGUMENT);
                }
                return EvaluationResult.ok(flat.stream().allMatch(FormulaValues::isTruthy));

            default:
                return EvaluationResult.notImplemented();
        }
    }

    // Both branches were evaluated already; only the chosen one's result is returned
    private EvaluationResult evalIf(List<FormulaNode> argNodes) {
        if (argNodes.size() != 3) {
            return arityError("requires 3 arguments");
        }
        EvaluationResult condition = cache.get(argNodes.get(0));
        boolean taken = !condition.isError() && FormulaValues.isTruthy(condition.getValue());
        return cache.get(argNodes.get(taken ? 1 : 2));
    }

    private EvaluationResult evalIfError(List<FormulaNode> argNodes) {
        if (argNodes.size() != 2) {
            return arityError("requires 2 arguments");
        }
        EvaluationResult first = cache.get(argNodes.get(0));
        return first.isError() ? cache.get(argNodes.get(1)) : first;
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private Object columnAt(int index) {
        return FormulaValues.normalize(columns.get(index));
    }

    private static double sum(List<Double> numbers) {
        double total = 0;
        for (double n : numbers) {
            total += n;
        }
        return total;
    }

    private static EvaluationResult arityError(String message) {
        return EvaluationResult.error(ErrorKind.ARITY_ERROR, message);
    }

    private static EvaluationResult columnOutOfRange() {
        return EvaluationResult.error(ErrorKind.COLUMN_INDEX_OUT_OF_RANGE, "column index out of range");
    }
}
