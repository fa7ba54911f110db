package com.spreadsheet.formula.services;

import java.util.ArrayList;
import java.util.List;

/**
 * Type tests and coercions shared by the operators and functions.
 * Numbers are any {@link Number}; everything numeric is computed as double.
 */
public final class FormulaValues {

    private FormulaValues() {
        // Utility class
    }

    public static boolean isNumber(Object value) {
        return value instanceof Number;
    }

    public static double toDouble(Object value) {
        return ((Number) value).doubleValue();
    }

    /**
     * Column values come in as whatever the caller holds (Integer, Long, BigDecimal...).
     * Numbers are widened to Double so results compare consistently; other values pass through.
     */
    public static Object normalize(Object value) {
        if (value instanceof Number && !(value instanceof Double)) {
            return ((Number) value).doubleValue();
        }
        return value;
    }

    /**
     * Spreadsheet truthiness: false, 0, NaN, the empty string and missing values are falsy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            double d = toDouble(value);
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String) {
            return !((String) value).isEmpty();
        }
        return true;
    }

    /**
     * Expands range values (lists) one level deep, keeping every other value in place.
     */
    public static List<Object> flatten(List<?> args) {
        List<Object> flat = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof List) {
                flat.addAll((List<?>) arg);
            } else {
                flat.add(arg);
            }
        }
        return flat;
    }

    public static List<Double> numbers(List<?> values) {
        List<Double> numbers = new ArrayList<>();
        for (Object value : values) {
            if (isNumber(value)) {
                numbers.add(toDouble(value));
            }
        }
        return numbers;
    }
}
