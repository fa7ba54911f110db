package com.spreadsheet.formula.models;

/**
 * Categories of formula errors.
 * The message carried by an {@link EvaluationResult} is what users see;
 * the kind lets callers branch without parsing that message.
 */
public enum ErrorKind {
    INVALID_REFERENCE,
    COLUMN_INDEX_OUT_OF_RANGE,
    ARITHMETIC_INVALID,
    ARITY_ERROR,
    UNIMPLEMENTED,
    INTERNAL_FAILURE
}
