package com.spreadsheet.formula.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Outcome of evaluating one formula node: either a value
 * (Double, String, Boolean, or a List of those for a range)
 * or an error message. Never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class EvaluationResult {

    public static final String NOT_IMPLEMENTED = "not implemented";

    private final Object value;
    private final String error;
    private final ErrorKind errorKind;

    private EvaluationResult(Object value, String error, ErrorKind errorKind) {
        this.value = value;
        this.error = error;
        this.errorKind = errorKind;
    }

    public static EvaluationResult ok(Object value) {
        return new EvaluationResult(value, null, null);
    }

    public static EvaluationResult error(ErrorKind kind, String message) {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
        return new EvaluationResult(null, message, kind);
    }

    public static EvaluationResult notImplemented() {
        return error(ErrorKind.UNIMPLEMENTED, NOT_IMPLEMENTED);
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }

    public Object getValue() {
        return value;
    }

    // null when the result is a value
    public String getError() {
        return error;
    }

    public ErrorKind getErrorKind() {
        return errorKind;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EvaluationResult)) {
            return false;
        }
        EvaluationResult other = (EvaluationResult) o;
        return Objects.equals(value, other.value)
                && Objects.equals(error, other.error)
                && errorKind == other.errorKind;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, error, errorKind);
    }

    @Override
    public String toString() {
        return isError()
                ? "Err[" + errorKind + ": " + error + "]"
                : "Ok[" + value + "]";
    }
}
