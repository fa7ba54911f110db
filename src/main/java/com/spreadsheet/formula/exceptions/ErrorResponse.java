package com.spreadsheet.formula.exceptions;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "PARSE_ERROR",
 *   "message": "Unexpected token ')' at position 4"
 * }
 * Formula evaluation errors are not reported this way; they are part of
 * a normal 200 response.
 */
public class ErrorResponse {
    private final String code;
    private final String message;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }
}
