package com.spreadsheet.formula.exceptions;

/**
 * Thrown when a request is missing its formula or columns,
 * or asks for more rows than the service is configured to evaluate at once.
 */
public class InvalidRequestException extends RuntimeException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
