package com.formulatrace.app.exceptions;

/**
 * Thrown when a request names something other than a single cell,
 * e.g. "A1:B2" or "A1,C3" as a trace target.
 */
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super(message);
    }
}
