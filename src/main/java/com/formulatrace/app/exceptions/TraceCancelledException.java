package com.formulatrace.app.exceptions;

/**
 * Thrown when the caller cancels a trace before it completes.
 * No partial tree is returned.
 */
public class TraceCancelledException extends RuntimeException {
    public TraceCancelledException(String message) {
        super(message);
    }
}
