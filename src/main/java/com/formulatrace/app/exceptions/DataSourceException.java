package com.formulatrace.app.exceptions;

/**
 * Thrown when the workbook data source fails to return a cell,
 * sheet list or formula grid. Aborts the whole trace.
 */
public class DataSourceException extends RuntimeException {
    public DataSourceException(String message) {
        super(message);
    }

    public DataSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
