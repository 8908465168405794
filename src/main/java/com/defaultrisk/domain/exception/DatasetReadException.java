package com.defaultrisk.domain.exception;

/**
 * The staged dataset could not be opened or parsed as a table.
 */
public class DatasetReadException extends RuntimeException {

    public DatasetReadException(String message) {
        super(message);
    }

    public DatasetReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
