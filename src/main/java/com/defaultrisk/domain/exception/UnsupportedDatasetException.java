package com.defaultrisk.domain.exception;

/**
 * Upload rejected before staging: empty, or not a supported tabular format.
 */
public class UnsupportedDatasetException extends RuntimeException {

    public UnsupportedDatasetException(String message) {
        super(message);
    }
}
