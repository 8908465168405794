package com.defaultrisk.domain.exception;

/**
 * The broker did not accept a batch job. The pipeline is never invoked for it.
 */
public class DispatchException extends RuntimeException {

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
