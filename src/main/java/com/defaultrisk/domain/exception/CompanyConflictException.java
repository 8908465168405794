package com.defaultrisk.domain.exception;

/**
 * The insert for a company symbol violated a constraint and no company with that
 * symbol is visible to a lookup. Usually a concurrent writer whose row is not yet
 * visible; resolution is retried.
 */
public class CompanyConflictException extends RuntimeException {

    public CompanyConflictException(String symbol, String detail, Throwable cause) {
        super("Company " + symbol + " could not be created: " + detail, cause);
    }
}
