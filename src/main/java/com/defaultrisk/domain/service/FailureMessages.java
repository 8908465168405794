package com.defaultrisk.domain.service;

import jakarta.persistence.PersistenceException;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.dao.DataAccessException;
import org.springframework.transaction.TransactionException;

/**
 * Turns a record failure into the one-line cause reported in the batch summary.
 *
 * Persistence failures are reported by their root cause, without the SQL text the
 * driver appends.
 */
final class FailureMessages {

    private static final String SQL_STATEMENT_MARKER = "; SQL statement";

    private FailureMessages() {
    }

    static String describe(Throwable e) {
        Throwable source = isPersistenceFailure(e) ? NestedExceptionUtils.getMostSpecificCause(e) : e;
        String message = source.getMessage();
        if (message == null || message.isBlank()) {
            return source.getClass().getSimpleName();
        }
        if (source != e) {
            message = stripStatement(message);
        }
        return message;
    }

    static String stripStatement(String message) {
        int lineEnd = message.indexOf('\n');
        String line = lineEnd >= 0 ? message.substring(0, lineEnd) : message;
        int marker = line.indexOf(SQL_STATEMENT_MARKER);
        if (marker >= 0) {
            line = line.substring(0, marker);
        }
        return line.trim();
    }

    private static boolean isPersistenceFailure(Throwable e) {
        return e instanceof DataAccessException
                || e instanceof TransactionException
                || e instanceof PersistenceException;
    }
}
