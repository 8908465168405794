package com.defaultrisk.domain.service;

import com.defaultrisk.domain.model.BatchSummary;

import java.util.ArrayList;
import java.util.List;

/**
 * Running counts of one pipeline run. Not thread-safe; owned by a single run.
 */
public final class BatchTally {

    public static final int DEFAULT_MAX_ERRORS = 5;
    static final int MAX_ERROR_LENGTH = 500;

    private final int maxErrors;
    private final List<String> errors = new ArrayList<>();
    private int processed;
    private int succeeded;
    private int failed;

    public BatchTally(int maxErrors) {
        if (maxErrors < 0) {
            throw new IllegalArgumentException("maxErrors must not be negative");
        }
        this.maxErrors = maxErrors;
    }

    public void recordSeen() {
        processed++;
    }

    public void recordSuccess() {
        succeeded++;
    }

    public void recordFailure(int recordNumber, String cause) {
        failed++;
        if (errors.size() < maxErrors) {
            String message = "Record " + recordNumber + ": " + cause;
            errors.add(message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message);
        }
    }

    public BatchSummary toSummary() {
        return new BatchSummary(processed, succeeded, failed, List.copyOf(errors));
    }
}
