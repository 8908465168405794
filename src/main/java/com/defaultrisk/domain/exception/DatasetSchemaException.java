package com.defaultrisk.domain.exception;

import java.util.Set;
import java.util.TreeSet;

/**
 * The dataset header lacks one or more required columns. Fatal for the whole batch.
 */
public class DatasetSchemaException extends RuntimeException {

    private final Set<String> missingColumns;

    public DatasetSchemaException(Set<String> missingColumns) {
        super("Dataset is missing required columns: " + new TreeSet<>(missingColumns));
        this.missingColumns = Set.copyOf(missingColumns);
    }

    public Set<String> getMissingColumns() {
        return missingColumns;
    }
}
