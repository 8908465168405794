package com.defaultrisk.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Dataset whose header has passed schema validation; records are in input order.
 */
@Value
public class ValidatedDataset {

    List<DatasetRecord> records;

    public ValidatedDataset(List<DatasetRecord> records) {
        this.records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
