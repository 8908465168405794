package com.defaultrisk.domain.model;

import lombok.Value;

import java.util.List;

/**
 * Dataset exactly as read from the file: the header row and the data rows as text cells.
 */
@Value
public class RawDataset {

    List<String> headers;
    List<List<String>> rows;

    public RawDataset(List<String> headers, List<List<String>> rows) {
        this.headers = List.copyOf(headers);
        this.rows = List.copyOf(rows);
    }
}
