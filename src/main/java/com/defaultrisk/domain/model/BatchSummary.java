package com.defaultrisk.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregate outcome of one pipeline run.
 *
 * {@code errors} holds at most the first few record failures, in record order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchSummary {

    private int processed;
    private int succeeded;
    private int failed;
    private List<String> errors;

    public static BatchSummary empty() {
        return new BatchSummary(0, 0, 0, List.of());
    }
}
