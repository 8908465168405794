package com.defaultrisk.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Message placed on the batch-jobs topic by the dispatcher and consumed by workers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobMessage {

    private UUID jobId;
    private String datasetPath;
    private String originalFilename;
    private Instant submittedAt;

    public DatasetRef toDatasetRef() {
        return new DatasetRef(datasetPath, originalFilename);
    }
}
