package com.defaultrisk.domain.model;

import com.defaultrisk.infrastructure.persistence.entity.BatchJobEntity;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Externally visible state of a batch job. {@code result} is present only once the
 * job has succeeded, {@code error} only once it has failed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatusView {

    private UUID jobId;
    private BatchJobEntity.JobStatus status;
    private BatchSummary result;
    private String error;
    private String worker;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
}
