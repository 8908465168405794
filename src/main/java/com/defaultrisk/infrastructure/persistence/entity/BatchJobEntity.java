package com.defaultrisk.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Recorded state of one dispatched batch job.
 *
 * Written PENDING by the dispatcher, moved to RUNNING and then to a terminal state by
 * the worker that picks the job up. {@code summaryJson} is set only on SUCCEEDED.
 */
@Entity
@Table(name = "batch_jobs", indexes = {
    @Index(name = "idx_job_status_created", columnList = "status,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchJobEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Builder.Default
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false, length = 1000)
    private String datasetPath;

    @Column(length = 255)
    private String originalFilename;

    @Column(length = 4000)
    private String summaryJson;

    @Column(length = 1000)
    private String errorMessage;

    @Column(length = 255)
    private String workerName;

    @Column(nullable = false)
    private Instant createdAt;

    @Column
    private Instant startedAt;

    @Column
    private Instant completedAt;

    public enum JobStatus {
        PENDING,
        RUNNING,
        SUCCEEDED,
        FAILED;

        public boolean isTerminal() {
            return this == SUCCEEDED || this == FAILED;
        }
    }

    @PrePersist
    protected void onCreate() {
        if (jobId == null) {
            jobId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    public void markRunning(String worker) {
        this.status = JobStatus.RUNNING;
        this.workerName = worker;
        this.startedAt = Instant.now();
    }

    public void markSucceeded(String summary) {
        this.status = JobStatus.SUCCEEDED;
        this.summaryJson = summary;
        this.errorMessage = null;
        this.completedAt = Instant.now();
    }

    public void markFailed(String error) {
        this.status = JobStatus.FAILED;
        this.errorMessage = truncate(error);
        this.completedAt = Instant.now();
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= 1000) {
            return error;
        }
        return error.substring(0, 1000);
    }
}
