package com.defaultrisk.domain.service;

import com.defaultrisk.domain.model.BatchSummary;
import com.defaultrisk.domain.model.DatasetRef;
import com.defaultrisk.domain.model.JobStatusView;
import com.defaultrisk.infrastructure.persistence.entity.BatchJobEntity;
import com.defaultrisk.infrastructure.persistence.repository.BatchJobRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Recorded lifecycle of batch jobs: PENDING -> RUNNING -> SUCCEEDED | FAILED.
 *
 * The summary of a succeeded job is stored as JSON on the job row and read back
 * through {@link #status(UUID)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchJobService {

    private final BatchJobRepository jobRepository;
    private final ObjectMapper objectMapper;

    @Transactional
    public BatchJobEntity create(DatasetRef datasetRef) {
        BatchJobEntity job = jobRepository.save(BatchJobEntity.builder()
                .datasetPath(datasetRef.getPath())
                .originalFilename(datasetRef.getOriginalFilename())
                .build());
        log.debug("Created batch job {} for {}", job.getJobId(), datasetRef.getOriginalFilename());
        return job;
    }

    /**
     * Move a job to RUNNING on behalf of a worker.
     *
     * @return false when the job is unknown or already terminal, in which case it must not be run
     */
    @Transactional
    public boolean claim(UUID jobId, String workerName) {
        Optional<BatchJobEntity> found = jobRepository.findById(jobId);
        if (found.isEmpty()) {
            log.warn("Batch job {} not found, nothing to run", jobId);
            return false;
        }
        BatchJobEntity job = found.get();
        if (job.getStatus().isTerminal()) {
            log.info("Batch job {} already {}, skipping redelivery", jobId, job.getStatus());
            return false;
        }
        if (job.getStatus() == BatchJobEntity.JobStatus.RUNNING) {
            log.warn("Batch job {} was left RUNNING by {}, running again on {}", jobId, job.getWorkerName(), workerName);
        }
        job.markRunning(workerName);
        jobRepository.save(job);
        return true;
    }

    @Transactional
    public void complete(UUID jobId, BatchSummary summary) {
        BatchJobEntity job = require(jobId);
        try {
            job.markSucceeded(objectMapper.writeValueAsString(summary));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize summary of job " + jobId, e);
        }
        jobRepository.save(job);
    }

    @Transactional
    public void fail(UUID jobId, String reason) {
        BatchJobEntity job = require(jobId);
        job.markFailed(reason);
        jobRepository.save(job);
    }

    @Transactional(readOnly = true)
    public Optional<JobStatusView> status(UUID jobId) {
        return jobRepository.findById(jobId).map(this::toView);
    }

    @Transactional(readOnly = true)
    public long countPending() {
        return jobRepository.countByStatus(BatchJobEntity.JobStatus.PENDING);
    }

    private BatchJobEntity require(UUID jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Batch job not found: " + jobId));
    }

    private JobStatusView toView(BatchJobEntity job) {
        return new JobStatusView(
                job.getJobId(),
                job.getStatus(),
                readSummary(job),
                job.getErrorMessage(),
                job.getWorkerName(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt());
    }

    private BatchSummary readSummary(BatchJobEntity job) {
        if (job.getSummaryJson() == null) {
            return null;
        }
        try {
            return objectMapper.readValue(job.getSummaryJson(), BatchSummary.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored summary of job " + job.getJobId() + " is unreadable", e);
        }
    }
}
