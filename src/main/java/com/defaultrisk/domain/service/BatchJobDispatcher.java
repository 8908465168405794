package com.defaultrisk.domain.service;

import com.defaultrisk.domain.exception.DispatchException;
import com.defaultrisk.domain.model.BatchJobMessage;
import com.defaultrisk.domain.model.DatasetRef;
import com.defaultrisk.domain.model.JobHandle;
import com.defaultrisk.infrastructure.persistence.entity.BatchJobEntity;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands batch jobs to the worker pool through Kafka.
 *
 * How It Works:
 * 1. Record the job as PENDING (committed before the message exists)
 * 2. Publish a {@link BatchJobMessage} keyed by job id
 * 3. Wait for the broker acknowledgment, never for a worker
 *
 * Delivery:
 * - The topic retains the message until a consumer in the worker group commits past
 *   it, so a job submitted while no worker is running stays queued
 * - Workers commit only after recording the outcome (at-least-once)
 * - A send the broker does not acknowledge marks the job FAILED and raises
 *   {@link DispatchException}; the pipeline never runs for it
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchJobDispatcher {

    private final BatchJobService jobService;
    private final KafkaTemplate<String, BatchJobMessage> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${app.kafka.topics.batch-jobs}")
    private String batchJobsTopic;

    @Value("${app.dispatch.send-timeout-ms:10000}")
    private long sendTimeoutMs = 10_000L;

    public JobHandle submit(DatasetRef datasetRef) {
        BatchJobEntity job = jobService.create(datasetRef);

        BatchJobMessage message = BatchJobMessage.builder()
                .jobId(job.getJobId())
                .datasetPath(datasetRef.getPath())
                .originalFilename(datasetRef.getOriginalFilename())
                .submittedAt(Instant.now())
                .build();

        try {
            kafkaTemplate.send(batchJobsTopic, job.getJobId().toString(), message)
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw dispatchFailed(job, e);
        } catch (ExecutionException e) {
            throw dispatchFailed(job, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException | RuntimeException e) {
            throw dispatchFailed(job, e);
        }

        Counter.builder("batch.jobs.dispatched")
                .tag("result", "success")
                .register(meterRegistry)
                .increment();

        log.info("Dispatched batch job {} for {} to topic {}", job.getJobId(), datasetRef.getOriginalFilename(), batchJobsTopic);
        return new JobHandle(job.getJobId(), BatchJobEntity.JobStatus.PENDING);
    }

    private DispatchException dispatchFailed(BatchJobEntity job, Throwable cause) {
        log.error("Failed to dispatch batch job {}: {}", job.getJobId(), cause.getMessage(), cause);

        Counter.builder("batch.jobs.dispatched")
                .tag("result", "failed")
                .register(meterRegistry)
                .increment();

        String reason = "Dispatch failed: " + cause.getMessage();
        try {
            jobService.fail(job.getJobId(), reason);
        } catch (RuntimeException e) {
            log.error("Failed to record dispatch failure of job {}: {}", job.getJobId(), e.getMessage(), e);
        }
        return new DispatchException("Batch job could not be queued: " + cause.getMessage(), cause);
    }
}
