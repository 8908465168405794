package com.defaultrisk.infrastructure.messaging;

import com.defaultrisk.domain.exception.DatasetReadException;
import com.defaultrisk.domain.exception.DatasetSchemaException;
import com.defaultrisk.domain.model.BatchJobMessage;
import com.defaultrisk.domain.model.BatchSummary;
import com.defaultrisk.domain.service.BatchJobService;
import com.defaultrisk.domain.service.BatchPredictionPipeline;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Worker pool consuming batch jobs from Kafka.
 *
 * Architecture:
 * - One listener container with {@code app.workers.concurrency} consumers; each consumer
 *   thread is one worker and runs one job at a time to completion
 * - Manual offset management: the offset is committed only after the job outcome is
 *   recorded, so a worker crash leads to redelivery (at-least-once)
 * - A redelivered job that is already terminal is acknowledged without running again
 *
 * Outcomes:
 * - Pipeline returns a summary: job SUCCEEDED with the summary
 * - Schema rejection or unreadable dataset: job FAILED with the reason
 * - Unexpected failure: job FAILED, logged with stack trace
 * - Failure to record the outcome: not acknowledged, the container redelivers; a
 *   summary that could not be stored never turns the job into FAILED
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchJobWorker {

    public static final String LISTENER_ID = "batch-workers";

    private final BatchPredictionPipeline pipeline;
    private final BatchJobService jobService;
    private final WorkerRegistry workerRegistry;
    private final MeterRegistry meterRegistry;

    @KafkaListener(
            id = LISTENER_ID,
            topics = "${app.kafka.topics.batch-jobs}",
            groupId = "${spring.kafka.consumer.group-id}",
            concurrency = "${app.workers.concurrency:2}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeBatchJob(ConsumerRecord<String, BatchJobMessage> record, Acknowledgment acknowledgment) {
        BatchJobMessage message = record.value();
        if (message == null || message.getJobId() == null) {
            log.warn("Discarding malformed batch job message at partition={}, offset={}",
                    record.partition(), record.offset());
            acknowledgment.acknowledge();
            return;
        }

        UUID jobId = message.getJobId();
        String worker = currentWorkerName();

        log.debug("Consumed batch job: partition={}, offset={}, jobId={}, worker={}",
                record.partition(), record.offset(), jobId, worker);

        if (!jobService.claim(jobId, worker)) {
            acknowledgment.acknowledge();
            return;
        }

        workerRegistry.jobStarted(worker, jobId);
        try {
            Optional<BatchSummary> summary = runPipeline(jobId, message);
            if (summary.isPresent()) {
                recordSuccess(jobId, worker, summary.get());
            }
        } finally {
            workerRegistry.jobFinished(worker);
        }

        // Commit offset only after the outcome is recorded
        acknowledgment.acknowledge();
    }

    /**
     * @return the summary, or empty when the job failed and that outcome has been recorded
     */
    private Optional<BatchSummary> runPipeline(UUID jobId, BatchJobMessage message) {
        try {
            return Optional.of(pipeline.process(message.toDatasetRef()));

        } catch (DatasetSchemaException | DatasetReadException e) {
            log.warn("Batch job {} rejected: {}", jobId, e.getMessage());
            jobService.fail(jobId, e.getMessage());
            countCompleted("rejected");

        } catch (Exception e) {
            log.error("Error processing batch job {}: {}", jobId, e.getMessage(), e);
            jobService.fail(jobId, "Batch processing failed: " + e.getMessage());
            countCompleted("error");
        }
        return Optional.empty();
    }

    private void recordSuccess(UUID jobId, String worker, BatchSummary summary) {
        try {
            jobService.complete(jobId, summary);
        } catch (RuntimeException e) {
            log.error("Batch job {} processed but its result could not be recorded, leaving it for redelivery: {}",
                    jobId, e.getMessage());
            throw e;
        }
        countCompleted("success");

        log.info("Batch job {} completed on {}: {} processed, {} succeeded, {} failed",
                jobId, worker, summary.getProcessed(), summary.getSucceeded(), summary.getFailed());
    }

    private void countCompleted(String result) {
        Counter.builder("batch.jobs.completed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    /**
     * Consumer threads are named {@code <container>-C-<n>}; the container part names the worker.
     */
    static String currentWorkerName() {
        return Thread.currentThread().getName().replaceFirst("-C-\\d+$", "");
    }
}
