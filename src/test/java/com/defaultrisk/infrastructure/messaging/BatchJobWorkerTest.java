package com.defaultrisk.infrastructure.messaging;

import com.defaultrisk.domain.exception.DatasetReadException;
import com.defaultrisk.domain.exception.DatasetSchemaException;
import com.defaultrisk.domain.model.BatchJobMessage;
import com.defaultrisk.domain.model.BatchSummary;
import com.defaultrisk.domain.model.DatasetRef;
import com.defaultrisk.domain.service.BatchJobService;
import com.defaultrisk.domain.service.BatchPredictionPipeline;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchJobWorkerTest {

    @Mock private BatchPredictionPipeline pipeline;
    @Mock private BatchJobService jobService;
    @Mock private Acknowledgment acknowledgment;

    private WorkerRegistry workerRegistry;
    private MeterRegistry meterRegistry;
    private BatchJobWorker worker;

    private final UUID jobId = UUID.randomUUID();
    private final DatasetRef ref = new DatasetRef("/staging/job.csv", "ratios.csv");

    @BeforeEach
    void setUp() {
        workerRegistry = new WorkerRegistry();
        meterRegistry = new SimpleMeterRegistry();
        worker = new BatchJobWorker(pipeline, jobService, workerRegistry, meterRegistry);
    }

    @Test
    void consume_pipelineSucceeds_completesJobThenAcknowledges() {
        BatchSummary summary = new BatchSummary(2, 2, 0, List.of());
        when(jobService.claim(eq(jobId), anyString())).thenReturn(true);
        when(pipeline.process(ref)).thenReturn(summary);

        worker.consumeBatchJob(record(message()), acknowledgment);

        InOrder inOrder = inOrder(jobService, acknowledgment);
        inOrder.verify(jobService).complete(jobId, summary);
        inOrder.verify(acknowledgment).acknowledge();
        verify(jobService, never()).fail(any(), any());
        assertEquals(1.0, meterRegistry.counter("batch.jobs.completed", "result", "success").count());

        WorkerRegistry.WorkerActivity activity =
                workerRegistry.activity(BatchJobWorker.currentWorkerName()).orElseThrow();
        assertNull(activity.getActiveJobId());
        assertEquals(1, activity.getJobsCompleted());
    }

    @Test
    void consume_schemaRejection_failsJobWithReason() {
        DatasetSchemaException rejection = new DatasetSchemaException(Set.of("stock_symbol"));
        when(jobService.claim(eq(jobId), anyString())).thenReturn(true);
        when(pipeline.process(ref)).thenThrow(rejection);

        worker.consumeBatchJob(record(message()), acknowledgment);

        verify(jobService).fail(jobId, "Dataset is missing required columns: [stock_symbol]");
        verify(jobService, never()).complete(any(), any());
        verify(acknowledgment).acknowledge();
        assertEquals(1.0, meterRegistry.counter("batch.jobs.completed", "result", "rejected").count());
    }

    @Test
    void consume_unreadableDataset_failsJob() {
        when(jobService.claim(eq(jobId), anyString())).thenReturn(true);
        when(pipeline.process(ref)).thenThrow(new DatasetReadException("Staged dataset not found: /staging/job.csv"));

        worker.consumeBatchJob(record(message()), acknowledgment);

        verify(jobService).fail(jobId, "Staged dataset not found: /staging/job.csv");
        verify(acknowledgment).acknowledge();
    }

    @Test
    void consume_unexpectedFailure_failsJobAndAcknowledges() {
        when(jobService.claim(eq(jobId), anyString())).thenReturn(true);
        when(pipeline.process(ref)).thenThrow(new IllegalStateException("connection refused"));

        worker.consumeBatchJob(record(message()), acknowledgment);

        verify(jobService).fail(jobId, "Batch processing failed: connection refused");
        verify(acknowledgment).acknowledge();
        assertEquals(1.0, meterRegistry.counter("batch.jobs.completed", "result", "error").count());
    }

    @Test
    void consume_jobNotClaimable_acknowledgesWithoutRunning() {
        when(jobService.claim(eq(jobId), anyString())).thenReturn(false);

        worker.consumeBatchJob(record(message()), acknowledgment);

        verifyNoInteractions(pipeline);
        verify(jobService, never()).complete(any(), any());
        verify(acknowledgment).acknowledge();
    }

    @Test
    void consume_outcomeNotRecorded_leavesMessageUnacknowledged() {
        BatchSummary summary = new BatchSummary(1, 1, 0, List.of());
        when(jobService.claim(eq(jobId), anyString())).thenReturn(true);
        when(pipeline.process(ref)).thenReturn(summary);
        doThrow(new IllegalStateException("database unavailable")).when(jobService).complete(jobId, summary);

        assertThrows(IllegalStateException.class, () -> worker.consumeBatchJob(record(message()), acknowledgment));

        verify(acknowledgment, never()).acknowledge();
        verify(jobService, never()).fail(any(), any());
        assertNull(workerRegistry.activity(BatchJobWorker.currentWorkerName()).orElseThrow().getActiveJobId());
        assertEquals(0.0, meterRegistry.counter("batch.jobs.completed", "result", "success").count());
        assertEquals(0.0, meterRegistry.counter("batch.jobs.completed", "result", "error").count());
    }

    @Test
    void consume_failureNotRecorded_leavesMessageUnacknowledged() {
        when(jobService.claim(eq(jobId), anyString())).thenReturn(true);
        when(pipeline.process(ref)).thenThrow(new DatasetSchemaException(Set.of("stock_symbol")));
        doThrow(new IllegalStateException("database unavailable")).when(jobService).fail(eq(jobId), anyString());

        assertThrows(IllegalStateException.class, () -> worker.consumeBatchJob(record(message()), acknowledgment));

        verify(acknowledgment, never()).acknowledge();
        verify(jobService, never()).complete(any(), any());
    }

    @Test
    void consume_malformedMessage_isAcknowledgedAndSkipped() {
        worker.consumeBatchJob(record(null), acknowledgment);

        verifyNoInteractions(pipeline, jobService);
        verify(acknowledgment).acknowledge();
    }

    @Test
    void currentWorkerName_stripsConsumerSuffix() throws InterruptedException {
        AtomicReference<String> name = new AtomicReference<>();
        Thread consumer = new Thread(() -> name.set(BatchJobWorker.currentWorkerName()), "batch-workers-1-C-1");
        consumer.start();
        consumer.join();

        assertEquals("batch-workers-1", name.get());
    }

    private BatchJobMessage message() {
        return BatchJobMessage.builder()
                .jobId(jobId)
                .datasetPath(ref.getPath())
                .originalFilename(ref.getOriginalFilename())
                .submittedAt(Instant.now())
                .build();
    }

    private ConsumerRecord<String, BatchJobMessage> record(BatchJobMessage message) {
        return new ConsumerRecord<>("default-risk.batch-jobs", 0, 42L, jobId.toString(), message);
    }
}
