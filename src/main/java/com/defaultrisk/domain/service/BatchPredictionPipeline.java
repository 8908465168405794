package com.defaultrisk.domain.service;

import com.defaultrisk.domain.model.BatchSummary;
import com.defaultrisk.domain.model.CompanyDescriptor;
import com.defaultrisk.domain.model.DatasetColumn;
import com.defaultrisk.domain.model.DatasetRecord;
import com.defaultrisk.domain.model.DatasetRef;
import com.defaultrisk.domain.model.FinancialRatios;
import com.defaultrisk.domain.model.ScoreResult;
import com.defaultrisk.domain.model.ValidatedDataset;
import com.defaultrisk.infrastructure.dataset.DatasetReader;
import com.defaultrisk.infrastructure.dataset.DatasetStagingService;
import com.defaultrisk.infrastructure.persistence.BatchSession;
import com.defaultrisk.infrastructure.persistence.BatchSessionFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.math.RoundingMode;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Bulk prediction pipeline with per-record failure isolation.
 *
 * Processing Flow:
 * 1. Open one persistence session for the whole batch
 * 2. Read and validate the staged dataset (a schema failure rejects the batch)
 * 3. For each record, in input order, as its own unit of work:
 *    extract fields, resolve the company, score the ratios, record the prediction, commit
 * 4. Return the batch summary
 *
 * Failure Handling:
 * - Missing required column: {@code DatasetSchemaException} propagates, nothing is written
 * - Any failure inside one record: that record is rolled back, counted as failed and
 *   described in the summary; processing continues with the next record
 * - Company fields that do not fit the company table (see {@link CompanyDescriptor})
 *   fail the record before anything is written for it
 * - Session release and removal of the staged file happen on every exit path and
 *   never throw
 *
 * Records are processed strictly sequentially: the session is not shared across threads
 * and the error list must follow input order.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchPredictionPipeline {

    private final DatasetReader datasetReader;
    private final BatchValidator batchValidator;
    private final BatchSessionFactory sessionFactory;
    private final CompanyResolver companyResolver;
    private final RiskScorer riskScorer;
    private final PredictionRecorder predictionRecorder;
    private final DatasetStagingService stagingService;
    private final MeterRegistry meterRegistry;
    private final Validator validator;

    @Value("${app.batch.max-errors:5}")
    private int maxErrors = BatchTally.DEFAULT_MAX_ERRORS;

    public BatchSummary process(DatasetRef datasetRef) {
        Timer.Sample sample = Timer.start(meterRegistry);
        BatchTally tally = new BatchTally(maxErrors);

        try (BatchSession session = sessionFactory.open()) {
            ValidatedDataset dataset = batchValidator.validate(datasetReader.read(datasetRef));
            log.info("Processing dataset {} with {} records", datasetRef.getOriginalFilename(), dataset.size());

            for (DatasetRecord record : dataset.getRecords()) {
                processRecord(session, record, tally);
            }
        } finally {
            stagingService.discard(datasetRef);
        }

        BatchSummary summary = tally.toSummary();

        sample.stop(Timer.builder("batch.processing.latency")
                .register(meterRegistry));

        log.info("Dataset {} processed: {} records, {} succeeded, {} failed",
                datasetRef.getOriginalFilename(), summary.getProcessed(), summary.getSucceeded(), summary.getFailed());

        return summary;
    }

    private void processRecord(BatchSession session, DatasetRecord record, BatchTally tally) {
        int recordNumber = record.getRecordNumber();
        tally.recordSeen();

        try {
            session.begin();

            // Step 1: Extract fields (absent ratios stay absent)
            CompanyDescriptor descriptor = companyOf(record);
            FinancialRatios ratios = record.ratios();

            // Step 2: Resolve company
            UUID companyId = companyResolver.resolve(descriptor);

            // Step 3: Score
            ScoreResult result = riskScorer.score(ratios);

            // Step 4: Persist and commit this record only
            predictionRecorder.record(companyId, result);
            session.commit();

            tally.recordSuccess();

            Counter.builder("batch.records.processed")
                    .tag("result", "success")
                    .register(meterRegistry)
                    .increment();

            log.debug("Record {} ({}) scored {}", recordNumber, descriptor.getSymbol(), result.getRiskLevel());

        } catch (RuntimeException e) {
            rollbackQuietly(session, recordNumber);

            String cause = FailureMessages.describe(e);
            tally.recordFailure(recordNumber, cause);

            Counter.builder("batch.records.processed")
                    .tag("result", "failed")
                    .register(meterRegistry)
                    .increment();

            log.warn("Error processing record {}: {}", recordNumber, cause);
        }
    }

    private void rollbackQuietly(BatchSession session, int recordNumber) {
        try {
            session.rollback();
        } catch (RuntimeException e) {
            log.warn("Rollback of record {} failed: {}", recordNumber, e.getMessage(), e);
        }
    }

    private CompanyDescriptor companyOf(DatasetRecord record) {
        CompanyDescriptor descriptor = new CompanyDescriptor(
                record.requiredText(DatasetColumn.STOCK_SYMBOL),
                record.requiredText(DatasetColumn.COMPANY_NAME),
                record.decimal(DatasetColumn.MARKET_CAP)
                        .map(value -> value.setScale(CompanyDescriptor.MARKET_CAP_SCALE, RoundingMode.HALF_UP))
                        .orElse(null),
                record.text(DatasetColumn.SECTOR).orElse(null));

        Set<ConstraintViolation<CompanyDescriptor>> violations = validator.validate(descriptor);
        if (!violations.isEmpty()) {
            throw new IllegalArgumentException(violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.joining("; ")));
        }
        return descriptor;
    }
}
