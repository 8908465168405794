package com.defaultrisk.infrastructure.persistence;

import com.defaultrisk.domain.exception.DatasetSchemaException;
import com.defaultrisk.domain.model.BatchSummary;
import com.defaultrisk.domain.model.DatasetRef;
import com.defaultrisk.domain.model.RiskLevel;
import com.defaultrisk.domain.service.BatchPredictionPipeline;
import com.defaultrisk.domain.service.BatchValidator;
import com.defaultrisk.domain.service.CompanyResolver;
import com.defaultrisk.domain.service.HeuristicRiskScorer;
import com.defaultrisk.domain.service.PredictionRecorder;
import com.defaultrisk.infrastructure.dataset.DatasetReader;
import com.defaultrisk.infrastructure.dataset.DatasetStagingService;
import com.defaultrisk.infrastructure.persistence.entity.CompanyEntity;
import com.defaultrisk.infrastructure.persistence.entity.FinancialRatioEntity;
import com.defaultrisk.infrastructure.persistence.entity.PredictionEntity;
import com.defaultrisk.infrastructure.persistence.repository.CompanyRepository;
import com.defaultrisk.infrastructure.persistence.repository.FinancialRatioRepository;
import com.defaultrisk.infrastructure.persistence.repository.PredictionRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.validation.beanvalidation.LocalValidatorFactoryBean;
import org.springframework.transaction.annotation.Transactional;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the pipeline against an embedded database, one real transaction per record.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@Import({
        BatchPredictionPipeline.class,
        DatasetReader.class,
        BatchValidator.class,
        BatchSessionFactory.class,
        CompanyResolver.class,
        HeuristicRiskScorer.class,
        PredictionRecorder.class,
        DatasetStagingService.class,
        BatchPredictionPipelineIntegrationTest.SupportConfig.class
})
class BatchPredictionPipelineIntegrationTest {

    private static final String HEADER =
            "stock_symbol,company_name,market_cap,sector,current_ratio,debt_to_equity_ratio,return_on_assets\n";

    @TestConfiguration
    static class SupportConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        LocalValidatorFactoryBean validator() {
            return new LocalValidatorFactoryBean();
        }
    }

    @TempDir
    Path tempDir;

    @Autowired private BatchPredictionPipeline pipeline;
    @Autowired private CompanyRepository companyRepository;
    @Autowired private PredictionRepository predictionRepository;
    @Autowired private FinancialRatioRepository financialRatioRepository;

    @BeforeEach
    void cleanDatabase() {
        predictionRepository.deleteAll();
        financialRatioRepository.deleteAll();
        companyRepository.deleteAll();
    }

    @Test
    void process_validDataset_persistsEveryRecordAndRemovesFile() throws IOException {
        DatasetRef ref = stage("valid.csv", HEADER
                + "AAA,Alpha,1000000,Tech,2.0,0.5,0.08\n"
                + "BBB,Beta,,Retail,1.1,1.5,0.02\n"
                + "CCC,Gamma,,,0.6,4.0,-0.05\n");

        BatchSummary summary = pipeline.process(ref);

        assertEquals(new BatchSummary(3, 3, 0, List.of()), summary);
        assertEquals(3, companyRepository.count());
        assertEquals(3, predictionRepository.count());
        assertEquals(3, financialRatioRepository.count());
        assertFalse(Files.exists(Path.of(ref.getPath())));

        CompanyEntity alpha = companyRepository.findBySymbol("AAA").orElseThrow();
        assertEquals("Alpha", alpha.getName());
        assertEquals(0, alpha.getMarketCap().compareTo(new BigDecimal("1000000")));

        FinancialRatioEntity ratios = financialRatioRepository.findByCompanyIdOrderByCreatedAtAsc(alpha.getCompanyId()).get(0);
        assertEquals(0, ratios.getCurrentRatio().compareTo(new BigDecimal("2.0")));
        assertNull(ratios.getQuickRatio());
    }

    @Test
    void process_invalidRecord_onlyThatRecordIsMissing() throws IOException {
        DatasetRef ref = stage("partial.csv", HEADER
                + "AAA,Alpha,,,2.0,0.5,0.08\n"
                + "BBB,Beta,,,not-a-number,1.5,0.02\n"
                + "CCC,Gamma,,,0.6,4.0,-0.05\n");

        BatchSummary summary = pipeline.process(ref);

        assertEquals(3, summary.getProcessed());
        assertEquals(2, summary.getSucceeded());
        assertEquals(List.of("Record 2: Invalid value 'not-a-number' for column current_ratio"), summary.getErrors());
        assertEquals(2, companyRepository.count());
        assertTrue(companyRepository.findBySymbol("BBB").isEmpty());
        assertEquals(2, predictionRepository.count());
    }

    @Test
    void process_missingKeyColumn_writesNothingAndRemovesFile() throws IOException {
        DatasetRef ref = stage("no-symbol.csv", "company_name,current_ratio\nAlpha,2.0\n");

        assertThrows(DatasetSchemaException.class, () -> pipeline.process(ref));

        assertEquals(0, companyRepository.count());
        assertEquals(0, predictionRepository.count());
        assertFalse(Files.exists(Path.of(ref.getPath())));
    }

    @Test
    void process_knownCompany_isReusedAcrossBatches() throws IOException {
        pipeline.process(stage("first.csv", HEADER + "AAA,Alpha,,,3.0,0.5,0.08\n"));
        pipeline.process(stage("second.csv", HEADER + "AAA,Alpha Renamed,,,0.7,3.5,-0.01\n"));

        assertEquals(1, companyRepository.count());
        CompanyEntity company = companyRepository.findBySymbol("AAA").orElseThrow();
        assertEquals("Alpha", company.getName());

        List<PredictionEntity> history = predictionRepository.findByCompanyIdOrderByPredictedAtAsc(company.getCompanyId());
        assertEquals(2, history.size());
        assertEquals(RiskLevel.LOW, history.get(0).getRiskLevel());
    }

    @Test
    void process_repeatedKeyWithinBatch_resolvesToOneCompany() throws IOException {
        BatchSummary summary = pipeline.process(stage("repeat.csv", HEADER
                + "AAA,Alpha,,,2.0,0.5,0.08\n"
                + "AAA,Alpha,,,1.8,0.6,0.07\n"));

        assertEquals(new BatchSummary(2, 2, 0, List.of()), summary);
        assertEquals(1, companyRepository.count());
        assertEquals(2, predictionRepository.count());
    }

    @Test
    void process_concurrentBatchesCreatingSameCompany_resolveToOneRow() throws Exception {
        DatasetRef left = stage("left.csv", HEADER + "XYZ,Xylo,,,2.0,0.5,0.08\n");
        DatasetRef right = stage("right.csv", HEADER + "XYZ,Xylo,,,1.2,1.0,0.03\n");

        CountDownLatch start = new CountDownLatch(1);
        ExecutorService workers = Executors.newFixedThreadPool(2);
        try {
            Future<BatchSummary> first = workers.submit(() -> {
                start.await();
                return pipeline.process(left);
            });
            Future<BatchSummary> second = workers.submit(() -> {
                start.await();
                return pipeline.process(right);
            });
            start.countDown();

            assertEquals(1, first.get(30, TimeUnit.SECONDS).getSucceeded());
            assertEquals(1, second.get(30, TimeUnit.SECONDS).getSucceeded());
        } finally {
            workers.shutdownNow();
        }

        assertEquals(1, companyRepository.count());
        UUID companyId = companyRepository.findBySymbol("XYZ").orElseThrow().getCompanyId();
        assertEquals(2, predictionRepository.findByCompanyIdOrderByPredictedAtAsc(companyId).size());
    }

    @Test
    void process_oversizedSymbol_isRecordErrorAndLeavesOthersCommitted() throws IOException {
        String symbol = "Z".repeat(60);
        DatasetRef ref = stage("oversized.csv", HEADER
                + "AAA,Alpha,,,2.0,0.5,0.08\n"
                + symbol + ",Zeta,,,1.0,1.0,0.01\n");

        BatchSummary summary = pipeline.process(ref);

        assertEquals(new BatchSummary(2, 1, 1,
                List.of("Record 2: Value for column stock_symbol exceeds 50 characters")), summary);
        assertEquals(1, companyRepository.count());
        assertEquals(1, predictionRepository.count());
    }

    @Test
    void process_groupedMarketCap_isStoredAndDecimalCommaIsRejected() throws IOException {
        DatasetRef ref = stage("grouped.csv", HEADER
                + "AAA,Alpha,\"1,250,000\",,2.0,0.5,0.08\n"
                + "BBB,Beta,,,\"0,75\",1.5,0.02\n");

        BatchSummary summary = pipeline.process(ref);

        assertEquals(List.of("Record 2: Invalid value '0,75' for column current_ratio"), summary.getErrors());
        CompanyEntity alpha = companyRepository.findBySymbol("AAA").orElseThrow();
        assertEquals(0, alpha.getMarketCap().compareTo(new BigDecimal("1250000")));
        assertTrue(companyRepository.findBySymbol("BBB").isEmpty());
    }

    private DatasetRef stage(String name, String content) throws IOException {
        Path file = tempDir.resolve(UUID.randomUUID() + "-" + name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return new DatasetRef(file.toString(), name);
    }
}
