package com.defaultrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Bulk Default-Risk Prediction Service
 *
 * Scores uploaded spreadsheets of company financial ratios off the request path.
 *
 * Architecture:
 * - Upload staged on a shared volume, job dispatched through Kafka
 * - Worker pool of Kafka consumers (manual offset commit, at-least-once)
 * - Per-record unit of work: one bad row never aborts or corrupts the batch
 * - Lookup-or-create of companies serialized by a unique symbol constraint
 * - Job status and bounded batch summary queryable by job id
 */
@SpringBootApplication
@EnableTransactionManagement
public class DefaultRiskApplication {

    public static void main(String[] args) {
        SpringApplication.run(DefaultRiskApplication.class, args);
    }
}
