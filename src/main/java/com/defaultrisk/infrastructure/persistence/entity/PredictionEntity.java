package com.defaultrisk.infrastructure.persistence.entity;

import com.defaultrisk.domain.model.RiskLevel;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only default-risk prediction for a company, with the ratio inputs it was scored on.
 */
@Entity
@Table(name = "default_rate_predictions", indexes = {
    @Index(name = "idx_prediction_company_predicted", columnList = "companyId,predictedAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID predictionId;

    @Column(nullable = false, columnDefinition = "UUID", updatable = false)
    private UUID companyId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private RiskLevel riskLevel;

    @Column(nullable = false, precision = 5, scale = 4, updatable = false)
    private BigDecimal confidence;

    @Column(precision = 5, scale = 4, updatable = false)
    private BigDecimal probability;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal debtToEquityRatio;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal currentRatio;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal quickRatio;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal returnOnEquity;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal returnOnAssets;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal profitMargin;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal interestCoverage;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal fixedAssetTurnover;

    @Column(precision = 10, scale = 4, updatable = false)
    private BigDecimal totalDebtEbitda;

    @Column(nullable = false, updatable = false)
    private Instant predictedAt;

    @Column(nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (predictionId == null) {
            predictionId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (predictedAt == null) {
            predictedAt = createdAt;
        }
    }
}
