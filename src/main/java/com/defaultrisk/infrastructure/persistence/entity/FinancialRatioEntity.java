package com.defaultrisk.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only ratio snapshot for a company. Absent ratios are stored as NULL.
 */
@Entity
@Table(name = "financial_ratios", indexes = {
    @Index(name = "idx_ratio_company_created", columnList = "companyId,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinancialRatioEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID ratioId;

    @Column(nullable = false, columnDefinition = "UUID", updatable = false)
    private UUID companyId;

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
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        if (ratioId == null) {
            ratioId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
