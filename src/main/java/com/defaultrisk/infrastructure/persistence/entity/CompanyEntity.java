package com.defaultrisk.infrastructure.persistence.entity;

import com.defaultrisk.domain.model.CompanyDescriptor;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Tracked company, keyed by its unique stock symbol.
 *
 * The unique constraint on symbol is what serializes concurrent lookup-or-create
 * calls from different workers: the losing insert fails and falls back to a lookup.
 */
@Entity
@Table(name = "companies", indexes = {
    @Index(name = "idx_company_symbol", columnList = "symbol", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompanyEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID companyId;

    @Column(nullable = false, unique = true, length = CompanyDescriptor.SYMBOL_MAX_LENGTH)
    private String symbol;

    @Column(nullable = false, length = CompanyDescriptor.NAME_MAX_LENGTH)
    private String name;

    @Column(precision = CompanyDescriptor.MARKET_CAP_PRECISION, scale = CompanyDescriptor.MARKET_CAP_SCALE)
    private BigDecimal marketCap;

    @Column(length = CompanyDescriptor.SECTOR_MAX_LENGTH)
    private String sector;

    @Column(nullable = false)
    private Instant createdAt;

    @Column(nullable = false)
    private Instant updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (companyId == null) {
            companyId = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }
}
