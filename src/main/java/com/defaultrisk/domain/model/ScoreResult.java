package com.defaultrisk.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Output of the risk scorer for one record, paired with the exact inputs used.
 */
@Value
@Builder
public class ScoreResult {

    @NonNull RiskLevel riskLevel;
    @NonNull BigDecimal confidence;
    BigDecimal probability;
    @NonNull FinancialRatios inputs;
}
