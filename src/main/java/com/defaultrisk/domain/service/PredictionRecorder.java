package com.defaultrisk.domain.service;

import com.defaultrisk.domain.model.FinancialRatios;
import com.defaultrisk.domain.model.RatioField;
import com.defaultrisk.domain.model.ScoreResult;
import com.defaultrisk.infrastructure.persistence.entity.FinancialRatioEntity;
import com.defaultrisk.infrastructure.persistence.entity.PredictionEntity;
import com.defaultrisk.infrastructure.persistence.repository.FinancialRatioRepository;
import com.defaultrisk.infrastructure.persistence.repository.PredictionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Appends a prediction and its ratio snapshot to a company's history.
 *
 * Writes join the caller's current unit of work; nothing is committed here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionRecorder {

    private final PredictionRepository predictionRepository;
    private final FinancialRatioRepository financialRatioRepository;

    public PredictionEntity record(UUID companyId, ScoreResult result) {
        FinancialRatios inputs = result.getInputs();
        Instant now = Instant.now();

        PredictionEntity prediction = predictionRepository.save(PredictionEntity.builder()
                .companyId(companyId)
                .riskLevel(result.getRiskLevel())
                .confidence(result.getConfidence())
                .probability(result.getProbability())
                .debtToEquityRatio(ratio(inputs, RatioField.DEBT_TO_EQUITY_RATIO))
                .currentRatio(ratio(inputs, RatioField.CURRENT_RATIO))
                .quickRatio(ratio(inputs, RatioField.QUICK_RATIO))
                .returnOnEquity(ratio(inputs, RatioField.RETURN_ON_EQUITY))
                .returnOnAssets(ratio(inputs, RatioField.RETURN_ON_ASSETS))
                .profitMargin(ratio(inputs, RatioField.PROFIT_MARGIN))
                .interestCoverage(ratio(inputs, RatioField.INTEREST_COVERAGE))
                .fixedAssetTurnover(ratio(inputs, RatioField.FIXED_ASSET_TURNOVER))
                .totalDebtEbitda(ratio(inputs, RatioField.TOTAL_DEBT_EBITDA))
                .predictedAt(now)
                .build());

        financialRatioRepository.save(FinancialRatioEntity.builder()
                .companyId(companyId)
                .debtToEquityRatio(ratio(inputs, RatioField.DEBT_TO_EQUITY_RATIO))
                .currentRatio(ratio(inputs, RatioField.CURRENT_RATIO))
                .quickRatio(ratio(inputs, RatioField.QUICK_RATIO))
                .returnOnEquity(ratio(inputs, RatioField.RETURN_ON_EQUITY))
                .returnOnAssets(ratio(inputs, RatioField.RETURN_ON_ASSETS))
                .profitMargin(ratio(inputs, RatioField.PROFIT_MARGIN))
                .interestCoverage(ratio(inputs, RatioField.INTEREST_COVERAGE))
                .fixedAssetTurnover(ratio(inputs, RatioField.FIXED_ASSET_TURNOVER))
                .totalDebtEbitda(ratio(inputs, RatioField.TOTAL_DEBT_EBITDA))
                .createdAt(now)
                .build());

        log.debug("Recorded {} prediction for company {}", result.getRiskLevel(), companyId);
        return prediction;
    }

    private static BigDecimal ratio(FinancialRatios ratios, RatioField field) {
        return ratios.get(field)
                .map(v -> v.setScale(4, RoundingMode.HALF_UP))
                .orElse(null);
    }
}
