package com.defaultrisk.domain.service;

import com.defaultrisk.domain.model.FinancialRatios;
import com.defaultrisk.domain.model.RatioField;
import com.defaultrisk.domain.model.ScoreResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;

/**
 * Scores one representative snapshot at startup so the first batch does not pay
 * the scorer's initialization cost. A failure here is only logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScorerWarmup {

    static final FinancialRatios SAMPLE = FinancialRatios.builder()
            .ratio(RatioField.DEBT_TO_EQUITY_RATIO, new BigDecimal("0.5"))
            .ratio(RatioField.CURRENT_RATIO, new BigDecimal("2.0"))
            .ratio(RatioField.QUICK_RATIO, new BigDecimal("1.5"))
            .ratio(RatioField.RETURN_ON_EQUITY, new BigDecimal("0.15"))
            .ratio(RatioField.RETURN_ON_ASSETS, new BigDecimal("0.08"))
            .ratio(RatioField.PROFIT_MARGIN, new BigDecimal("0.10"))
            .ratio(RatioField.INTEREST_COVERAGE, new BigDecimal("5.0"))
            .ratio(RatioField.FIXED_ASSET_TURNOVER, new BigDecimal("1.2"))
            .ratio(RatioField.TOTAL_DEBT_EBITDA, new BigDecimal("2.5"))
            .build();

    private final RiskScorer riskScorer;

    @EventListener(ApplicationReadyEvent.class)
    public void warmUp() {
        try {
            ScoreResult result = riskScorer.score(SAMPLE);
            log.info("Risk scorer ready (sample scored {} at {})", result.getRiskLevel(), result.getProbability());
        } catch (RuntimeException e) {
            log.warn("Risk scorer warm-up failed: {}", e.getMessage(), e);
        }
    }
}
