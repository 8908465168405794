package com.defaultrisk.domain.service;

import com.defaultrisk.domain.model.FinancialRatios;
import com.defaultrisk.domain.model.RatioField;
import com.defaultrisk.domain.model.RiskLevel;
import com.defaultrisk.domain.model.ScoreResult;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;

/**
 * Deterministic logistic score over whichever ratios are present.
 *
 * Each present ratio is clamped to a plausible range and weighted; absent ratios
 * contribute nothing. Confidence scales with the share of ratios present.
 */
@Component
public class HeuristicRiskScorer implements RiskScorer {

    static final double LOW_THRESHOLD = 0.35;
    static final double HIGH_THRESHOLD = 0.65;
    private static final double BIAS = 0.5;

    private static final Map<RatioField, Weight> WEIGHTS = new EnumMap<>(RatioField.class);

    static {
        WEIGHTS.put(RatioField.DEBT_TO_EQUITY_RATIO, new Weight(0.8, 0, 10));
        WEIGHTS.put(RatioField.CURRENT_RATIO, new Weight(-0.6, 0, 10));
        WEIGHTS.put(RatioField.QUICK_RATIO, new Weight(-0.4, 0, 10));
        WEIGHTS.put(RatioField.RETURN_ON_EQUITY, new Weight(-2.0, -1, 1));
        WEIGHTS.put(RatioField.RETURN_ON_ASSETS, new Weight(-4.0, -1, 1));
        WEIGHTS.put(RatioField.PROFIT_MARGIN, new Weight(-3.0, -1, 1));
        WEIGHTS.put(RatioField.INTEREST_COVERAGE, new Weight(-0.15, -20, 50));
        WEIGHTS.put(RatioField.FIXED_ASSET_TURNOVER, new Weight(-0.2, 0, 10));
        WEIGHTS.put(RatioField.TOTAL_DEBT_EBITDA, new Weight(0.35, -10, 20));
    }

    @Override
    public ScoreResult score(FinancialRatios ratios) {
        if (ratios.isEmpty()) {
            throw new IllegalArgumentException("No financial ratios available to score");
        }

        double z = BIAS;
        for (Map.Entry<RatioField, BigDecimal> entry : ratios.present().entrySet()) {
            z += WEIGHTS.get(entry.getKey()).apply(entry.getValue().doubleValue());
        }
        double probability = 1.0 / (1.0 + Math.exp(-z));
        double coverage = (double) ratios.presentCount() / RatioField.values().length;
        double confidence = Math.min(0.99, (0.5 + 0.45 * coverage) * (0.6 + 0.8 * Math.abs(probability - 0.5)));

        return ScoreResult.builder()
                .riskLevel(classify(probability))
                .probability(scaled(probability))
                .confidence(scaled(confidence))
                .inputs(ratios)
                .build();
    }

    static RiskLevel classify(double probability) {
        if (probability < LOW_THRESHOLD) {
            return RiskLevel.LOW;
        }
        if (probability < HIGH_THRESHOLD) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.HIGH;
    }

    private static BigDecimal scaled(double value) {
        return BigDecimal.valueOf(value).setScale(4, RoundingMode.HALF_UP);
    }

    @RequiredArgsConstructor
    private static final class Weight {

        private final double coefficient;
        private final double min;
        private final double max;

        double apply(double value) {
            return coefficient * Math.max(min, Math.min(max, value));
        }
    }
}
