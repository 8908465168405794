package com.defaultrisk.domain.service;

import com.defaultrisk.domain.model.FinancialRatios;
import com.defaultrisk.domain.model.ScoreResult;

/**
 * Derives a default-risk classification from a ratio snapshot.
 *
 * Implementations must accept snapshots with absent ratios. They signal an input
 * they cannot score by throwing a runtime exception.
 */
public interface RiskScorer {

    ScoreResult score(FinancialRatios ratios);
}
