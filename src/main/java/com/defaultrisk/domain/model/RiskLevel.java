package com.defaultrisk.domain.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH
}
