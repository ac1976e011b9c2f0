package com.wallet.monitor.model;

public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH;

    public static RiskLevel fromScore(double score) {
        if (score >= 0.8) return HIGH;
        if (score >= 0.4) return MEDIUM;
        return LOW;
    }

    public boolean isElevated() {
        return this != LOW;
    }
}
