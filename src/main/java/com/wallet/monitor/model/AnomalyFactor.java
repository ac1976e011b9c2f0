package com.wallet.monitor.model;

/**
 * Binary factors of the anomaly score. Weights live in ScoringConfig.
 */
public enum AnomalyFactor {
    LARGE_AMOUNT,
    UNFAMILIAR_COUNTERPARTY,
    HIGH_FREQUENCY
}
