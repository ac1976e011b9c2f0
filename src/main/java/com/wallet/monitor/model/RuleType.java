package com.wallet.monitor.model;

public enum RuleType {
    TRANSACTION,
    BALANCE,
    CONTRACT,
    ANOMALY,
    FREQUENCY
}
