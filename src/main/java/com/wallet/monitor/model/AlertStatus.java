package com.wallet.monitor.model;

public enum AlertStatus {
    PENDING,
    RESOLVED
}
