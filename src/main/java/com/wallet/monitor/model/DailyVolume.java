package com.wallet.monitor.model;

public record DailyVolume(String day, int count, double volume, double incoming, double outgoing) {}
