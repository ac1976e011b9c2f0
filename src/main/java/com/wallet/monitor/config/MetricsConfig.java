package com.wallet.monitor.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

@Component
public class MetricsConfig {

    private final MeterRegistry registry;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnomalyScore(String chain, String riskLevel, double score) {
        DistributionSummary.builder("transaction.anomaly_score")
                .tag("chain", chain)
                .tag("risk_level", riskLevel)
                .register(registry)
                .record(score);
    }

    public void recordSync(String chain, int synced, int failed) {
        Counter.builder("sync.run.count")
                .tag("chain", chain)
                .register(registry)
                .increment();

        Counter.builder("sync.transactions.count")
                .tag("chain", chain)
                .tag("outcome", "synced")
                .register(registry)
                .increment(synced);

        Counter.builder("sync.transactions.count")
                .tag("chain", chain)
                .tag("outcome", "failed")
                .register(registry)
                .increment(failed);
    }

    public void recordRuleTriggered(String ruleType) {
        Counter.builder("rule.triggered.count")
                .tag("rule_type", ruleType)
                .register(registry)
                .increment();
    }

    public void recordRuleSkipped(String ruleType) {
        Counter.builder("rule.skipped.count")
                .tag("rule_type", ruleType)
                .register(registry)
                .increment();
    }

    public void recordAlert(String alertType, String riskLevel) {
        Counter.builder("alert.created.count")
                .tag("alert_type", alertType)
                .tag("risk_level", riskLevel)
                .register(registry)
                .increment();
    }

    public void recordNotification(String channel, String status) {
        Counter.builder("notification.sent.count")
                .tag("channel", channel)
                .tag("status", status)
                .register(registry)
                .increment();
    }
}
