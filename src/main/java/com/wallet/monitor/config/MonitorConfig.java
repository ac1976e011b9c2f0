package com.wallet.monitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "monitor")
public class MonitorConfig {

    // Raw transactions requested from the chain per sync
    private int syncBatchSize = 100;

    // Stored transactions loaded as scoring history
    private int historyLimit = 1000;

    // Evaluate alert rules on newly stored transactions during sync
    private boolean ruleEvaluationEnabled = true;

    // Default page size for list endpoints
    private int defaultListLimit = 100;

    private Sync sync = new Sync();

    @Data
    public static class Sync {
        // Periodic sync of all active wallets
        private boolean enabled = false;
        private long intervalMs = 300_000;
        private long initialDelayMs = 30_000;
        private int poolSize = 4;
    }
}
