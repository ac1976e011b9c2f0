package com.wallet.monitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Data
@Configuration
@ConfigurationProperties(prefix = "monitor.scoring")
public class ScoringConfig {

    private double largeAmountWeight = 0.5;
    private double unfamiliarCounterpartyWeight = 0.3;
    private double highFrequencyWeight = 0.2;

    // Amount above this multiple of the historical mean counts as large
    private double largeAmountMultiplier = 3.0;

    // Trailing window for the frequency factor
    private long frequencyWindowSeconds = 3600;

    // Factor fires when the window holds strictly more history transactions than this
    private int frequencyCountThreshold = 10;
}
