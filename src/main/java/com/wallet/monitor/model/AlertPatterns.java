package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Alert counts grouped along several dimensions")
public class AlertPatterns {

    private int totalAlerts;

    private int pendingAlerts;

    private Map<RiskLevel, Integer> byRiskLevel;

    private Map<RuleType, Integer> byType;

    private Map<String, Integer> byWallet;

    private Map<ChainId, Integer> byChain;
}
