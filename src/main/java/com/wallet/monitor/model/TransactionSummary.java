package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Stored transactions grouped by chain. Volumes are never summed across chains.")
public class TransactionSummary {

    private int totalTransactions;

    private List<ChainVolume> byChain;

    private Map<RiskLevel, Integer> byRiskLevel;

    private int contractInteractions;
}
