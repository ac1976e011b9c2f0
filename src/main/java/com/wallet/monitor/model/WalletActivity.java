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
@Schema(description = "Activity statistics for one wallet over its stored transactions")
public class WalletActivity {

    private String walletAddress;

    private ChainId chain;

    @Schema(description = "Native unit the volumes are expressed in", example = "ETH")
    private String unit;

    private int transactionCount;

    private double incomingVolume;

    private double outgoingVolume;

    private double totalVolume;

    private double averageAmount;

    @Schema(description = "Transaction count per UTC day (yyyy-MM-dd)")
    private Map<String, Integer> countByDay;

    @Schema(description = "UTC day with the most transactions; null when there are no timestamps", example = "2024-03-01")
    private String mostActiveDay;

    private int contractInteractions;

    @Schema(description = "Transactions scored MEDIUM or HIGH")
    private int anomalyCount;
}
