package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Canonical transaction record, independent of the source chain")
public class Transaction {

    @Schema(description = "Unique row identifier")
    private String id;

    @Schema(description = "Transaction hash (signature on Solana). Globally unique.",
            example = "0x5c504ed432cb51138bcf09aa5e8a410dd4a1e204ef84bfed1be16dfba1b22060")
    private String hash;

    @Schema(description = "Monitored wallet this transaction was synced for")
    private String walletAddress;

    @Schema(description = "Chain of the transaction", example = "ETHEREUM")
    private ChainId chain;

    private String fromAddress;

    private String toAddress;

    @Schema(description = "Transferred value in the chain's native unit. Not comparable across chains.", example = "1.5")
    private double amount;

    @Schema(description = "Execution status", example = "success")
    private String status;

    @Schema(description = "Block time in unix seconds; null when the source did not report it")
    private Long timestamp;

    @Schema(description = "Block number (slot on Solana)")
    private Long blockNumber;

    private String blockHash;

    @Schema(description = "Gas used; null on chains without gas")
    private Long gasUsed;

    @Schema(description = "Gas price; null on chains without gas")
    private Long gasPrice;

    @Schema(description = "Call data; null on chains without call data")
    private String inputData;

    @Schema(description = "True when the transaction carries call data", example = "false")
    private boolean contractInteraction;

    @Schema(description = "Destination contract for contract interactions")
    private String contractAddress;

    @Schema(description = "Anomaly score in [0, 1]", example = "0.8")
    private double anomalyScore;

    @Schema(description = "Risk tier derived from the anomaly score", example = "HIGH")
    @Builder.Default
    private RiskLevel riskLevel = RiskLevel.LOW;

    @Schema(description = "Factors that contributed to the anomaly score")
    @Builder.Default
    private List<AnomalyFactor> anomalyFactors = new ArrayList<>();

    @Schema(description = "Row creation time in epoch milliseconds")
    private long createdAt;
}
