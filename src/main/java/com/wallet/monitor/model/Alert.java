package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A rule firing, pending operator resolution")
public class Alert {

    @Schema(description = "Unique alert identifier")
    private String id;

    @Schema(description = "Rule that produced the alert")
    private String ruleId;

    private String walletAddress;

    private ChainId chain;

    @Schema(description = "Type of the rule that fired", example = "TRANSACTION")
    private RuleType alertType;

    @Schema(description = "Human-readable explanation", example = "Transaction amount exceeds threshold: 250.00 > 100.00")
    private String message;

    @Schema(description = "Severity computed by the rule", example = "HIGH")
    private RiskLevel riskLevel;

    @Schema(description = "Hash of the triggering transaction; absent for balance alerts")
    private String transactionHash;

    @Builder.Default
    private AlertStatus status = AlertStatus.PENDING;

    @Schema(description = "Creation time in epoch milliseconds")
    private long createdAt;

    @Schema(description = "Resolution time in epoch milliseconds; null while pending")
    private Long resolvedAt;
}
