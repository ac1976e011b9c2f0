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
@Schema(description = "Evaluation result from a single alert rule")
public class RuleResult {

    @Schema(description = "Rule identifier", example = "RULE-LARGE-TX")
    private String ruleId;

    @Schema(description = "Rule display name", example = "Large transaction")
    private String ruleName;

    @Schema(description = "Type of the rule", example = "TRANSACTION")
    private RuleType ruleType;

    @Schema(description = "Whether the rule fired", example = "true")
    private boolean triggered;

    @Schema(description = "Severity when fired; null otherwise", example = "HIGH")
    private RiskLevel riskLevel;

    @Schema(description = "Human-readable explanation",
            example = "Transaction amount exceeds threshold: 250.00 > 100.00")
    private String reason;
}
