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
@Schema(description = "Configuration of an alerting rule")
public class AlertRule {

    @Schema(description = "Unique rule identifier", example = "RULE-LARGE-TX")
    private String id;

    @Schema(description = "Rule display name", example = "Large transaction")
    private String name;

    @Schema(description = "What the rule detects")
    private String description;

    @Schema(description = "Kind of input the rule evaluates", example = "TRANSACTION")
    private RuleType ruleType;

    @Schema(description = "Numeric threshold. Required for TRANSACTION and BALANCE rules without an expression, " +
            "ignored for CONTRACT, multiplier of the historical mean for ANOMALY (default 3), " +
            "transaction count in the trailing hour for FREQUENCY.", example = "100.0")
    private Double threshold;

    @Schema(description = "Optional expression overriding the default comparison, e.g. \"amount >= 50\" or \"count > 10 in 3600\"",
            example = "count > 10 in 3600")
    private String expression;

    @Schema(description = "Whether the rule is evaluated", example = "true")
    @Builder.Default
    private boolean enabled = true;

    @Schema(description = "Creation time in epoch milliseconds")
    private long createdAt;

    @Schema(description = "Last update time in epoch milliseconds")
    private long updatedAt;
}
