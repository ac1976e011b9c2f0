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
@Schema(description = "A historical pattern flagged in a wallet's stored transactions")
public class WalletAnomaly {

    public enum Kind { LARGE_AMOUNT, RAPID_SUCCESSION }

    private Kind kind;

    private String transactionHash;

    private RiskLevel riskLevel;

    private String description;

    private Long timestamp;
}
