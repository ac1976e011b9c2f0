package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Activity, trend and historical anomalies of one wallet")
public class WalletAnalysis {

    private String walletAddress;

    private ChainId chain;

    private WalletActivity activity;

    private TransactionTrend trend;

    private List<WalletAnomaly> anomalies;
}
