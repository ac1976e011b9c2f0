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
@Schema(description = "Counters for one wallet synchronization run")
public class SyncResult {

    private String walletAddress;

    private ChainId chain;

    @Schema(description = "Raw transactions returned by the chain", example = "5")
    private int fetchedCount;

    @Schema(description = "Transactions newly stored by this run. Duplicates are not counted.", example = "5")
    private int syncedCount;

    @Schema(description = "Transactions that failed to process", example = "0")
    private int failedCount;

    @Schema(description = "Alerts persisted by this run", example = "1")
    private int alertCount;
}
