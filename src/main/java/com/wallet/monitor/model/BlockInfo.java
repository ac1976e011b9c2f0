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
@Schema(description = "Latest block (slot on Solana) as reported by the chain")
public class BlockInfo {

    private ChainId chain;

    @Schema(description = "Block number or slot", example = "19500000")
    private long number;

    private String hash;

    @Schema(description = "Block time in unix seconds")
    private Long timestamp;

    private int transactionCount;
}
