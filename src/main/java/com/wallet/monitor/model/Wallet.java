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
@Schema(description = "A monitored address on one chain")
public class Wallet {

    @Schema(description = "Unique wallet identifier", example = "5f1c1f9e-0c55-4d3f-a0f0-3b0c2d0b4a11")
    private String id;

    @Schema(description = "Chain-normalized address", example = "0x742d35cc6634c0532925a3b844bc454e4438f44e")
    private String address;

    @Schema(description = "Chain the address lives on", example = "ETHEREUM")
    private ChainId chain;

    @Schema(description = "Optional display name", example = "Treasury hot wallet")
    private String name;

    @Schema(description = "Optional free-form description")
    private String description;

    @Schema(description = "Soft-disable flag; inactive wallets are not synced", example = "true")
    @Builder.Default
    private boolean active = true;

    @Schema(description = "Creation time in epoch milliseconds")
    private long createdAt;

    @Schema(description = "Last update time in epoch milliseconds")
    private long updatedAt;
}
