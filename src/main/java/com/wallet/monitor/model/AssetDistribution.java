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
@Schema(description = "Native balances of the active wallets. Totals are per chain and never summed across chains.")
public class AssetDistribution {

    @Schema(description = "Active wallets considered", example = "12")
    private int walletCount;

    private List<ChainBalance> byChain;

    private List<WalletBalance> byWallet;

    @Schema(description = "Wallets left out because their balance could not be read", example = "1")
    private int unavailableCount;
}
