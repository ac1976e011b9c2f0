package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Summed native balance of the wallets on one chain, in that chain's native unit")
public record ChainBalance(ChainId chain, String unit, int walletCount, double totalBalance) {}
