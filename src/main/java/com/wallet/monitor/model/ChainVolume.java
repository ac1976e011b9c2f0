package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Transaction count and volume for one chain, in that chain's native unit")
public record ChainVolume(ChainId chain, String unit, int transactionCount, double volume) {}
