package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "Native balance of one wallet, in its chain's native unit")
public record WalletBalance(String address, ChainId chain, String name, String unit, double balance) {}
