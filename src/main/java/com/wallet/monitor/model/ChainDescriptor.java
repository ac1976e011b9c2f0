package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "A chain known to the monitor and whether an adapter is registered for it")
public record ChainDescriptor(ChainId chain, boolean evm, String nativeUnit, boolean adapterAvailable) {}
