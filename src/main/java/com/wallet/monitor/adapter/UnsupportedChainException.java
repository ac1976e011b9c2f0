package com.wallet.monitor.adapter;

import com.wallet.monitor.model.ChainId;

public class UnsupportedChainException extends RuntimeException {

    private final String chain;

    public UnsupportedChainException(String chain) {
        super("Unsupported chain: " + chain);
        this.chain = chain;
    }

    public UnsupportedChainException(ChainId chain) {
        this(chain.name());
    }

    public String getChain() {
        return chain;
    }
}
