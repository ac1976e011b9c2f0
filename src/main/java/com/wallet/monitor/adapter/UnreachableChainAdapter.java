package com.wallet.monitor.adapter;

import com.wallet.monitor.model.BalanceReading;
import com.wallet.monitor.model.BlockInfo;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.RawTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Stands in for an adapter whose construction failed. Every read comes back empty.
 */
class UnreachableChainAdapter implements ChainAdapter {

    private final ChainId chain;

    UnreachableChainAdapter(ChainId chain) {
        this.chain = chain;
    }

    @Override
    public ChainId getChain() {
        return chain;
    }

    @Override
    public List<RawTransaction> getTransactions(String address, int limit) {
        return List.of();
    }

    @Override
    public Optional<RawTransaction> getTransaction(String hash) {
        return Optional.empty();
    }

    @Override
    public BalanceReading getBalance(String address, String tokenAddress) {
        return BalanceReading.unavailable(address, chain, tokenAddress);
    }

    @Override
    public Optional<BlockInfo> getBlock(Long number) {
        return Optional.empty();
    }

    /**
     * The address format cannot be checked without the chain client, so it is accepted.
     */
    @Override
    public boolean isValidAddress(String address) {
        return true;
    }
}
