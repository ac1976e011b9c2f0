package com.wallet.monitor.adapter;

import com.wallet.monitor.model.BalanceReading;
import com.wallet.monitor.model.BlockInfo;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.RawTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Converts every failure of the wrapped adapter into its empty result.
 */
class FailSoftChainAdapter implements ChainAdapter {

    private static final Logger log = LoggerFactory.getLogger(FailSoftChainAdapter.class);

    private final ChainAdapter delegate;

    FailSoftChainAdapter(ChainAdapter delegate) {
        this.delegate = delegate;
    }

    @Override
    public ChainId getChain() {
        return delegate.getChain();
    }

    @Override
    public List<RawTransaction> getTransactions(String address, int limit) {
        try {
            List<RawTransaction> result = delegate.getTransactions(address, limit);
            return result != null ? result : List.of();
        } catch (Exception e) {
            log.error("Failed to fetch transactions for {} on {}: {}", address, getChain(), e.getMessage(), e);
            return List.of();
        }
    }

    @Override
    public Optional<RawTransaction> getTransaction(String hash) {
        try {
            Optional<RawTransaction> result = delegate.getTransaction(hash);
            return result != null ? result : Optional.empty();
        } catch (Exception e) {
            log.error("Failed to fetch transaction {} on {}: {}", hash, getChain(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public BalanceReading getBalance(String address, String tokenAddress) {
        try {
            BalanceReading reading = delegate.getBalance(address, tokenAddress);
            return reading != null ? reading : BalanceReading.unavailable(address, getChain(), tokenAddress);
        } catch (Exception e) {
            log.error("Failed to read balance for {} (token {}) on {}: {}",
                    address, tokenAddress, getChain(), e.getMessage(), e);
            return BalanceReading.unavailable(address, getChain(), tokenAddress);
        }
    }

    @Override
    public Optional<BlockInfo> getBlock(Long number) {
        try {
            Optional<BlockInfo> block = delegate.getBlock(number);
            return block != null ? block : Optional.empty();
        } catch (Exception e) {
            log.error("Failed to read block {} on {}: {}", number != null ? number : "latest",
                    getChain(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public boolean isValidAddress(String address) {
        try {
            return delegate.isValidAddress(address);
        } catch (Exception e) {
            log.warn("Address validation failed on {} for {}: {}", getChain(), address, e.getMessage());
            return false;
        }
    }

    ChainAdapter getDelegate() {
        return delegate;
    }
}
