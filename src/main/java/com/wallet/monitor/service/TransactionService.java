package com.wallet.monitor.service;

import com.wallet.monitor.adapter.ChainAdapterRegistry;
import com.wallet.monitor.engine.normalizer.TransactionNormalizer;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class TransactionService {

    private static final Logger log = LoggerFactory.getLogger(TransactionService.class);

    private final AlertStore alertStore;
    private final ChainAdapterRegistry adapterRegistry;
    private final TransactionNormalizer normalizer;

    public TransactionService(AlertStore alertStore, ChainAdapterRegistry adapterRegistry,
                              TransactionNormalizer normalizer) {
        this.alertStore = alertStore;
        this.adapterRegistry = adapterRegistry;
        this.normalizer = normalizer;
    }

    public List<Transaction> list(String walletAddress, ChainId chain, int limit) {
        String address = walletAddress != null && chain != null ? chain.normalizeAddress(walletAddress) : walletAddress;
        return alertStore.transactionsFor(address, chain, limit);
    }

    /**
     * Looks the hash up in the store first. When it is not stored and a chain is given,
     * the transaction is fetched from the chain and normalized but neither scored nor stored.
     */
    public Optional<Transaction> get(String rawHash, ChainId chain) {
        String hash = chain != null ? chain.normalizeHash(rawHash) : ChainId.normalizeAnyHash(rawHash);
        if (hash == null) {
            throw new ValidationException("hash is required", "hash");
        }

        Optional<Transaction> stored = alertStore.findTransaction(hash);
        if (stored.isPresent() || chain == null) {
            return stored;
        }

        log.debug("Transaction {} not stored, fetching from {}", hash, chain);
        return adapterRegistry.get(chain).getTransaction(hash)
                .map(raw -> {
                    Transaction transaction = normalizer.normalize(raw, chain);
                    if (transaction.getHash() == null) transaction.setHash(hash);
                    return transaction;
                });
    }
}
