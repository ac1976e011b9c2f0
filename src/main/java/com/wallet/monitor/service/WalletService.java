package com.wallet.monitor.service;

import com.wallet.monitor.adapter.ChainAdapterRegistry;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Wallet;
import com.wallet.monitor.repository.AlertStore;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class WalletService {

    private final AlertStore alertStore;
    private final ChainAdapterRegistry adapterRegistry;

    public WalletService(AlertStore alertStore, ChainAdapterRegistry adapterRegistry) {
        this.alertStore = alertStore;
        this.adapterRegistry = adapterRegistry;
    }

    /**
     * Idempotent: registering an existing (address, chain) returns the stored wallet unchanged.
     */
    public Wallet register(String rawAddress, ChainId chain, String name, String description) {
        String address = chain.normalizeAddress(rawAddress);
        if (address == null) {
            throw new ValidationException("address is required", "address");
        }
        if (adapterRegistry.isSupported(chain) && !adapterRegistry.get(chain).isValidAddress(address)) {
            throw new ValidationException("Invalid " + chain + " address: " + address, "address");
        }

        long now = System.currentTimeMillis();
        Wallet wallet = Wallet.builder()
                .id(UUID.randomUUID().toString())
                .address(address)
                .chain(chain)
                .name(name)
                .description(description)
                .active(true)
                .createdAt(now)
                .updatedAt(now)
                .build();
        return alertStore.insertWallet(wallet);
    }

    public List<Wallet> list(ChainId chain, boolean activeOnly) {
        return alertStore.listWallets(chain, activeOnly);
    }

    public Optional<Wallet> get(String address, ChainId chain) {
        return alertStore.findWallet(chain.normalizeAddress(address), chain);
    }

    public Optional<Wallet> update(String address, ChainId chain, String name, String description) {
        return alertStore.updateWalletDetails(chain.normalizeAddress(address), chain, name, description);
    }

    public boolean deactivate(String address, ChainId chain) {
        return alertStore.deactivateWallet(chain.normalizeAddress(address), chain);
    }
}
