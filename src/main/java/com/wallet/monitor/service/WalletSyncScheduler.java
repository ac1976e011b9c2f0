package com.wallet.monitor.service;

import com.wallet.monitor.adapter.ChainAdapterRegistry;
import com.wallet.monitor.config.SyncExecutorConfig;
import com.wallet.monitor.model.SyncResult;
import com.wallet.monitor.model.Wallet;
import com.wallet.monitor.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Periodically syncs every active wallet whose chain has an adapter.
 * Wallets are synced in parallel on the sync pool; a run waits for all of them
 * before the next one is scheduled.
 */
@Service
@ConditionalOnProperty(prefix = "monitor.sync", name = "enabled", havingValue = "true")
public class WalletSyncScheduler {

    private static final Logger log = LoggerFactory.getLogger(WalletSyncScheduler.class);

    private final AlertStore alertStore;
    private final IngestionCoordinator coordinator;
    private final ChainAdapterRegistry adapterRegistry;
    private final ThreadPoolTaskExecutor syncExecutor;

    public WalletSyncScheduler(AlertStore alertStore,
                               IngestionCoordinator coordinator,
                               ChainAdapterRegistry adapterRegistry,
                               @Qualifier(SyncExecutorConfig.SYNC_EXECUTOR) ThreadPoolTaskExecutor syncExecutor) {
        this.alertStore = alertStore;
        this.coordinator = coordinator;
        this.adapterRegistry = adapterRegistry;
        this.syncExecutor = syncExecutor;
    }

    @Scheduled(fixedDelayString = "${monitor.sync.interval-ms:300000}",
            initialDelayString = "${monitor.sync.initial-delay-ms:30000}")
    public void syncActiveWallets() {
        List<Wallet> wallets;
        try {
            wallets = alertStore.listWallets(null, true);
        } catch (Exception e) {
            log.error("Periodic sync skipped, cannot list wallets: {}", e.getMessage(), e);
            return;
        }

        List<CompletableFuture<SyncResult>> runs = new ArrayList<>();
        for (Wallet wallet : wallets) {
            if (!adapterRegistry.isSupported(wallet.getChain())) {
                log.debug("No adapter for {}, skipping wallet {}", wallet.getChain(), wallet.getAddress());
                continue;
            }
            runs.add(CompletableFuture
                    .supplyAsync(() -> coordinator.sync(wallet.getAddress(), wallet.getChain()), syncExecutor)
                    .exceptionally(e -> {
                        log.error("Periodic sync failed for {} on {}: {}",
                                wallet.getAddress(), wallet.getChain(), e.getMessage(), e);
                        return null;
                    }));
        }

        CompletableFuture.allOf(runs.toArray(new CompletableFuture[0])).join();
        int synced = runs.stream().map(CompletableFuture::join)
                .filter(r -> r != null)
                .mapToInt(SyncResult::getSyncedCount)
                .sum();
        log.info("Periodic sync finished: {} wallets, {} new transactions", runs.size(), synced);
    }
}
