package com.wallet.monitor.service;

import com.wallet.monitor.adapter.ChainAdapter;
import com.wallet.monitor.adapter.ChainAdapterRegistry;
import com.wallet.monitor.config.MetricsConfig;
import com.wallet.monitor.config.MonitorConfig;
import com.wallet.monitor.engine.AnomalyScorer;
import com.wallet.monitor.engine.RuleEngine;
import com.wallet.monitor.engine.normalizer.TransactionNormalizer;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AnomalyAssessment;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.RawTransaction;
import com.wallet.monitor.model.SyncResult;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.repository.AlertStore;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pulls a wallet's recent transactions from its chain and runs each through
 * normalize, score, store and rule evaluation.
 *
 * <p>Each transaction is processed on its own: a failure is logged and counted
 * and the batch continues. Already-stored transactions are skipped without
 * re-evaluating rules, so re-syncing never duplicates transactions or alerts.
 * Syncs of the same wallet are serialized; different wallets run in parallel.</p>
 */
@Service
public class IngestionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

    private final ChainAdapterRegistry adapterRegistry;
    private final TransactionNormalizer normalizer;
    private final AnomalyScorer anomalyScorer;
    private final AlertStore alertStore;
    private final RuleEngine ruleEngine;
    private final AlertService alertService;
    private final MonitorConfig monitorConfig;
    private final MetricsConfig metricsConfig;

    private final ConcurrentHashMap<String, ReentrantLock> walletLocks = new ConcurrentHashMap<>();

    public IngestionCoordinator(ChainAdapterRegistry adapterRegistry,
                                TransactionNormalizer normalizer,
                                AnomalyScorer anomalyScorer,
                                AlertStore alertStore,
                                RuleEngine ruleEngine,
                                AlertService alertService,
                                MonitorConfig monitorConfig,
                                MetricsConfig metricsConfig) {
        this.adapterRegistry = adapterRegistry;
        this.normalizer = normalizer;
        this.anomalyScorer = anomalyScorer;
        this.alertStore = alertStore;
        this.ruleEngine = ruleEngine;
        this.alertService = alertService;
        this.monitorConfig = monitorConfig;
        this.metricsConfig = metricsConfig;
    }

    /**
     * @throws com.wallet.monitor.adapter.UnsupportedChainException when no adapter is registered for the chain
     */
    @Observed(name = "wallet.sync", contextualName = "sync-wallet")
    public SyncResult sync(String walletAddress, ChainId chain) {
        String address = chain.normalizeAddress(walletAddress);
        if (address == null) {
            throw new ValidationException("walletAddress is required", "walletAddress");
        }
        ChainAdapter adapter = adapterRegistry.get(chain);

        ReentrantLock lock = walletLocks.computeIfAbsent(chain.name() + ":" + address, k -> new ReentrantLock());
        lock.lock();
        try {
            return doSync(adapter, address, chain);
        } finally {
            lock.unlock();
        }
    }

    private SyncResult doSync(ChainAdapter adapter, String address, ChainId chain) {
        // 1. Fetch raw transactions (fail-soft: empty on adapter failure)
        List<RawTransaction> rawTransactions = adapter.getTransactions(address, monitorConfig.getSyncBatchSize());
        log.info("Fetched {} raw transactions for {} on {}", rawTransactions.size(), address, chain);

        int synced = 0;
        int failed = 0;
        int alertCount = 0;

        for (RawTransaction raw : rawTransactions) {
            try {
                IngestOutcome outcome = ingest(raw, address, chain);
                if (outcome.inserted()) {
                    synced++;
                    alertCount += outcome.alertCount();
                }
            } catch (Exception e) {
                failed++;
                log.error("Failed to ingest transaction for {} on {}: {}", address, chain, e.getMessage(), e);
            }
        }

        metricsConfig.recordSync(chain.name(), synced, failed);
        log.info("Sync complete for {} on {}: fetched={}, synced={}, failed={}, alerts={}",
                address, chain, rawTransactions.size(), synced, failed, alertCount);

        return SyncResult.builder()
                .walletAddress(address)
                .chain(chain)
                .fetchedCount(rawTransactions.size())
                .syncedCount(synced)
                .failedCount(failed)
                .alertCount(alertCount)
                .build();
    }

    private IngestOutcome ingest(RawTransaction raw, String address, ChainId chain) {
        // 2. Normalize into the canonical shape
        Transaction txn = normalizer.normalize(raw, chain);
        if (txn.getHash() == null) {
            throw new IllegalArgumentException("Raw transaction has no hash: " + raw);
        }
        txn.setId(UUID.randomUUID().toString());
        txn.setWalletAddress(address);
        txn.setCreatedAt(System.currentTimeMillis());

        // 3. Score against the stored history of this wallet
        List<Transaction> history = new ArrayList<>(
                alertStore.transactionsFor(address, chain, monitorConfig.getHistoryLimit()));
        history.removeIf(h -> txn.getHash().equals(h.getHash()));

        AnomalyAssessment assessment = anomalyScorer.score(txn, history);
        txn.setAnomalyScore(assessment.anomalyScore());
        txn.setRiskLevel(assessment.riskLevel());
        txn.setAnomalyFactors(new ArrayList<>(assessment.contributingFactors()));

        // 4. Store once per hash
        if (!alertStore.insertTransaction(txn)) {
            log.debug("Transaction {} already stored, skipping rule evaluation", txn.getHash());
            return new IngestOutcome(false, 0);
        }
        metricsConfig.recordAnomalyScore(chain.name(), assessment.riskLevel().name(), assessment.anomalyScore());

        // 5. Evaluate rules for new transactions only
        if (!monitorConfig.isRuleEvaluationEnabled()) {
            return new IngestOutcome(true, 0);
        }
        List<Alert> alerts = ruleEngine.evaluateAll(txn, history);
        return new IngestOutcome(true, alertService.persist(alerts));
    }

    private record IngestOutcome(boolean inserted, int alertCount) {}
}
