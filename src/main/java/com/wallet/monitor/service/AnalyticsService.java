package com.wallet.monitor.service;

import com.wallet.monitor.adapter.ChainAdapterRegistry;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertPatterns;
import com.wallet.monitor.model.AlertStatus;
import com.wallet.monitor.model.AssetDistribution;
import com.wallet.monitor.model.BalanceReading;
import com.wallet.monitor.model.ChainBalance;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.ChainVolume;
import com.wallet.monitor.model.DailyVolume;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.RuleType;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.model.TransactionSummary;
import com.wallet.monitor.model.TransactionTrend;
import com.wallet.monitor.model.Wallet;
import com.wallet.monitor.model.WalletActivity;
import com.wallet.monitor.model.WalletAnalysis;
import com.wallet.monitor.model.WalletAnomaly;
import com.wallet.monitor.model.WalletBalance;
import com.wallet.monitor.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only statistics over stored transactions, alerts and live wallet balances.
 * Volumes are kept per chain; amounts of different chains are never added together.
 */
@Service
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    static final double LARGE_AMOUNT_MULTIPLIER = 3.0;
    static final double LARGE_AMOUNT_HIGH_FRACTION_OF_MAX = 0.8;
    static final long RAPID_SUCCESSION_SECONDS = 60;
    static final int TREND_PERIOD_DAYS = 30;

    private static final DateTimeFormatter DAY = DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);

    private final AlertStore alertStore;
    private final ChainAdapterRegistry adapterRegistry;

    public AnalyticsService(AlertStore alertStore, ChainAdapterRegistry adapterRegistry) {
        this.alertStore = alertStore;
        this.adapterRegistry = adapterRegistry;
    }

    /**
     * @return empty when the wallet has no stored transactions
     */
    public Optional<WalletAnalysis> analyzeWallet(String rawAddress, ChainId chain) {
        String address = chain.normalizeAddress(rawAddress);
        if (address == null) {
            throw new ValidationException("walletAddress is required", "walletAddress");
        }
        List<Transaction> transactions = alertStore.transactionsFor(address, chain, Integer.MAX_VALUE);
        if (transactions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(WalletAnalysis.builder()
                .walletAddress(address)
                .chain(chain)
                .activity(walletActivity(address, chain, transactions))
                .trend(transactionTrend(address, transactions, TREND_PERIOD_DAYS, Instant.now().getEpochSecond()))
                .anomalies(walletAnomalies(transactions))
                .build());
    }

    public WalletActivity walletActivity(String address, ChainId chain, List<Transaction> transactions) {
        double incoming = 0;
        double outgoing = 0;
        double volume = 0;
        Map<String, Integer> countByDay = new TreeMap<>();

        for (Transaction tx : transactions) {
            volume += tx.getAmount();
            if (address.equals(tx.getFromAddress())) {
                outgoing += tx.getAmount();
            } else if (address.equals(tx.getToAddress())) {
                incoming += tx.getAmount();
            }
            if (tx.getTimestamp() != null) {
                countByDay.merge(DAY.format(Instant.ofEpochSecond(tx.getTimestamp())), 1, Integer::sum);
            }
        }

        // earliest day wins ties
        String mostActiveDay = null;
        int maxCount = 0;
        for (Map.Entry<String, Integer> entry : countByDay.entrySet()) {
            if (entry.getValue() > maxCount) {
                maxCount = entry.getValue();
                mostActiveDay = entry.getKey();
            }
        }

        int count = transactions.size();
        return WalletActivity.builder()
                .walletAddress(address)
                .chain(chain)
                .unit(chain.getNativeUnit())
                .transactionCount(count)
                .incomingVolume(incoming)
                .outgoingVolume(outgoing)
                .totalVolume(volume)
                .averageAmount(count > 0 ? volume / count : 0.0)
                .countByDay(countByDay)
                .mostActiveDay(mostActiveDay)
                .contractInteractions((int) transactions.stream().filter(Transaction::isContractInteraction).count())
                .anomalyCount((int) transactions.stream().filter(tx -> tx.getRiskLevel().isElevated()).count())
                .build();
    }

    /**
     * LARGE_AMOUNT for amounts above 3x the mean of positive amounts (HIGH when above
     * 0.8x the largest amount); RAPID_SUCCESSION for consecutive transactions under 60s apart.
     */
    public List<WalletAnomaly> walletAnomalies(List<Transaction> transactions) {
        List<WalletAnomaly> anomalies = new ArrayList<>();

        double[] positive = transactions.stream().mapToDouble(Transaction::getAmount).filter(a -> a > 0).toArray();
        if (positive.length == 0) {
            return anomalies;
        }
        double mean = Arrays.stream(positive).average().orElse(0.0);
        double max = Arrays.stream(positive).max().orElse(0.0);

        for (Transaction tx : transactions) {
            if (tx.getAmount() > mean * LARGE_AMOUNT_MULTIPLIER) {
                anomalies.add(WalletAnomaly.builder()
                        .kind(WalletAnomaly.Kind.LARGE_AMOUNT)
                        .transactionHash(tx.getHash())
                        .riskLevel(tx.getAmount() > max * LARGE_AMOUNT_HIGH_FRACTION_OF_MAX ? RiskLevel.HIGH : RiskLevel.MEDIUM)
                        .description(String.format("Amount %.4f is above %.1fx the mean %.4f",
                                tx.getAmount(), LARGE_AMOUNT_MULTIPLIER, mean))
                        .timestamp(tx.getTimestamp())
                        .build());
            }
        }

        List<Transaction> timed = transactions.stream()
                .filter(tx -> tx.getTimestamp() != null)
                .sorted(Comparator.comparing(Transaction::getTimestamp))
                .toList();
        for (int i = 1; i < timed.size(); i++) {
            long gap = timed.get(i).getTimestamp() - timed.get(i - 1).getTimestamp();
            if (gap < RAPID_SUCCESSION_SECONDS) {
                anomalies.add(WalletAnomaly.builder()
                        .kind(WalletAnomaly.Kind.RAPID_SUCCESSION)
                        .transactionHash(timed.get(i).getHash())
                        .riskLevel(RiskLevel.MEDIUM)
                        .description(String.format("%d seconds after the previous transaction", gap))
                        .timestamp(timed.get(i).getTimestamp())
                        .build());
            }
        }
        return anomalies;
    }

    public TransactionTrend transactionTrend(String address, List<Transaction> transactions, int days, long nowEpochSeconds) {
        long start = nowEpochSeconds - days * 86_400L;
        Map<String, double[]> byDay = new TreeMap<>(); // count, volume, incoming, outgoing

        for (Transaction tx : transactions) {
            if (tx.getTimestamp() == null || tx.getTimestamp() < start) continue;
            double[] stats = byDay.computeIfAbsent(DAY.format(Instant.ofEpochSecond(tx.getTimestamp())), d -> new double[4]);
            stats[0]++;
            stats[1] += tx.getAmount();
            if (address.equals(tx.getFromAddress())) {
                stats[3] += tx.getAmount();
            } else {
                stats[2] += tx.getAmount();
            }
        }

        List<DailyVolume> daily = new ArrayList<>();
        byDay.forEach((day, s) -> daily.add(new DailyVolume(day, (int) s[0], s[1], s[2], s[3])));

        double avgCount = daily.stream().mapToInt(DailyVolume::count).average().orElse(0.0);
        double avgVolume = daily.stream().mapToDouble(DailyVolume::volume).average().orElse(0.0);

        TransactionTrend.Direction direction = TransactionTrend.Direction.STABLE;
        if (daily.size() >= 2) {
            int half = daily.size() / 2;
            double first = daily.subList(0, half).stream().mapToDouble(DailyVolume::volume).sum();
            double second = daily.subList(half, daily.size()).stream().mapToDouble(DailyVolume::volume).sum();
            if (second > first * 1.2) {
                direction = TransactionTrend.Direction.INCREASING;
            } else if (second < first * 0.8) {
                direction = TransactionTrend.Direction.DECREASING;
            }
        }

        return TransactionTrend.builder()
                .periodDays(days)
                .daily(daily)
                .averageDailyCount(avgCount)
                .averageDailyVolume(avgVolume)
                .direction(direction)
                .build();
    }

    public TransactionSummary transactionSummary() {
        List<Transaction> transactions = alertStore.transactionsFor(null, null, Integer.MAX_VALUE);

        Map<ChainId, int[]> counts = new EnumMap<>(ChainId.class);
        Map<ChainId, Double> volumes = new EnumMap<>(ChainId.class);
        Map<RiskLevel, Integer> byRisk = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) byRisk.put(level, 0);

        int contractInteractions = 0;
        for (Transaction tx : transactions) {
            if (tx.getChain() != null) {
                counts.computeIfAbsent(tx.getChain(), c -> new int[1])[0]++;
                volumes.merge(tx.getChain(), tx.getAmount(), Double::sum);
            }
            byRisk.merge(tx.getRiskLevel(), 1, Integer::sum);
            if (tx.isContractInteraction()) contractInteractions++;
        }

        List<ChainVolume> byChain = new ArrayList<>();
        counts.forEach((chain, count) ->
                byChain.add(new ChainVolume(chain, chain.getNativeUnit(), count[0], volumes.getOrDefault(chain, 0.0))));

        return TransactionSummary.builder()
                .totalTransactions(transactions.size())
                .byChain(byChain)
                .byRiskLevel(byRisk)
                .contractInteractions(contractInteractions)
                .build();
    }

    public AlertPatterns alertPatterns() {
        List<Alert> alerts = alertStore.listAlerts(null, null, null, Integer.MAX_VALUE);

        Map<RiskLevel, Integer> byRisk = new EnumMap<>(RiskLevel.class);
        for (RiskLevel level : RiskLevel.values()) byRisk.put(level, 0);
        Map<RuleType, Integer> byType = new EnumMap<>(RuleType.class);
        Map<String, Integer> byWallet = new LinkedHashMap<>();
        Map<ChainId, Integer> byChain = new EnumMap<>(ChainId.class);
        int pending = 0;

        for (Alert alert : alerts) {
            if (alert.getRiskLevel() != null) byRisk.merge(alert.getRiskLevel(), 1, Integer::sum);
            if (alert.getAlertType() != null) byType.merge(alert.getAlertType(), 1, Integer::sum);
            if (alert.getWalletAddress() != null) byWallet.merge(alert.getWalletAddress(), 1, Integer::sum);
            if (alert.getChain() != null) byChain.merge(alert.getChain(), 1, Integer::sum);
            if (Objects.equals(alert.getStatus(), AlertStatus.PENDING)) pending++;
        }

        return AlertPatterns.builder()
                .totalAlerts(alerts.size())
                .pendingAlerts(pending)
                .byRiskLevel(byRisk)
                .byType(byType)
                .byWallet(byWallet)
                .byChain(byChain)
                .build();
    }

    /**
     * Reads the native balance of every active wallet, optionally on one chain only.
     * Wallets whose balance cannot be read (no adapter, or the chain did not answer)
     * are counted as unavailable and left out of the totals.
     */
    public AssetDistribution assetDistribution(ChainId chainFilter) {
        List<Wallet> wallets = alertStore.listWallets(chainFilter, true);

        List<WalletBalance> byWallet = new ArrayList<>();
        Map<ChainId, int[]> walletCounts = new EnumMap<>(ChainId.class);
        Map<ChainId, Double> totals = new EnumMap<>(ChainId.class);
        int unavailable = 0;

        for (Wallet wallet : wallets) {
            ChainId chain = wallet.getChain();
            if (chain == null || !adapterRegistry.isSupported(chain)) {
                unavailable++;
                continue;
            }
            BalanceReading reading = adapterRegistry.get(chain).getBalance(wallet.getAddress(), null);
            if (!reading.isAvailable()) {
                unavailable++;
                continue;
            }
            byWallet.add(new WalletBalance(wallet.getAddress(), chain, wallet.getName(),
                    chain.getNativeUnit(), reading.getBalance()));
            walletCounts.computeIfAbsent(chain, c -> new int[1])[0]++;
            totals.merge(chain, reading.getBalance(), Double::sum);
        }
        if (unavailable > 0) {
            log.warn("Asset distribution: {} of {} wallets had no readable balance", unavailable, wallets.size());
        }

        List<ChainBalance> byChain = new ArrayList<>();
        walletCounts.forEach((chain, count) ->
                byChain.add(new ChainBalance(chain, chain.getNativeUnit(), count[0], totals.get(chain))));
        byWallet.sort(Comparator.comparingDouble(WalletBalance::balance).reversed());

        return AssetDistribution.builder()
                .walletCount(wallets.size())
                .byChain(byChain)
                .byWallet(byWallet)
                .unavailableCount(unavailable)
                .build();
    }
}
