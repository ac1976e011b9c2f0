package com.wallet.monitor.engine;

import com.wallet.monitor.config.ScoringConfig;
import com.wallet.monitor.model.AnomalyAssessment;
import com.wallet.monitor.model.AnomalyFactor;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.Transaction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Additive anomaly score of a transaction relative to its wallet's history.
 *
 * <p>Three binary factors contribute fixed weights:</p>
 * <ul>
 *   <li>LARGE_AMOUNT: amount above {@code largeAmountMultiplier} times the history mean.
 *       Never fires on an empty history.</li>
 *   <li>UNFAMILIAR_COUNTERPARTY: the destination never appears as sender or receiver in
 *       the history. A missing destination counts as unfamiliar.</li>
 *   <li>HIGH_FREQUENCY: more than {@code frequencyCountThreshold} history transactions
 *       within the trailing window before this one. Needs a timestamp.</li>
 * </ul>
 *
 * <p>Stateless and deterministic; the score is rounded to 6 decimals so that
 * weight sums land exactly on the risk tier boundaries.</p>
 */
@Component
public class AnomalyScorer {

    private final ScoringConfig config;

    public AnomalyScorer(ScoringConfig config) {
        this.config = config;
    }

    public AnomalyAssessment score(Transaction txn, List<Transaction> history) {
        List<Transaction> safeHistory = history != null ? history : List.of();
        List<AnomalyFactor> factors = new ArrayList<>();
        double score = 0.0;

        if (isAmountAnomalous(txn, safeHistory, config.getLargeAmountMultiplier())) {
            score += config.getLargeAmountWeight();
            factors.add(AnomalyFactor.LARGE_AMOUNT);
        }

        if (!isFamiliarCounterparty(txn.getToAddress(), safeHistory)) {
            score += config.getUnfamiliarCounterpartyWeight();
            factors.add(AnomalyFactor.UNFAMILIAR_COUNTERPARTY);
        }

        if (countWithinWindow(txn, safeHistory, config.getFrequencyWindowSeconds()) > config.getFrequencyCountThreshold()) {
            score += config.getHighFrequencyWeight();
            factors.add(AnomalyFactor.HIGH_FREQUENCY);
        }

        double rounded = Math.round(score * 1_000_000d) / 1_000_000d;
        double clamped = Math.max(0.0, Math.min(1.0, rounded));
        return new AnomalyAssessment(clamped, factors, RiskLevel.fromScore(clamped));
    }

    /**
     * @return true when the amount exceeds {@code multiplier} times the mean
     *         history amount; false on an empty history
     */
    public boolean isAmountAnomalous(Transaction txn, List<Transaction> history, double multiplier) {
        if (history == null || history.isEmpty()) return false;
        return txn.getAmount() > multiplier * meanAmount(history);
    }

    public static double meanAmount(List<Transaction> history) {
        return history.stream().mapToDouble(Transaction::getAmount).average().orElse(0.0);
    }

    /**
     * History transactions with {@code 0 <= txn.timestamp - h.timestamp < windowSeconds}.
     * Zero when the transaction has no timestamp.
     */
    public static long countWithinWindow(Transaction txn, List<Transaction> history, long windowSeconds) {
        Long now = txn.getTimestamp();
        if (now == null) return 0;
        return history.stream()
                .map(Transaction::getTimestamp)
                .filter(Objects::nonNull)
                .filter(ts -> {
                    long delta = now - ts;
                    return delta >= 0 && delta < windowSeconds;
                })
                .count();
    }

    private boolean isFamiliarCounterparty(String toAddress, List<Transaction> history) {
        if (toAddress == null) return false;
        for (Transaction h : history) {
            if (toAddress.equals(h.getFromAddress()) || toAddress.equals(h.getToAddress())) {
                return true;
            }
        }
        return false;
    }
}
