package com.wallet.monitor.repository;

import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.AlertStatus;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.model.Wallet;

import java.util.List;
import java.util.Optional;

/**
 * Durable storage of wallets, transactions, alert rules and alerts.
 *
 * <p>Uniqueness is enforced by the store itself: one wallet per
 * (address, chain) and one transaction per hash, even under concurrent inserts.
 * Every write is atomic per record. Nullable filter arguments mean "any".</p>
 */
public interface AlertStore {

    // --- wallets ---

    /**
     * Registers the wallet unless one with the same (address, chain) exists.
     *
     * @return the stored wallet; the pre-existing row when the wallet was already registered
     */
    Wallet insertWallet(Wallet wallet);

    Optional<Wallet> findWallet(String address, ChainId chain);

    List<Wallet> listWallets(ChainId chain, boolean activeOnly);

    /**
     * Changes the non-null name and description only; the active flag is left as stored.
     *
     * @return the updated wallet, or empty when it does not exist
     */
    Optional<Wallet> updateWalletDetails(String address, ChainId chain, String name, String description);

    /**
     * @return false when the wallet does not exist
     */
    boolean deactivateWallet(String address, ChainId chain);

    // --- transactions ---

    /**
     * @return true if stored, false if a transaction with the same hash already exists
     *         (the existing row is left untouched)
     */
    boolean insertTransaction(Transaction transaction);

    Optional<Transaction> findTransaction(String hash);

    /**
     * Transactions newest first by timestamp; rows without a timestamp sort last.
     */
    List<Transaction> transactionsFor(String walletAddress, ChainId chain, int limit);

    // --- rules ---

    void insertRule(AlertRule rule);

    void updateRule(AlertRule rule);

    boolean deleteRule(String ruleId);

    Optional<AlertRule> findRule(String ruleId);

    List<AlertRule> allRules();

    default List<AlertRule> enabledRules() {
        return allRules().stream().filter(AlertRule::isEnabled).toList();
    }

    // --- alerts ---

    /**
     * Appends the alert. No uniqueness constraint applies.
     */
    void insertAlert(Alert alert);

    Optional<Alert> findAlert(String id);

    /**
     * Alerts newest first by creation time.
     */
    List<Alert> listAlerts(String walletAddress, ChainId chain, AlertStatus status, int limit);

    /**
     * Moves a PENDING alert to RESOLVED.
     *
     * @return false when the alert does not exist or is not pending
     */
    boolean resolveAlert(String id);
}
