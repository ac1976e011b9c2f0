package com.wallet.monitor.repository;

import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.AlertStatus;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.model.Wallet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * {@link AlertStore} over one Aerospike set per record family. Uniqueness comes
 * from CREATE_ONLY writes on natural keys, so concurrent inserts race safely on the server.
 */
@Repository
public class AerospikeAlertStore implements AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AerospikeAlertStore.class);

    private final WalletRepository walletRepository;
    private final TransactionRepository transactionRepository;
    private final AlertRuleRepository alertRuleRepository;
    private final AlertRepository alertRepository;

    public AerospikeAlertStore(WalletRepository walletRepository,
                               TransactionRepository transactionRepository,
                               AlertRuleRepository alertRuleRepository,
                               AlertRepository alertRepository) {
        this.walletRepository = walletRepository;
        this.transactionRepository = transactionRepository;
        this.alertRuleRepository = alertRuleRepository;
        this.alertRepository = alertRepository;
    }

    @Override
    public Wallet insertWallet(Wallet wallet) {
        if (walletRepository.insert(wallet)) {
            log.info("Registered wallet {} on {}", wallet.getAddress(), wallet.getChain());
            return wallet;
        }
        Wallet existing = walletRepository.find(wallet.getAddress(), wallet.getChain());
        return existing != null ? existing : wallet;
    }

    @Override
    public Optional<Wallet> findWallet(String address, ChainId chain) {
        return Optional.ofNullable(walletRepository.find(address, chain));
    }

    @Override
    public List<Wallet> listWallets(ChainId chain, boolean activeOnly) {
        return walletRepository.findAll(chain, activeOnly);
    }

    @Override
    public Optional<Wallet> updateWalletDetails(String address, ChainId chain, String name, String description) {
        return Optional.ofNullable(walletRepository.updateDetails(address, chain, name, description,
                System.currentTimeMillis()));
    }

    @Override
    public boolean deactivateWallet(String address, ChainId chain) {
        return walletRepository.deactivate(address, chain, System.currentTimeMillis());
    }

    @Override
    public boolean insertTransaction(Transaction transaction) {
        return transactionRepository.insert(transaction);
    }

    @Override
    public Optional<Transaction> findTransaction(String hash) {
        return Optional.ofNullable(transactionRepository.findByHash(hash));
    }

    @Override
    public List<Transaction> transactionsFor(String walletAddress, ChainId chain, int limit) {
        return transactionRepository.find(walletAddress, chain, limit);
    }

    @Override
    public void insertRule(AlertRule rule) {
        alertRuleRepository.save(rule);
    }

    @Override
    public void updateRule(AlertRule rule) {
        alertRuleRepository.save(rule);
    }

    @Override
    public boolean deleteRule(String ruleId) {
        return alertRuleRepository.delete(ruleId);
    }

    @Override
    public Optional<AlertRule> findRule(String ruleId) {
        return Optional.ofNullable(alertRuleRepository.findById(ruleId));
    }

    @Override
    public List<AlertRule> allRules() {
        return alertRuleRepository.findAll();
    }

    @Override
    public void insertAlert(Alert alert) {
        alertRepository.save(alert);
    }

    @Override
    public Optional<Alert> findAlert(String id) {
        return Optional.ofNullable(alertRepository.findById(id));
    }

    @Override
    public List<Alert> listAlerts(String walletAddress, ChainId chain, AlertStatus status, int limit) {
        return alertRepository.find(walletAddress, chain, status, limit);
    }

    @Override
    public boolean resolveAlert(String id) {
        return alertRepository.resolve(id, System.currentTimeMillis());
    }
}
