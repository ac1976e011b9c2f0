package com.wallet.monitor.service;

import com.wallet.monitor.config.MonitorConfig;
import com.wallet.monitor.engine.RuleEngine;
import com.wallet.monitor.engine.rules.RuleCompilationException;
import com.wallet.monitor.engine.rules.RuleCompiler;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service layer for managing alert rules.
 * Every mutation reloads the rule engine snapshot.
 */
@Service
public class RuleService {

    private static final Logger log = LoggerFactory.getLogger(RuleService.class);

    private final AlertStore alertStore;
    private final RuleEngine ruleEngine;
    private final int historyLimit;

    public RuleService(AlertStore alertStore, RuleEngine ruleEngine,
                       MonitorConfig monitorConfig) {
        this.alertStore = alertStore;
        this.ruleEngine = ruleEngine;
        this.historyLimit = monitorConfig.getHistoryLimit();
    }

    public List<AlertRule> getRules(boolean enabledOnly) {
        return enabledOnly ? alertStore.enabledRules() : alertStore.allRules();
    }

    public Optional<AlertRule> getRule(String ruleId) {
        return alertStore.findRule(ruleId);
    }

    public AlertRule createRule(AlertRule rule) {
        if (rule.getName() == null || rule.getName().isBlank()) {
            throw new ValidationException("name is required", "name");
        }
        if (rule.getRuleType() == null) {
            throw new ValidationException("ruleType is required", "ruleType");
        }
        validate(rule);

        if (rule.getId() == null || rule.getId().isEmpty()) {
            rule.setId("RULE-" + UUID.randomUUID());
        }
        long now = System.currentTimeMillis();
        rule.setCreatedAt(now);
        rule.setUpdatedAt(now);

        alertStore.insertRule(rule);
        log.info("Created rule {} ({}, {})", rule.getId(), rule.getName(), rule.getRuleType());
        ruleEngine.reload();
        return rule;
    }

    public Optional<AlertRule> updateRule(String ruleId, AlertRule updated) {
        Optional<AlertRule> found = alertStore.findRule(ruleId);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        AlertRule existing = found.get();

        // Update mutable fields
        if (updated.getName() != null) existing.setName(updated.getName());
        if (updated.getDescription() != null) existing.setDescription(updated.getDescription());
        if (updated.getRuleType() != null) existing.setRuleType(updated.getRuleType());
        if (updated.getThreshold() != null) existing.setThreshold(updated.getThreshold());
        if (updated.getExpression() != null) {
            existing.setExpression(updated.getExpression().isBlank() ? null : updated.getExpression());
        }
        existing.setEnabled(updated.isEnabled());
        validate(existing);
        existing.setUpdatedAt(System.currentTimeMillis());

        alertStore.updateRule(existing);
        log.info("Updated rule {}", ruleId);
        ruleEngine.reload();
        return Optional.of(existing);
    }

    public boolean deleteRule(String ruleId) {
        boolean deleted = alertStore.deleteRule(ruleId);
        if (deleted) {
            log.info("Deleted rule {}", ruleId);
            ruleEngine.reload();
        }
        return deleted;
    }

    public RuleEngine.ReloadSummary reload() {
        return ruleEngine.reload();
    }

    /**
     * Runs the active rules against a stored transaction without persisting alerts.
     */
    public Optional<List<Alert>> evaluateStoredTransaction(String rawHash) {
        String hash = ChainId.normalizeAnyHash(rawHash);
        if (hash == null) {
            return Optional.empty();
        }
        Optional<Transaction> found = alertStore.findTransaction(hash);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Transaction txn = found.get();
        List<Transaction> history = new ArrayList<>(
                alertStore.transactionsFor(txn.getWalletAddress(), txn.getChain(), historyLimit));
        history.removeIf(h -> hash.equals(h.getHash()));
        return Optional.of(ruleEngine.evaluateAll(txn, history));
    }

    private void validate(AlertRule rule) {
        try {
            RuleCompiler.compile(rule);
        } catch (RuleCompilationException e) {
            String field = rule.getExpression() != null ? "expression" : "threshold";
            throw new ValidationException(e.getMessage(), field);
        }
    }
}
