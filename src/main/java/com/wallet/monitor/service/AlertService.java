package com.wallet.monitor.service;

import com.wallet.monitor.config.MetricsConfig;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertStatus;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Persists alert drafts produced by the rule engine and manages their lifecycle.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertStore alertStore;
    private final MetricsConfig metricsConfig;
    private final TwilioNotificationService notificationService;

    public AlertService(AlertStore alertStore, MetricsConfig metricsConfig,
                        TwilioNotificationService notificationService) {
        this.alertStore = alertStore;
        this.metricsConfig = metricsConfig;
        this.notificationService = notificationService;
    }

    /**
     * Stores every alert and notifies on HIGH ones.
     *
     * @return number of alerts stored
     */
    public int persist(List<Alert> alerts) {
        int stored = 0;
        for (Alert alert : alerts) {
            alertStore.insertAlert(alert);
            stored++;
            metricsConfig.recordAlert(alert.getAlertType().name(), alert.getRiskLevel().name());
            log.info("Alert {} [{}] for wallet {} on {}: {}", alert.getId(), alert.getRiskLevel(),
                    alert.getWalletAddress(), alert.getChain(), alert.getMessage());
            notificationService.notifyIfHighRisk(alert);
        }
        return stored;
    }

    public List<Alert> list(String walletAddress, ChainId chain, AlertStatus status, int limit) {
        String address = walletAddress != null && chain != null ? chain.normalizeAddress(walletAddress) : walletAddress;
        return alertStore.listAlerts(address, chain, status, limit);
    }

    public Optional<Alert> get(String alertId) {
        return alertStore.findAlert(alertId);
    }

    /**
     * @return the resolved alert; empty when the alert does not exist
     * @throws ValidationException when the alert is already resolved
     */
    public Optional<Alert> resolve(String alertId) {
        Optional<Alert> existing = alertStore.findAlert(alertId);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        if (!alertStore.resolveAlert(alertId)) {
            throw new ValidationException("Alert " + alertId + " is not pending", "status");
        }
        log.info("Alert {} resolved", alertId);
        return alertStore.findAlert(alertId);
    }
}
