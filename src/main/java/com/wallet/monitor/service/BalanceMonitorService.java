package com.wallet.monitor.service;

import com.wallet.monitor.adapter.ChainAdapterRegistry;
import com.wallet.monitor.engine.RuleEngine;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.BalanceReading;
import com.wallet.monitor.model.ChainId;
import io.swagger.v3.oas.annotations.media.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Reads a wallet balance and evaluates BALANCE rules against it. Rule thresholds are
 * in the chain's native unit, so token balances are reported but not evaluated.
 */
@Service
public class BalanceMonitorService {

    private static final Logger log = LoggerFactory.getLogger(BalanceMonitorService.class);

    private final ChainAdapterRegistry adapterRegistry;
    private final RuleEngine ruleEngine;
    private final AlertService alertService;

    public BalanceMonitorService(ChainAdapterRegistry adapterRegistry, RuleEngine ruleEngine,
                                 AlertService alertService) {
        this.adapterRegistry = adapterRegistry;
        this.ruleEngine = ruleEngine;
        this.alertService = alertService;
    }

    public BalanceCheck checkBalance(String rawAddress, ChainId chain) {
        return checkBalance(rawAddress, chain, null);
    }

    public BalanceCheck checkBalance(String rawAddress, ChainId chain, String rawTokenAddress) {
        String address = chain.normalizeAddress(rawAddress);
        if (address == null) {
            throw new ValidationException("address is required", "address");
        }

        String tokenAddress = chain.normalizeAddress(rawTokenAddress);

        BalanceReading reading = adapterRegistry.get(chain).getBalance(address, tokenAddress);
        if (!reading.isAvailable()) {
            // no rule may fire on a reading that is not a real zero
            log.warn("Balance unavailable for {} on {}, skipping balance rules", address, chain);
            return new BalanceCheck(reading, List.of());
        }
        if (tokenAddress != null) {
            return new BalanceCheck(reading, List.of());
        }

        List<Alert> alerts = ruleEngine.evaluateBalance(address, chain, reading.getBalance());
        alertService.persist(alerts);
        return new BalanceCheck(reading, alerts);
    }

    @Schema(description = "Balance reading and the alerts it produced")
    public record BalanceCheck(BalanceReading reading, List<Alert> alerts) {}
}
