package com.wallet.monitor.seeder;

import com.wallet.monitor.engine.RuleEngine;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.RuleType;
import com.wallet.monitor.repository.AlertStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Seeds the default alert rules so a fresh installation alerts out of the box.
 * Only runs when the "seed" Spring profile is active; existing rules with the
 * same id are left untouched.
 *
 * Run with:  mvn spring-boot:run -Dspring-boot.run.profiles=seed
 */
@Component
@Profile("seed")
@Order(1)
public class DataSeeder implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(DataSeeder.class);

    private final AlertStore alertStore;
    private final RuleEngine ruleEngine;

    public DataSeeder(AlertStore alertStore, RuleEngine ruleEngine) {
        this.alertStore = alertStore;
        this.ruleEngine = ruleEngine;
    }

    @Override
    public void run(String... args) {
        log.info("=== Seeding default alert rules ===");

        int created = 0;
        for (AlertRule rule : defaultRules()) {
            if (alertStore.findRule(rule.getId()).isPresent()) {
                log.info("Rule {} already present, skipping", rule.getId());
                continue;
            }
            long now = System.currentTimeMillis();
            rule.setCreatedAt(now);
            rule.setUpdatedAt(now);
            alertStore.insertRule(rule);
            created++;
        }

        RuleEngine.ReloadSummary summary = ruleEngine.reload();
        log.info("=== Seeding complete: {} rules created, {} active ===", created, summary.active());
    }

    static List<AlertRule> defaultRules() {
        return List.of(
                AlertRule.builder()
                        .id("RULE-LARGE-TX")
                        .name("Large transaction")
                        .description("Flag transactions above 10 units of the chain's native currency")
                        .ruleType(RuleType.TRANSACTION)
                        .threshold(10.0)
                        .enabled(true)
                        .build(),
                AlertRule.builder()
                        .id("RULE-LOW-BALANCE")
                        .name("Low balance")
                        .description("Flag wallets whose balance drops below 0.1 units")
                        .ruleType(RuleType.BALANCE)
                        .threshold(0.1)
                        .enabled(true)
                        .build(),
                AlertRule.builder()
                        .id("RULE-CONTRACT")
                        .name("Contract interaction")
                        .description("Flag every transaction that calls a contract")
                        .ruleType(RuleType.CONTRACT)
                        .enabled(true)
                        .build(),
                AlertRule.builder()
                        .id("RULE-AMOUNT-ANOMALY")
                        .name("Amount anomaly")
                        .description("Flag amounts above 3x the wallet's historical mean")
                        .ruleType(RuleType.ANOMALY)
                        .threshold(3.0)
                        .enabled(true)
                        .build(),
                AlertRule.builder()
                        .id("RULE-HIGH-FREQUENCY")
                        .name("High frequency")
                        .description("Flag more than 10 transactions within an hour")
                        .ruleType(RuleType.FREQUENCY)
                        .expression("count > 10 in 3600")
                        .enabled(true)
                        .build());
    }
}
