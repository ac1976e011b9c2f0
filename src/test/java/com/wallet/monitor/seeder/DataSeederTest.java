package com.wallet.monitor.seeder;

import com.wallet.monitor.config.MetricsConfig;
import com.wallet.monitor.config.ScoringConfig;
import com.wallet.monitor.engine.AnomalyScorer;
import com.wallet.monitor.engine.RuleEngine;
import com.wallet.monitor.engine.evaluators.AmountAnomalyEvaluator;
import com.wallet.monitor.engine.evaluators.BalanceThresholdEvaluator;
import com.wallet.monitor.engine.evaluators.ContractInteractionEvaluator;
import com.wallet.monitor.engine.evaluators.TransactionAmountEvaluator;
import com.wallet.monitor.engine.evaluators.TransactionFrequencyEvaluator;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.RuleType;
import com.wallet.monitor.testutil.InMemoryAlertStore;
import com.wallet.monitor.testutil.TestDataFactory;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class DataSeederTest {

    @Mock private MetricsConfig metricsConfig;

    private InMemoryAlertStore store;
    private RuleEngine ruleEngine;
    private DataSeeder seeder;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertStore();
        ruleEngine = new RuleEngine(store, List.of(
                new TransactionAmountEvaluator(),
                new BalanceThresholdEvaluator(),
                new ContractInteractionEvaluator(),
                new AmountAnomalyEvaluator(new AnomalyScorer(new ScoringConfig())),
                new TransactionFrequencyEvaluator()), Tracer.NOOP, metricsConfig);
        seeder = new DataSeeder(store, ruleEngine);
    }

    @Test
    void run_seedsOneValidRulePerType() {
        seeder.run();

        assertThat(store.allRules()).hasSize(5);
        assertThat(store.allRules()).extracting(AlertRule::getRuleType).containsExactlyInAnyOrder(RuleType.values());
        for (RuleType type : RuleType.values()) {
            assertThat(ruleEngine.activeRules(type)).hasSize(1);
        }
        verify(metricsConfig, never()).recordRuleSkipped(anyString());
    }

    @Test
    void run_leavesExistingRulesUntouched() {
        AlertRule customized = TestDataFactory.createRule("RULE-LARGE-TX", RuleType.TRANSACTION, 500.0, null);
        store.insertRule(customized);

        seeder.run();
        seeder.run();

        assertThat(store.allRules()).hasSize(5);
        assertThat(store.findRule("RULE-LARGE-TX")).get()
                .extracting(AlertRule::getThreshold).isEqualTo(500.0);
    }
}
