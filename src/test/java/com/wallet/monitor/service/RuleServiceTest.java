package com.wallet.monitor.service;

import com.wallet.monitor.config.MonitorConfig;
import com.wallet.monitor.engine.RuleEngine;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.AlertStatus;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.RuleType;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.testutil.InMemoryAlertStore;
import com.wallet.monitor.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static com.wallet.monitor.testutil.TestDataFactory.BASE_TIME;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RuleServiceTest {

    @Mock private RuleEngine ruleEngine;

    private InMemoryAlertStore store;
    private RuleService ruleService;

    @BeforeEach
    void setUp() {
        store = new InMemoryAlertStore();
        ruleService = new RuleService(store, ruleEngine, new MonitorConfig());
    }

    @Test
    void createRule_assignsIdAndReloads() {
        AlertRule rule = AlertRule.builder().name("Large transfer").ruleType(RuleType.TRANSACTION).threshold(10.0).build();

        AlertRule created = ruleService.createRule(rule);

        assertThat(created.getId()).startsWith("RULE-");
        assertThat(created.getCreatedAt()).isPositive();
        assertThat(created.isEnabled()).isTrue();
        assertThat(store.findRule(created.getId())).isPresent();
        verify(ruleEngine).reload();
    }

    @Test
    void createRule_keepsCallerId() {
        AlertRule rule = TestDataFactory.createRule("RULE-MINE", RuleType.CONTRACT, null, null);

        assertThat(ruleService.createRule(rule).getId()).isEqualTo("RULE-MINE");
    }

    @Test
    void createRule_missingThreshold_rejected() {
        AlertRule rule = AlertRule.builder().name("No threshold").ruleType(RuleType.BALANCE).build();

        assertThatThrownBy(() -> ruleService.createRule(rule))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("threshold"));
        assertThat(store.allRules()).isEmpty();
        verify(ruleEngine, never()).reload();
    }

    @Test
    void createRule_badExpression_rejectedOnExpressionField() {
        AlertRule rule = AlertRule.builder().name("Bad").ruleType(RuleType.TRANSACTION).expression("amount >> 3").build();

        assertThatThrownBy(() -> ruleService.createRule(rule))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getField()).isEqualTo("expression"));
    }

    @Test
    void createRule_missingNameOrType_rejected() {
        assertThatThrownBy(() -> ruleService.createRule(
                AlertRule.builder().ruleType(RuleType.CONTRACT).build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("name");
        assertThatThrownBy(() -> ruleService.createRule(
                AlertRule.builder().name("x").build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("ruleType");
    }

    @Test
    void updateRule_appliesPresentFieldsAndReloads() {
        store.insertRule(TestDataFactory.createRule("R1", RuleType.TRANSACTION, 10.0, null));
        AlertRule patch = AlertRule.builder().threshold(25.0).enabled(false).build();

        Optional<AlertRule> updated = ruleService.updateRule("R1", patch);

        assertThat(updated).isPresent();
        assertThat(updated.get().getThreshold()).isEqualTo(25.0);
        assertThat(updated.get().isEnabled()).isFalse();
        assertThat(updated.get().getName()).isEqualTo("Test rule R1");
        verify(ruleEngine).reload();
    }

    @Test
    void updateRule_blankExpressionClearsIt() {
        store.insertRule(TestDataFactory.createRule("R1", RuleType.TRANSACTION, 10.0, "amount >= 2"));

        AlertRule updated = ruleService.updateRule("R1", AlertRule.builder().expression(" ").build()).orElseThrow();

        assertThat(updated.getExpression()).isNull();
    }

    @Test
    void updateRule_unknownId_returnsEmpty() {
        assertThat(ruleService.updateRule("missing", new AlertRule())).isEmpty();
        verifyNoInteractions(ruleEngine);
    }

    @Test
    void deleteRule_reloadsOnlyWhenDeleted() {
        store.insertRule(TestDataFactory.createRule("R1", RuleType.CONTRACT, null, null));

        assertThat(ruleService.deleteRule("R1")).isTrue();
        assertThat(ruleService.deleteRule("R1")).isFalse();
        verify(ruleEngine, times(1)).reload();
    }

    @Test
    void getRules_filtersDisabled() {
        AlertRule disabled = TestDataFactory.createRule("R2", RuleType.CONTRACT, null, null);
        disabled.setEnabled(false);
        store.insertRule(TestDataFactory.createRule("R1", RuleType.CONTRACT, null, null));
        store.insertRule(disabled);

        assertThat(ruleService.getRules(true)).extracting(AlertRule::getId).containsExactly("R1");
        assertThat(ruleService.getRules(false)).hasSize(2);
    }

    @Test
    void evaluateStoredTransaction_excludesItselfFromHistory() {
        Transaction target = TestDataFactory.createTransaction("0xa", 50, BASE_TIME);
        store.insertTransaction(target);
        store.insertTransaction(TestDataFactory.createTransaction("0xb", 5, BASE_TIME - 600));
        Alert alert = TestDataFactory.createAlert("A1", RiskLevel.HIGH, AlertStatus.PENDING);
        when(ruleEngine.evaluateAll(eq(target), anyList())).thenReturn(List.of(alert));

        Optional<List<Alert>> result = ruleService.evaluateStoredTransaction("0xa");

        assertThat(result).contains(List.of(alert));
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Transaction>> history = ArgumentCaptor.forClass(List.class);
        verify(ruleEngine).evaluateAll(eq(target), history.capture());
        assertThat(history.getValue()).extracting(Transaction::getHash).containsExactly("0xb");
        assertThat(store.allAlerts()).isEmpty();
    }

    @Test
    void evaluateStoredTransaction_unknownHash_returnsEmpty() {
        assertThat(ruleService.evaluateStoredTransaction("0xnone")).isEmpty();
        verify(ruleEngine, never()).evaluateAll(any(), any());
    }
}
