package com.wallet.monitor.engine.evaluators;

import com.wallet.monitor.engine.AnomalyScorer;
import com.wallet.monitor.engine.EvaluationContext;
import com.wallet.monitor.engine.RuleEvaluator;
import com.wallet.monitor.engine.rules.CompiledRule;
import com.wallet.monitor.engine.rules.ComparisonCondition;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.RuleResult;
import com.wallet.monitor.model.RuleType;
import com.wallet.monitor.model.Transaction;
import org.springframework.stereotype.Component;

/**
 * Detects when a transaction amount is anomalously high compared to the
 * wallet's historical mean amount.
 *
 * Logic: flag if amount > multiplier * mean(history), multiplier defaulting to 3.
 * Never fires on an empty history. Always HIGH.
 */
@Component
public class AmountAnomalyEvaluator implements RuleEvaluator {

    private final AnomalyScorer anomalyScorer;

    public AmountAnomalyEvaluator(AnomalyScorer anomalyScorer) {
        this.anomalyScorer = anomalyScorer;
    }

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.ANOMALY;
    }

    @Override
    public RuleResult evaluate(CompiledRule rule, EvaluationContext context) {
        Transaction txn = context.getTransaction();
        double multiplier = rule.condition(ComparisonCondition.class).operand();

        if (!anomalyScorer.isAmountAnomalous(txn, context.getHistory(), multiplier)) {
            return notTriggered(rule, "Transaction amount within normal range");
        }

        double mean = AnomalyScorer.meanAmount(context.getHistory());
        String reason = String.format("Anomalous transaction amount: %.4f (mean: %.4f, multiplier: %.1f)",
                txn.getAmount(), mean, multiplier);

        return RuleResult.builder()
                .ruleId(rule.id())
                .ruleName(rule.name())
                .ruleType(rule.type())
                .triggered(true)
                .riskLevel(RiskLevel.HIGH)
                .reason(reason)
                .build();
    }
}
