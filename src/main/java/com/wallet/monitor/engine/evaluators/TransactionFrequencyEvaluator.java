package com.wallet.monitor.engine.evaluators;

import com.wallet.monitor.engine.AnomalyScorer;
import com.wallet.monitor.engine.EvaluationContext;
import com.wallet.monitor.engine.RuleEvaluator;
import com.wallet.monitor.engine.rules.CompiledRule;
import com.wallet.monitor.engine.rules.WindowCountCondition;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.RuleResult;
import com.wallet.monitor.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Counts history transactions in the trailing window ending at the transaction
 * and compares the count with the rule's bound. Needs a transaction timestamp.
 */
@Component
public class TransactionFrequencyEvaluator implements RuleEvaluator {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.FREQUENCY;
    }

    @Override
    public RuleResult evaluate(CompiledRule rule, EvaluationContext context) {
        WindowCountCondition condition = rule.condition(WindowCountCondition.class);
        if (context.getTransaction().getTimestamp() == null) {
            return notTriggered(rule, "Transaction has no timestamp");
        }

        long observed = AnomalyScorer.countWithinWindow(
                context.getTransaction(), context.getHistory(), condition.windowSeconds());

        if (!condition.test(observed)) {
            return notTriggered(rule, "Transaction frequency within bounds");
        }

        String reason = String.format("High transaction frequency: %d transactions in the last %d seconds (rule: %s)",
                observed, condition.windowSeconds(), condition.describe());

        return RuleResult.builder()
                .ruleId(rule.id())
                .ruleName(rule.name())
                .ruleType(rule.type())
                .triggered(true)
                .riskLevel(RiskLevel.MEDIUM)
                .reason(reason)
                .build();
    }
}
