package com.wallet.monitor.engine.evaluators;

import com.wallet.monitor.engine.EvaluationContext;
import com.wallet.monitor.engine.RuleEvaluator;
import com.wallet.monitor.engine.rules.CompiledRule;
import com.wallet.monitor.engine.rules.ComparisonCondition;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.RuleResult;
import com.wallet.monitor.model.RuleType;
import org.springframework.stereotype.Component;

/**
 * Fires when the transaction amount satisfies the rule's comparison
 * (by default {@code amount > threshold}).
 *
 * Severity is HIGH when an upper-bound rule is exceeded by more than 2x its
 * operand, MEDIUM otherwise.
 */
@Component
public class TransactionAmountEvaluator implements RuleEvaluator {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.TRANSACTION;
    }

    @Override
    public RuleResult evaluate(CompiledRule rule, EvaluationContext context) {
        ComparisonCondition condition = rule.condition(ComparisonCondition.class);
        double amount = context.getTransaction().getAmount();

        if (!condition.test(amount)) {
            return notTriggered(rule, "Transaction amount within threshold");
        }

        double operand = condition.operand();
        RiskLevel riskLevel = condition.operator().isUpperBound() && amount > operand * 2
                ? RiskLevel.HIGH
                : RiskLevel.MEDIUM;

        String verb = condition.operator().isUpperBound() ? "exceeds threshold" : "matches rule";
        String reason = String.format("Transaction amount %s: %.4f %s %.4f %s",
                verb, amount, condition.operator().getSymbol(), operand, context.getChain().getNativeUnit());

        return RuleResult.builder()
                .ruleId(rule.id())
                .ruleName(rule.name())
                .ruleType(rule.type())
                .triggered(true)
                .riskLevel(riskLevel)
                .reason(reason)
                .build();
    }
}
