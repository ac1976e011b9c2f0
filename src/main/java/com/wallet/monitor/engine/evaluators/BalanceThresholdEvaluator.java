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
 * Fires when the wallet balance satisfies the rule's comparison
 * (by default {@code balance < threshold}). HIGH below half of a lower-bound operand.
 */
@Component
public class BalanceThresholdEvaluator implements RuleEvaluator {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.BALANCE;
    }

    @Override
    public RuleResult evaluate(CompiledRule rule, EvaluationContext context) {
        ComparisonCondition condition = rule.condition(ComparisonCondition.class);
        double balance = context.getBalance();

        if (!condition.test(balance)) {
            return notTriggered(rule, "Wallet balance within threshold");
        }

        double operand = condition.operand();
        RiskLevel riskLevel = condition.operator().isLowerBound() && balance < operand * 0.5
                ? RiskLevel.HIGH
                : RiskLevel.MEDIUM;

        String verb = condition.operator().isLowerBound() ? "below threshold" : "matches rule";
        String reason = String.format("Wallet balance %s: %.4f %s %.4f %s",
                verb, balance, condition.operator().getSymbol(), operand, context.getChain().getNativeUnit());

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
