package com.wallet.monitor.engine.evaluators;

import com.wallet.monitor.engine.EvaluationContext;
import com.wallet.monitor.engine.RuleEvaluator;
import com.wallet.monitor.engine.rules.CompiledRule;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.RuleResult;
import com.wallet.monitor.model.RuleType;
import com.wallet.monitor.model.Transaction;
import org.springframework.stereotype.Component;

@Component
public class ContractInteractionEvaluator implements RuleEvaluator {

    @Override
    public RuleType getSupportedRuleType() {
        return RuleType.CONTRACT;
    }

    @Override
    public RuleResult evaluate(CompiledRule rule, EvaluationContext context) {
        Transaction txn = context.getTransaction();
        if (!txn.isContractInteraction()) {
            return notTriggered(rule, "No contract interaction");
        }

        return RuleResult.builder()
                .ruleId(rule.id())
                .ruleName(rule.name())
                .ruleType(rule.type())
                .triggered(true)
                .riskLevel(RiskLevel.MEDIUM)
                .reason("Contract interaction detected: " + txn.getContractAddress())
                .build();
    }
}
