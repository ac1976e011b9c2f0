package com.wallet.monitor.engine;

import com.wallet.monitor.engine.rules.CompiledRule;
import com.wallet.monitor.model.RuleResult;
import com.wallet.monitor.model.RuleType;

/**
 * Interface for all alert rule evaluators.
 * Each implementation handles a specific RuleType.
 */
public interface RuleEvaluator {

    /**
     * The rule type this evaluator handles.
     */
    RuleType getSupportedRuleType();

    /**
     * Evaluate one compiled rule.
     *
     * @param rule    the validated rule with its resolved condition
     * @param context transaction, history or balance under evaluation
     * @return the evaluation result; {@code riskLevel} is set only when triggered
     */
    RuleResult evaluate(CompiledRule rule, EvaluationContext context);

    default RuleResult notTriggered(CompiledRule rule, String reason) {
        return RuleResult.builder()
                .ruleId(rule.id())
                .ruleName(rule.name())
                .ruleType(rule.type())
                .triggered(false)
                .reason(reason)
                .build();
    }
}
