package com.wallet.monitor.engine.rules;

import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.RuleType;

/**
 * A validated rule together with its typed condition. The condition is null
 * for rule types that compare nothing (CONTRACT).
 */
public record CompiledRule(AlertRule rule, RuleCondition condition) {

    public String id() {
        return rule.getId();
    }

    public String name() {
        return rule.getName();
    }

    public RuleType type() {
        return rule.getRuleType();
    }

    public <C extends RuleCondition> C condition(Class<C> type) {
        return type.cast(condition);
    }
}
