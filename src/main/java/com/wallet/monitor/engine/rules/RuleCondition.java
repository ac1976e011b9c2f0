package com.wallet.monitor.engine.rules;

/**
 * Typed form of a rule expression, built once when the rule is loaded.
 */
public interface RuleCondition {

    /**
     * Canonical textual form, e.g. {@code amount > 100.0}.
     */
    String describe();
}
