package com.wallet.monitor.engine.rules;

/**
 * A rule that cannot be turned into an executable condition.
 */
public class RuleCompilationException extends Exception {

    public RuleCompilationException(String message) {
        super(message);
    }
}
