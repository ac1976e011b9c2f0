package com.wallet.monitor.engine.rules;

import java.util.Locale;

/**
 * {@code amount|value|balance OP number}.
 */
public record ComparisonCondition(Subject subject, ComparisonOperator operator, double operand) implements RuleCondition {

    public enum Subject {
        AMOUNT, VALUE, BALANCE;

        public String token() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public boolean test(double value) {
        return operator.apply(value, operand);
    }

    @Override
    public String describe() {
        return subject.token() + " " + operator.getSymbol() + " " + operand;
    }
}
