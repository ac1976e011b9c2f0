package com.wallet.monitor.engine.rules;

/**
 * {@code count OP n in seconds}: number of history transactions inside the
 * trailing window compared with {@code n}.
 */
public record WindowCountCondition(ComparisonOperator operator, long count, long windowSeconds) implements RuleCondition {

    public boolean test(long observed) {
        return operator.apply(observed, count);
    }

    @Override
    public String describe() {
        return "count " + operator.getSymbol() + " " + count + " in " + windowSeconds;
    }
}
