package com.wallet.monitor.engine.rules;

import java.util.Arrays;
import java.util.Optional;

public enum ComparisonOperator {
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<="),
    EQ("==");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean apply(double left, double right) {
        return switch (this) {
            case GT -> left > right;
            case LT -> left < right;
            case GE -> left >= right;
            case LE -> left <= right;
            case EQ -> Double.compare(left, right) == 0;
        };
    }

    public boolean isUpperBound() {
        return this == GT || this == GE;
    }

    public boolean isLowerBound() {
        return this == LT || this == LE;
    }

    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(op -> op.symbol.equals(symbol)).findFirst();
    }
}
