package com.wallet.monitor.engine.rules;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the rule expression grammar:
 * <pre>
 *   amount|value|balance OP number
 *   count OP integer in seconds
 *   OP := &gt; | &lt; | &gt;= | &lt;= | ==
 * </pre>
 */
public final class RuleExpressionParser {

    // two-character operators first so ">=" is not read as ">"
    private static final String OPERATOR = "(>=|<=|==|>|<)";

    private static final Pattern COMPARISON = Pattern.compile(
            "^\\s*(amount|value|balance)\\s*" + OPERATOR + "\\s*(-?\\d+(?:\\.\\d+)?)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WINDOW_COUNT = Pattern.compile(
            "^\\s*count\\s*" + OPERATOR + "\\s*(\\d+)\\s+in\\s+(\\d+)\\s*$",
            Pattern.CASE_INSENSITIVE);

    private RuleExpressionParser() {
    }

    public static RuleCondition parse(String expression) throws RuleCompilationException {
        if (expression == null || expression.isBlank()) {
            throw new RuleCompilationException("Expression is empty");
        }

        Matcher comparison = COMPARISON.matcher(expression);
        if (comparison.matches()) {
            ComparisonCondition.Subject subject =
                    ComparisonCondition.Subject.valueOf(comparison.group(1).toUpperCase(Locale.ROOT));
            return new ComparisonCondition(subject, operator(comparison.group(2)),
                    Double.parseDouble(comparison.group(3)));
        }

        Matcher window = WINDOW_COUNT.matcher(expression);
        if (window.matches()) {
            long count;
            long seconds;
            try {
                count = Long.parseLong(window.group(2));
                seconds = Long.parseLong(window.group(3));
            } catch (NumberFormatException e) {
                throw new RuleCompilationException("Number out of range in expression: " + expression);
            }
            if (seconds <= 0) {
                throw new RuleCompilationException("Window must be positive: " + expression);
            }
            return new WindowCountCondition(operator(window.group(1)), count, seconds);
        }

        throw new RuleCompilationException("Unrecognized expression: " + expression);
    }

    private static ComparisonOperator operator(String symbol) throws RuleCompilationException {
        return ComparisonOperator.fromSymbol(symbol)
                .orElseThrow(() -> new RuleCompilationException("Unknown operator: " + symbol));
    }
}
