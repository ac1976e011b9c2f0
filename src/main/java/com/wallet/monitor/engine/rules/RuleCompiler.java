package com.wallet.monitor.engine.rules;

import com.wallet.monitor.model.AlertRule;

/**
 * Validates a stored rule and resolves its effective condition.
 *
 * <ul>
 *   <li>TRANSACTION: expression over amount/value, else {@code amount > threshold}.</li>
 *   <li>BALANCE: expression over balance/value, else {@code balance < threshold}.</li>
 *   <li>CONTRACT: no condition; threshold ignored.</li>
 *   <li>ANOMALY: multiplier of the historical mean, {@code threshold} or 3.</li>
 *   <li>FREQUENCY: window-count expression, else {@code count > threshold in 3600}.</li>
 * </ul>
 */
public final class RuleCompiler {

    public static final double DEFAULT_ANOMALY_MULTIPLIER = 3.0;
    public static final long DEFAULT_FREQUENCY_WINDOW_SECONDS = 3600;

    private RuleCompiler() {
    }

    public static CompiledRule compile(AlertRule rule) throws RuleCompilationException {
        if (rule.getRuleType() == null) {
            throw new RuleCompilationException("Rule type is missing");
        }
        RuleCondition condition = switch (rule.getRuleType()) {
            case TRANSACTION -> comparison(rule, ComparisonCondition.Subject.AMOUNT, ComparisonOperator.GT);
            case BALANCE -> comparison(rule, ComparisonCondition.Subject.BALANCE, ComparisonOperator.LT);
            case CONTRACT -> noExpression(rule, null);
            case ANOMALY -> noExpression(rule, anomalyMultiplier(rule));
            case FREQUENCY -> windowCount(rule);
        };
        return new CompiledRule(rule, condition);
    }

    private static RuleCondition comparison(AlertRule rule, ComparisonCondition.Subject subject,
                                            ComparisonOperator defaultOperator) throws RuleCompilationException {
        if (hasExpression(rule)) {
            RuleCondition parsed = RuleExpressionParser.parse(rule.getExpression());
            if (parsed instanceof ComparisonCondition c
                    && (c.subject() == subject || c.subject() == ComparisonCondition.Subject.VALUE)) {
                return c;
            }
            throw new RuleCompilationException(String.format(
                    "Expression '%s' does not apply to %s rules", rule.getExpression(), rule.getRuleType()));
        }
        if (rule.getThreshold() == null) {
            throw new RuleCompilationException(rule.getRuleType() + " rule requires a threshold or an expression");
        }
        return new ComparisonCondition(subject, defaultOperator, rule.getThreshold());
    }

    private static RuleCondition windowCount(AlertRule rule) throws RuleCompilationException {
        if (hasExpression(rule)) {
            RuleCondition parsed = RuleExpressionParser.parse(rule.getExpression());
            if (parsed instanceof WindowCountCondition w) {
                return w;
            }
            throw new RuleCompilationException(String.format(
                    "Expression '%s' does not apply to FREQUENCY rules", rule.getExpression()));
        }
        if (rule.getThreshold() == null || rule.getThreshold() < 0) {
            throw new RuleCompilationException("FREQUENCY rule requires a non-negative threshold or an expression");
        }
        return new WindowCountCondition(ComparisonOperator.GT, rule.getThreshold().longValue(),
                DEFAULT_FREQUENCY_WINDOW_SECONDS);
    }

    private static RuleCondition anomalyMultiplier(AlertRule rule) throws RuleCompilationException {
        double multiplier = rule.getThreshold() != null ? rule.getThreshold() : DEFAULT_ANOMALY_MULTIPLIER;
        if (multiplier <= 0) {
            throw new RuleCompilationException("ANOMALY multiplier must be positive, got " + multiplier);
        }
        return new ComparisonCondition(ComparisonCondition.Subject.AMOUNT, ComparisonOperator.GT, multiplier);
    }

    private static RuleCondition noExpression(AlertRule rule, RuleCondition condition) throws RuleCompilationException {
        if (hasExpression(rule)) {
            throw new RuleCompilationException(rule.getRuleType() + " rules do not take an expression");
        }
        return condition;
    }

    private static boolean hasExpression(AlertRule rule) {
        return rule.getExpression() != null && !rule.getExpression().isBlank();
    }
}
