package com.wallet.monitor.engine;

import com.wallet.monitor.config.MetricsConfig;
import com.wallet.monitor.engine.rules.CompiledRule;
import com.wallet.monitor.engine.rules.RuleCompilationException;
import com.wallet.monitor.engine.rules.RuleCompiler;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.AlertStatus;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.RuleResult;
import com.wallet.monitor.model.RuleType;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.repository.AlertStore;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Evaluates enabled alert rules and turns firings into pending {@link Alert} drafts.
 * Uses the Strategy pattern: each RuleType is handled by a registered RuleEvaluator.
 *
 * <p>Rules are compiled into a snapshot when the engine starts and on {@link #reload()};
 * evaluations never hit the store. Malformed rules are left out of the snapshot.</p>
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final AlertStore alertStore;
    private final Map<RuleType, RuleEvaluator> evaluatorMap;
    private final Tracer tracer;
    private final MetricsConfig metricsConfig;

    private final AtomicReference<Map<RuleType, List<CompiledRule>>> snapshot =
            new AtomicReference<>(new EnumMap<>(RuleType.class));

    public RuleEngine(AlertStore alertStore, List<RuleEvaluator> evaluators,
                      Tracer tracer, MetricsConfig metricsConfig) {
        this.alertStore = alertStore;
        this.evaluatorMap = new EnumMap<>(RuleType.class);
        this.tracer = tracer;
        this.metricsConfig = metricsConfig;

        // Auto-register all evaluator implementations
        for (RuleEvaluator evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedRuleType(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedRuleType(), evaluator.getClass().getSimpleName());
        }
    }

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * Recompiles the enabled rules from the store. On a store failure the
     * previous snapshot stays in effect.
     */
    public ReloadSummary reload() {
        List<AlertRule> enabled;
        try {
            enabled = alertStore.enabledRules();
        } catch (Exception e) {
            log.error("Failed to load alert rules, keeping previous snapshot", e);
            return new ReloadSummary(countLoaded(), 0, false);
        }

        Map<RuleType, List<CompiledRule>> compiled = new EnumMap<>(RuleType.class);
        int skipped = 0;
        for (AlertRule rule : enabled) {
            try {
                CompiledRule compiledRule = RuleCompiler.compile(rule);
                if (!evaluatorMap.containsKey(compiledRule.type())) {
                    throw new RuleCompilationException("No evaluator registered for " + compiledRule.type());
                }
                compiled.computeIfAbsent(compiledRule.type(), t -> new ArrayList<>()).add(compiledRule);
            } catch (RuleCompilationException e) {
                skipped++;
                metricsConfig.recordRuleSkipped(String.valueOf(rule.getRuleType()));
                log.warn("Skipping malformed rule {} ({}): {}", rule.getId(), rule.getName(), e.getMessage());
            }
        }

        compiled.replaceAll((type, rules) -> List.copyOf(rules));
        snapshot.set(Collections.unmodifiableMap(compiled));
        int loaded = countLoaded();
        log.info("Rule snapshot reloaded: {} active, {} skipped", loaded, skipped);
        return new ReloadSummary(loaded, skipped, true);
    }

    public List<CompiledRule> activeRules(RuleType type) {
        return snapshot.get().getOrDefault(type, List.of());
    }

    public List<Alert> evaluateTransaction(Transaction txn) {
        return evaluate(RuleType.TRANSACTION, EvaluationContext.forTransaction(txn, List.of()));
    }

    public List<Alert> evaluateBalance(String walletAddress, ChainId chain, double balance) {
        return evaluate(RuleType.BALANCE, EvaluationContext.forBalance(walletAddress, chain, balance));
    }

    public List<Alert> evaluateContract(Transaction txn) {
        return evaluate(RuleType.CONTRACT, EvaluationContext.forTransaction(txn, List.of()));
    }

    public List<Alert> evaluateAnomaly(Transaction txn, List<Transaction> history) {
        return evaluate(RuleType.ANOMALY, EvaluationContext.forTransaction(txn, history));
    }

    public List<Alert> evaluateFrequency(Transaction txn, List<Transaction> history) {
        return evaluate(RuleType.FREQUENCY, EvaluationContext.forTransaction(txn, history));
    }

    /**
     * Transaction, contract, anomaly and frequency rules, in that order.
     */
    @Observed(name = "rules.evaluate_all", contextualName = "evaluate-all-rules")
    public List<Alert> evaluateAll(Transaction txn, List<Transaction> history) {
        EvaluationContext context = EvaluationContext.forTransaction(txn, history);
        List<Alert> alerts = new ArrayList<>();
        alerts.addAll(evaluate(RuleType.TRANSACTION, context));
        alerts.addAll(evaluate(RuleType.CONTRACT, context));
        alerts.addAll(evaluate(RuleType.ANOMALY, context));
        alerts.addAll(evaluate(RuleType.FREQUENCY, context));
        return alerts;
    }

    private List<Alert> evaluate(RuleType type, EvaluationContext context) {
        List<CompiledRule> rules = activeRules(type);
        if (rules.isEmpty()) return List.of();

        RuleEvaluator evaluator = evaluatorMap.get(type);
        List<Alert> alerts = new ArrayList<>();

        for (CompiledRule rule : rules) {
            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + type)
                    .tag("rule.id", rule.id())
                    .tag("rule.name", String.valueOf(rule.name()))
                    .tag("rule.type", type.name())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                RuleResult result = evaluator.evaluate(rule, context);
                ruleSpan.tag("rule.triggered", String.valueOf(result.isTriggered()));

                if (result.isTriggered()) {
                    metricsConfig.recordRuleTriggered(type.name());
                    alerts.add(toAlert(result, context));
                    log.debug("Rule triggered: {} for wallet {} on {}: {}",
                            rule.name(), context.getWalletAddress(), context.getChain(), result.getReason());
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating rule {} for wallet {}: {}",
                        rule.id(), context.getWalletAddress(), e.getMessage(), e);
                // one failing rule must not block the others
            } finally {
                ruleSpan.end();
            }
        }
        return alerts;
    }

    private Alert toAlert(RuleResult result, EvaluationContext context) {
        Transaction txn = context.getTransaction();
        return Alert.builder()
                .id(UUID.randomUUID().toString())
                .ruleId(result.getRuleId())
                .walletAddress(context.getWalletAddress())
                .chain(context.getChain())
                .alertType(result.getRuleType())
                .message(result.getReason())
                .riskLevel(result.getRiskLevel())
                .transactionHash(txn != null ? txn.getHash() : null)
                .status(AlertStatus.PENDING)
                .createdAt(System.currentTimeMillis())
                .build();
    }

    private int countLoaded() {
        return snapshot.get().values().stream().mapToInt(List::size).sum();
    }

    /**
     * @param active  rules in the snapshot after the reload
     * @param skipped enabled rules left out because they are malformed
     * @param applied false when the store could not be read and the old snapshot was kept
     */
    public record ReloadSummary(int active, int skipped, boolean applied) {}
}
