package com.wallet.monitor.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.wallet.monitor.config.AerospikeConfig;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.model.RuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class AlertRuleRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRuleRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public AlertRuleRepository(AerospikeClient client,
                               @Qualifier("aerospikeNamespace") String namespace,
                               @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                               @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    public List<AlertRule> findAll() {
        List<AlertRule> rules = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERT_RULES,
                (key, record) -> {
                    try {
                        String ruleId = record.getString("id");
                        if (ruleId != null) {
                            AlertRule rule = mapRecord(record);
                            synchronized (rules) {
                                rules.add(rule);
                            }
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize rule record: {}", e.getMessage());
                    }
                });

        rules.sort(Comparator.comparingLong(AlertRule::getCreatedAt).thenComparing(AlertRule::getId));
        return rules;
    }

    public AlertRule findById(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_RULES, ruleId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public void save(AlertRule rule) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_RULES, rule.getId());

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", rule.getId()),
                new Bin("name", rule.getName()),
                new Bin("ruleType", rule.getRuleType().name()),
                new Bin("enabled", rule.isEnabled()),
                new Bin("createdAt", rule.getCreatedAt()),
                new Bin("updatedAt", rule.getUpdatedAt())));
        RecordBins.addIfPresent(bins, "description", rule.getDescription());
        RecordBins.addIfPresent(bins, "threshold", rule.getThreshold());
        RecordBins.addIfPresent(bins, "expression", rule.getExpression());

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public boolean delete(String ruleId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERT_RULES, ruleId);
        return client.delete(writePolicy, key);
    }

    private AlertRule mapRecord(Record record) {
        return AlertRule.builder()
                .id(record.getString("id"))
                .name(record.getString("name"))
                .description(record.getString("description"))
                .ruleType(RecordBins.getEnum(record, "ruleType", RuleType.class))
                .threshold(RecordBins.getNullableDouble(record, "threshold"))
                .expression(record.getString("expression"))
                .enabled(record.getBoolean("enabled"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
