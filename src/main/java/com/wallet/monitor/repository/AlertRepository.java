package com.wallet.monitor.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.wallet.monitor.config.AerospikeConfig;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertStatus;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.RuleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class AlertRepository {

    private static final Logger log = LoggerFactory.getLogger(AlertRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;

    public AlertRepository(AerospikeClient client,
                           @Qualifier("aerospikeNamespace") String namespace,
                           @Qualifier("defaultReadPolicy") Policy readPolicy,
                           @Qualifier("defaultWritePolicy") WritePolicy writePolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
    }

    public void save(Alert alert) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alert.getId());

        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", alert.getId()),
                new Bin("walletAddr", alert.getWalletAddress()),
                new Bin("chain", alert.getChain().name()),
                new Bin("alertType", alert.getAlertType().name()),
                new Bin("message", alert.getMessage()),
                new Bin("riskLevel", alert.getRiskLevel().name()),
                new Bin("status", alert.getStatus().name()),
                new Bin("createdAt", alert.getCreatedAt())));
        RecordBins.addIfPresent(bins, "ruleId", alert.getRuleId());
        RecordBins.addIfPresent(bins, "txHash", alert.getTransactionHash());
        RecordBins.addIfPresent(bins, "resolvedAt", alert.getResolvedAt());

        client.put(writePolicy, key, bins.toArray(new Bin[0]));
    }

    public Alert findById(String alertId) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Alert> find(String walletAddress, ChainId chain, AlertStatus status, int limit) {
        List<Alert> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_ALERTS,
                (key, record) -> {
                    if (walletAddress != null && !walletAddress.equals(record.getString("walletAddr"))) return;
                    if (chain != null && !chain.name().equals(record.getString("chain"))) return;
                    if (status != null && !status.name().equals(record.getString("status"))) return;
                    try {
                        Alert alert = mapRecord(record);
                        synchronized (results) {
                            results.add(alert);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize alert record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Alert::getCreatedAt).reversed());
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    /**
     * Compare-and-set on the record generation so two concurrent resolutions
     * cannot both succeed.
     */
    public boolean resolve(String alertId, long resolvedAt) {
        Key key = new Key(namespace, AerospikeConfig.SET_ALERTS, alertId);
        Record record = client.get(readPolicy, key);
        if (record == null) return false;
        if (!AlertStatus.PENDING.name().equals(record.getString("status"))) return false;

        WritePolicy casPolicy = new WritePolicy(writePolicy);
        casPolicy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        casPolicy.generation = record.generation;

        try {
            client.put(casPolicy, key,
                    new Bin("status", AlertStatus.RESOLVED.name()),
                    new Bin("resolvedAt", resolvedAt));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.GENERATION_ERROR) {
                log.info("Alert {} was modified concurrently, not resolving", alertId);
                return false;
            }
            throw e;
        }
    }

    private Alert mapRecord(Record record) {
        return Alert.builder()
                .id(record.getString("id"))
                .ruleId(record.getString("ruleId"))
                .walletAddress(record.getString("walletAddr"))
                .chain(RecordBins.getEnum(record, "chain", ChainId.class))
                .alertType(RecordBins.getEnum(record, "alertType", RuleType.class))
                .message(record.getString("message"))
                .riskLevel(RecordBins.getEnum(record, "riskLevel", RiskLevel.class))
                .transactionHash(record.getString("txHash"))
                .status(RecordBins.getEnum(record, "status", AlertStatus.class))
                .createdAt(record.getLong("createdAt"))
                .resolvedAt(RecordBins.getNullableLong(record, "resolvedAt"))
                .build();
    }
}
