package com.wallet.monitor.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.ScanPolicy;
import com.aerospike.client.policy.WritePolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.wallet.monitor.config.AerospikeConfig;
import com.wallet.monitor.model.AnomalyFactor;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class TransactionRepository {

    private static final Logger log = LoggerFactory.getLogger(TransactionRepository.class);

    // Newest first; transactions without a block time go last
    static final Comparator<Transaction> NEWEST_FIRST = Comparator.comparing(
            Transaction::getTimestamp, Comparator.nullsLast(Comparator.<Long>reverseOrder()));

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy createOnlyPolicy;
    private final ObjectMapper objectMapper;

    public TransactionRepository(AerospikeClient client,
                                 @Qualifier("aerospikeNamespace") String namespace,
                                 @Qualifier("defaultReadPolicy") Policy readPolicy,
                                 @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.createOnlyPolicy = createOnlyPolicy;
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @return false when a transaction with the same hash is already stored
     */
    public boolean insert(Transaction txn) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, txn.getHash());
        try {
            client.put(createOnlyPolicy, key, toBins(txn));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.debug("Transaction {} already stored, skipping", txn.getHash());
                return false;
            }
            throw e;
        }
    }

    public Transaction findByHash(String hash) {
        Key key = new Key(namespace, AerospikeConfig.SET_TRANSACTIONS, hash);
        Record record = client.get(readPolicy, key);
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Transaction> find(String walletAddress, ChainId chain, int limit) {
        List<Transaction> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_TRANSACTIONS,
                (key, record) -> {
                    if (walletAddress != null && !walletAddress.equals(record.getString("walletAddr"))) return;
                    if (chain != null && !chain.name().equals(record.getString("chain"))) return;
                    try {
                        Transaction txn = mapRecord(record);
                        synchronized (results) {
                            results.add(txn);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize transaction record: {}", e.getMessage());
                    }
                });

        results.sort(NEWEST_FIRST);
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    private Bin[] toBins(Transaction txn) {
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", txn.getId()),
                new Bin("hash", txn.getHash()),
                new Bin("walletAddr", txn.getWalletAddress()),
                new Bin("chain", txn.getChain().name()),
                new Bin("amount", txn.getAmount()),
                new Bin("status", txn.getStatus()),
                new Bin("contract", txn.isContractInteraction()),
                new Bin("score", txn.getAnomalyScore()),
                new Bin("riskLevel", txn.getRiskLevel().name()),
                new Bin("factors", serializeFactors(txn.getAnomalyFactors())),
                new Bin("createdAt", txn.getCreatedAt())));

        RecordBins.addIfPresent(bins, "fromAddr", txn.getFromAddress());
        RecordBins.addIfPresent(bins, "toAddr", txn.getToAddress());
        RecordBins.addIfPresent(bins, "timestamp", txn.getTimestamp());
        RecordBins.addIfPresent(bins, "blockNumber", txn.getBlockNumber());
        RecordBins.addIfPresent(bins, "blockHash", txn.getBlockHash());
        RecordBins.addIfPresent(bins, "gasUsed", txn.getGasUsed());
        RecordBins.addIfPresent(bins, "gasPrice", txn.getGasPrice());
        RecordBins.addIfPresent(bins, "inputData", txn.getInputData());
        RecordBins.addIfPresent(bins, "contractAddr", txn.getContractAddress());
        return bins.toArray(new Bin[0]);
    }

    private Transaction mapRecord(Record record) {
        RiskLevel riskLevel = RecordBins.getEnum(record, "riskLevel", RiskLevel.class);
        return Transaction.builder()
                .id(record.getString("id"))
                .hash(record.getString("hash"))
                .walletAddress(record.getString("walletAddr"))
                .chain(RecordBins.getEnum(record, "chain", ChainId.class))
                .fromAddress(record.getString("fromAddr"))
                .toAddress(record.getString("toAddr"))
                .amount(record.getDouble("amount"))
                .status(record.getString("status"))
                .timestamp(RecordBins.getNullableLong(record, "timestamp"))
                .blockNumber(RecordBins.getNullableLong(record, "blockNumber"))
                .blockHash(record.getString("blockHash"))
                .gasUsed(RecordBins.getNullableLong(record, "gasUsed"))
                .gasPrice(RecordBins.getNullableLong(record, "gasPrice"))
                .inputData(record.getString("inputData"))
                .contractInteraction(record.getBoolean("contract"))
                .contractAddress(record.getString("contractAddr"))
                .anomalyScore(record.getDouble("score"))
                .riskLevel(riskLevel != null ? riskLevel : RiskLevel.LOW)
                .anomalyFactors(deserializeFactors(record.getString("factors")))
                .createdAt(record.getLong("createdAt"))
                .build();
    }

    private String serializeFactors(List<AnomalyFactor> factors) {
        try {
            return objectMapper.writeValueAsString(factors != null ? factors : List.of());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize anomaly factors " + factors, e);
        }
    }

    private List<AnomalyFactor> deserializeFactors(String json) {
        if (json == null || json.isEmpty()) return new ArrayList<>();
        try {
            return objectMapper.readValue(json, new TypeReference<List<AnomalyFactor>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable anomaly factors '{}': {}", json, e.getMessage());
            return new ArrayList<>();
        }
    }
}
