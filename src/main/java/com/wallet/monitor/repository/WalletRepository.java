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
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Wallet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

@Repository
public class WalletRepository {

    private static final Logger log = LoggerFactory.getLogger(WalletRepository.class);

    private static final int MAX_CAS_ATTEMPTS = 3;

    private final AerospikeClient client;
    private final String namespace;
    private final Policy readPolicy;
    private final WritePolicy writePolicy;
    private final WritePolicy createOnlyPolicy;

    public WalletRepository(AerospikeClient client,
                            @Qualifier("aerospikeNamespace") String namespace,
                            @Qualifier("defaultReadPolicy") Policy readPolicy,
                            @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                            @Qualifier("createOnlyWritePolicy") WritePolicy createOnlyPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.readPolicy = readPolicy;
        this.writePolicy = writePolicy;
        this.createOnlyPolicy = createOnlyPolicy;
    }

    /**
     * @return false when a wallet with the same (chain, address) key already exists
     */
    public boolean insert(Wallet wallet) {
        try {
            client.put(createOnlyPolicy, keyFor(wallet.getAddress(), wallet.getChain()), toBins(wallet));
            return true;
        } catch (AerospikeException e) {
            if (e.getResultCode() == ResultCode.KEY_EXISTS_ERROR) {
                log.debug("Wallet {} on {} already registered", wallet.getAddress(), wallet.getChain());
                return false;
            }
            throw e;
        }
    }

    /**
     * Writes only the name, description and updatedAt bins, guarded by the record
     * generation, so a concurrent deactivation is never undone.
     *
     * @return the wallet as stored after the update, or null when it does not exist
     */
    public Wallet updateDetails(String address, ChainId chain, String name, String description, long updatedAt) {
        Key key = keyFor(address, chain);
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Record record = client.get(readPolicy, key);
            if (record == null) return null;

            List<Bin> bins = new ArrayList<>();
            RecordBins.addIfPresent(bins, "name", name);
            RecordBins.addIfPresent(bins, "description", description);
            bins.add(new Bin("updatedAt", updatedAt));
            try {
                client.put(expectGeneration(record.generation), key, bins.toArray(new Bin[0]));
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) throw e;
                log.debug("Wallet {} on {} changed during update, attempt {}", address, chain, attempt);
                continue;
            }
            Wallet wallet = mapRecord(record);
            if (name != null) wallet.setName(name);
            if (description != null) wallet.setDescription(description);
            wallet.setUpdatedAt(updatedAt);
            return wallet;
        }
        throw new IllegalStateException("Wallet " + address + " on " + chain + " is being modified concurrently");
    }

    /**
     * @return false when the wallet does not exist
     */
    public boolean deactivate(String address, ChainId chain, long updatedAt) {
        Key key = keyFor(address, chain);
        for (int attempt = 1; attempt <= MAX_CAS_ATTEMPTS; attempt++) {
            Record record = client.get(readPolicy, key);
            if (record == null) return false;
            if (!record.getBoolean("active")) return true;
            try {
                client.put(expectGeneration(record.generation), key,
                        new Bin("active", false),
                        new Bin("updatedAt", updatedAt));
                return true;
            } catch (AerospikeException e) {
                if (e.getResultCode() != ResultCode.GENERATION_ERROR) throw e;
                log.debug("Wallet {} on {} changed during deactivation, attempt {}", address, chain, attempt);
            }
        }
        throw new IllegalStateException("Wallet " + address + " on " + chain + " is being modified concurrently");
    }

    public Wallet find(String address, ChainId chain) {
        Record record = client.get(readPolicy, keyFor(address, chain));
        if (record == null) return null;
        return mapRecord(record);
    }

    public List<Wallet> findAll(ChainId chain, boolean activeOnly) {
        List<Wallet> results = new ArrayList<>();
        ScanPolicy scanPolicy = new ScanPolicy();
        scanPolicy.concurrentNodes = true;
        scanPolicy.includeBinData = true;

        client.scanAll(scanPolicy, namespace, AerospikeConfig.SET_WALLETS,
                (key, record) -> {
                    try {
                        Wallet wallet = mapRecord(record);
                        if (chain != null && chain != wallet.getChain()) return;
                        if (activeOnly && !wallet.isActive()) return;
                        synchronized (results) {
                            results.add(wallet);
                        }
                    } catch (Exception e) {
                        log.warn("Failed to deserialize wallet record: {}", e.getMessage());
                    }
                });

        results.sort(Comparator.comparingLong(Wallet::getCreatedAt));
        return results;
    }

    private WritePolicy expectGeneration(int generation) {
        WritePolicy policy = new WritePolicy(writePolicy);
        policy.generationPolicy = GenerationPolicy.EXPECT_GEN_EQUAL;
        policy.generation = generation;
        return policy;
    }

    Key keyFor(String address, ChainId chain) {
        return new Key(namespace, AerospikeConfig.SET_WALLETS, chain.name() + ":" + address);
    }

    private Bin[] toBins(Wallet wallet) {
        List<Bin> bins = new ArrayList<>(List.of(
                new Bin("id", wallet.getId()),
                new Bin("address", wallet.getAddress()),
                new Bin("chain", wallet.getChain().name()),
                new Bin("active", wallet.isActive()),
                new Bin("createdAt", wallet.getCreatedAt()),
                new Bin("updatedAt", wallet.getUpdatedAt())));
        RecordBins.addIfPresent(bins, "name", wallet.getName());
        RecordBins.addIfPresent(bins, "description", wallet.getDescription());
        return bins.toArray(new Bin[0]);
    }

    private Wallet mapRecord(Record record) {
        return Wallet.builder()
                .id(record.getString("id"))
                .address(record.getString("address"))
                .chain(RecordBins.getEnum(record, "chain", ChainId.class))
                .name(record.getString("name"))
                .description(record.getString("description"))
                .active(record.getBoolean("active"))
                .createdAt(record.getLong("createdAt"))
                .updatedAt(record.getLong("updatedAt"))
                .build();
    }
}
