package com.wallet.monitor.engine.normalizer;

import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.RawTransaction;
import com.wallet.monitor.model.RiskLevel;
import com.wallet.monitor.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps chain-specific raw payloads onto the canonical {@link Transaction}.
 *
 * <p>Pure and total: missing or unparseable fields become null (0 for the amount,
 * "unknown" for the status). Scoring fields are left at their defaults and
 * filled in later by the ingestion pipeline.</p>
 */
@Component
public class TransactionNormalizer {

    private static final Logger log = LoggerFactory.getLogger(TransactionNormalizer.class);

    static final String STATUS_SUCCESS = "success";
    static final String STATUS_FAILED = "failed";
    static final String STATUS_UNKNOWN = "unknown";

    public Transaction normalize(RawTransaction raw, ChainId chain) {
        ChainFieldMapping mapping = ChainFieldMapping.forChain(chain);

        String inputData = readString(raw, mapping.inputKeys());
        String toAddress = chain.normalizeAddress(readString(raw, mapping.toKeys()));
        boolean contractInteraction = inputData != null && inputData.length() > 2;

        return Transaction.builder()
                .hash(chain.normalizeHash(readString(raw, mapping.hashKeys())))
                .chain(chain)
                .fromAddress(chain.normalizeAddress(readString(raw, mapping.fromKeys())))
                .toAddress(toAddress)
                .amount(readAmount(raw, mapping.amountKeys()))
                .status(readStatus(raw, mapping.statusKeys()))
                .timestamp(readLong(raw, mapping.timestampKeys()))
                .blockNumber(readLong(raw, mapping.blockNumberKeys()))
                .blockHash(chain.normalizeHash(readString(raw, mapping.blockHashKeys())))
                .gasUsed(readLong(raw, mapping.gasUsedKeys()))
                .gasPrice(readLong(raw, mapping.gasPriceKeys()))
                .inputData(inputData)
                .contractInteraction(contractInteraction)
                .contractAddress(contractInteraction ? toAddress : null)
                .riskLevel(RiskLevel.LOW)
                .anomalyFactors(new ArrayList<>())
                .build();
    }

    private Object first(RawTransaction raw, List<String> keys) {
        if (keys.isEmpty()) return null;
        return raw.firstOf(keys.toArray(new String[0]));
    }

    private String readString(RawTransaction raw, List<String> keys) {
        Object value = first(raw, keys);
        if (value == null) return null;
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    private double readAmount(RawTransaction raw, List<String> keys) {
        Object value = first(raw, keys);
        if (value == null) return 0.0;
        if (value instanceof Number n) return n.doubleValue();
        try {
            String text = value.toString().trim();
            if (isHex(text)) {
                return new BigInteger(text.substring(2), 16).doubleValue();
            }
            return new BigDecimal(text).doubleValue();
        } catch (NumberFormatException e) {
            log.debug("Unparseable amount '{}' in {}", value, keys);
            return 0.0;
        }
    }

    private Long readLong(RawTransaction raw, List<String> keys) {
        Object value = first(raw, keys);
        if (value == null) return null;
        if (value instanceof Number n) return n.longValue();
        try {
            String text = value.toString().trim();
            if (isHex(text)) {
                return new BigInteger(text.substring(2), 16).longValue();
            }
            return new BigDecimal(text).longValue();
        } catch (NumberFormatException e) {
            log.debug("Unparseable integer '{}' in {}", value, keys);
            return null;
        }
    }

    private String readStatus(RawTransaction raw, List<String> keys) {
        Object value = first(raw, keys);
        if (value == null) return STATUS_UNKNOWN;
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "0x1", "1", "true" -> STATUS_SUCCESS;
            case "0x0", "0", "false" -> STATUS_FAILED;
            case "" -> STATUS_UNKNOWN;
            default -> text;
        };
    }

    private static boolean isHex(String text) {
        return text.length() > 2 && (text.startsWith("0x") || text.startsWith("0X"));
    }
}
