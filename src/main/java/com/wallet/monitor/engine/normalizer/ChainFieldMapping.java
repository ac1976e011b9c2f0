package com.wallet.monitor.engine.normalizer;

import com.wallet.monitor.model.ChainId;

import java.util.List;

/**
 * Raw payload keys for each canonical transaction field, per chain family.
 * Keys are tried in order; an empty list means the field does not exist on the chain.
 */
public record ChainFieldMapping(
        List<String> hashKeys,
        List<String> fromKeys,
        List<String> toKeys,
        List<String> amountKeys,
        List<String> statusKeys,
        List<String> timestampKeys,
        List<String> blockNumberKeys,
        List<String> blockHashKeys,
        List<String> gasUsedKeys,
        List<String> gasPriceKeys,
        List<String> inputKeys) {

    public static final ChainFieldMapping EVM = new ChainFieldMapping(
            List.of("hash", "transactionHash"),
            List.of("from", "fromAddress"),
            List.of("to", "toAddress"),
            List.of("value"),
            List.of("status"),
            List.of("blockTime", "timestamp"),
            List.of("blockNumber"),
            List.of("blockHash"),
            List.of("gasUsed"),
            List.of("gasPrice"),
            List.of("input"));

    // from/to only exist when the adapter flattened the instruction list
    public static final ChainFieldMapping SOLANA = new ChainFieldMapping(
            List.of("signature"),
            List.of("from"),
            List.of("to"),
            List.of("amount"),
            List.of("status"),
            List.of("block_time", "blockTime"),
            List.of("slot"),
            List.of(),
            List.of(),
            List.of(),
            List.of());

    public static ChainFieldMapping forChain(ChainId chain) {
        return chain.isEvm() ? EVM : SOLANA;
    }
}
