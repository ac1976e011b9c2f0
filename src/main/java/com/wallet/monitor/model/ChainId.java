package com.wallet.monitor.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Supported blockchain networks. EVM-family chains share one raw payload layout.
 */
public enum ChainId {
    ETHEREUM(true, "ETH"),
    BSC(true, "BNB"),
    POLYGON(true, "MATIC"),
    SOLANA(false, "SOL");

    private final boolean evm;
    private final String nativeUnit;

    ChainId(boolean evm, String nativeUnit) {
        this.evm = evm;
        this.nativeUnit = nativeUnit;
    }

    public boolean isEvm() {
        return evm;
    }

    public String getNativeUnit() {
        return nativeUnit;
    }

    /**
     * EVM addresses are hex and case-insensitive; Solana addresses are base58
     * and must keep their case.
     */
    public String normalizeAddress(String address) {
        if (address == null) return null;
        String trimmed = address.trim();
        if (trimmed.isEmpty()) return null;
        return evm ? trimmed.toLowerCase(Locale.ROOT) : trimmed;
    }

    /**
     * EVM hashes are hex and compared case-insensitively; Solana signatures are base58 and kept as given.
     */
    public String normalizeHash(String hash) {
        return normalizeAddress(hash);
    }

    /**
     * Normalizes a hash whose chain is not known. A 0x prefix marks an EVM hash;
     * base58 Solana signatures never start with it.
     */
    public static String normalizeAnyHash(String hash) {
        if (hash == null || hash.isBlank()) return null;
        String trimmed = hash.trim();
        return trimmed.regionMatches(true, 0, "0x", 0, 2) ? trimmed.toLowerCase(Locale.ROOT) : trimmed;
    }

    public static Optional<ChainId> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        try {
            return Optional.of(ChainId.valueOf(name.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
