package com.wallet.monitor.adapter;

import com.wallet.monitor.model.BalanceReading;
import com.wallet.monitor.model.BlockInfo;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.RawTransaction;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to one blockchain. Implementations wrap the chain's RPC client.
 *
 * <p>Callers obtain adapters through {@link ChainAdapterRegistry}, which guarantees
 * that none of these methods throws: failures surface as an empty list, an
 * unavailable balance or an empty optional.</p>
 */
public interface ChainAdapter {

    ChainId getChain();

    /**
     * Most recent transactions involving the address, newest first, in the
     * chain's own payload format.
     */
    List<RawTransaction> getTransactions(String address, int limit);

    Optional<RawTransaction> getTransaction(String hash);

    /**
     * @param tokenAddress token contract to read, or null for the native balance
     */
    BalanceReading getBalance(String address, String tokenAddress);

    /**
     * @param number block number, or null for the latest block
     */
    Optional<BlockInfo> getBlock(Long number);

    boolean isValidAddress(String address);
}
