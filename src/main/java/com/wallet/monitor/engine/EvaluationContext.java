package com.wallet.monitor.engine;

import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Transaction;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Inputs available to rule evaluators. Transaction rules see the transaction
 * and its wallet history; balance rules see only the balance.
 */
@Data
@Builder
public class EvaluationContext {

    private String walletAddress;
    private ChainId chain;

    // null for balance evaluations
    private Transaction transaction;

    // stored wallet history, excluding the transaction itself
    @Builder.Default
    private List<Transaction> history = List.of();

    private double balance;

    public static EvaluationContext forTransaction(Transaction txn, List<Transaction> history) {
        return EvaluationContext.builder()
                .walletAddress(txn.getWalletAddress())
                .chain(txn.getChain())
                .transaction(txn)
                .history(history != null ? history : List.of())
                .build();
    }

    public static EvaluationContext forBalance(String walletAddress, ChainId chain, double balance) {
        return EvaluationContext.builder()
                .walletAddress(walletAddress)
                .chain(chain)
                .balance(balance)
                .build();
    }
}
