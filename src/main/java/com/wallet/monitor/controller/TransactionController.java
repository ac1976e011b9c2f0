package com.wallet.monitor.controller;

import com.wallet.monitor.config.MonitorConfig;
import com.wallet.monitor.model.PagedResponse;
import com.wallet.monitor.model.SyncResult;
import com.wallet.monitor.model.Transaction;
import com.wallet.monitor.model.TransactionSummary;
import com.wallet.monitor.model.WalletAnalysis;
import com.wallet.monitor.service.AnalyticsService;
import com.wallet.monitor.service.IngestionCoordinator;
import com.wallet.monitor.service.TransactionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/transactions")
@Tag(name = "Transactions", description = "Sync wallet transactions from chains and query stored history")
public class TransactionController {

    private final TransactionService transactionService;
    private final IngestionCoordinator ingestionCoordinator;
    private final AnalyticsService analyticsService;
    private final MonitorConfig monitorConfig;

    public TransactionController(TransactionService transactionService,
                                 IngestionCoordinator ingestionCoordinator,
                                 AnalyticsService analyticsService,
                                 MonitorConfig monitorConfig) {
        this.transactionService = transactionService;
        this.ingestionCoordinator = ingestionCoordinator;
        this.analyticsService = analyticsService;
        this.monitorConfig = monitorConfig;
    }

    @Operation(summary = "List stored transactions",
            description = "Newest first by block time. Transactions without a block time come last.")
    @GetMapping
    public ResponseEntity<PagedResponse<Transaction>> listTransactions(
            @Parameter(description = "Only transactions synced for this wallet")
            @RequestParam(required = false) String walletAddress,
            @Parameter(description = "Only transactions on this chain", example = "ETHEREUM")
            @RequestParam(required = false) String chain,
            @Parameter(description = "Max number of transactions to return", example = "100")
            @RequestParam(required = false) Integer limit) {
        int effectiveLimit = ChainParams.limit(limit != null ? limit : monitorConfig.getDefaultListLimit());
        List<Transaction> transactions =
                transactionService.list(walletAddress, ChainParams.optional(chain), effectiveLimit);
        return ResponseEntity.ok(PagedResponse.of(transactions, effectiveLimit));
    }

    @Operation(summary = "Get a transaction by hash",
            description = "Served from the store. With a chain, a hash that is not stored is fetched from the chain; " +
                    "such a transaction is not scored and not stored.")
    @GetMapping("/{hash}")
    public ResponseEntity<Transaction> getTransaction(
            @Parameter(description = "Transaction hash or signature")
            @PathVariable String hash,
            @Parameter(description = "Chain to query when the hash is not stored", example = "ETHEREUM")
            @RequestParam(required = false) String chain) {
        return transactionService.get(hash, ChainParams.optional(chain))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Sync a wallet's transactions",
            description = "Fetches recent transactions from the chain, scores and stores new ones, and evaluates " +
                    "alert rules on them. Re-syncing is safe: already stored transactions are skipped.")
    @PostMapping("/sync")
    public ResponseEntity<SyncResult> syncTransactions(
            @Parameter(description = "Wallet address") @RequestParam String walletAddress,
            @Parameter(description = "Chain", example = "ETHEREUM") @RequestParam String chain) {
        return ResponseEntity.ok(ingestionCoordinator.sync(walletAddress, ChainParams.required(chain)));
    }

    @Operation(summary = "Analyze a wallet's stored transactions",
            description = "Activity statistics, 30-day trend and historical anomaly patterns. 404 when the wallet has no transactions.")
    @PostMapping("/analyze")
    public ResponseEntity<WalletAnalysis> analyzeTransactions(
            @Parameter(description = "Wallet address") @RequestParam String walletAddress,
            @Parameter(description = "Chain", example = "ETHEREUM") @RequestParam String chain) {
        return analyticsService.analyzeWallet(walletAddress, ChainParams.required(chain))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Transaction summary",
            description = "Counts and volumes per chain, each in the chain's native unit.")
    @GetMapping("/stats/summary")
    public ResponseEntity<TransactionSummary> getSummary() {
        return ResponseEntity.ok(analyticsService.transactionSummary());
    }
}
