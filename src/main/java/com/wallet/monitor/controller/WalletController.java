package com.wallet.monitor.controller;

import com.wallet.monitor.model.AssetDistribution;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Wallet;
import com.wallet.monitor.service.AnalyticsService;
import com.wallet.monitor.service.BalanceMonitorService;
import com.wallet.monitor.service.WalletService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/wallets")
@Tag(name = "Wallets", description = "Register and manage monitored wallets")
public class WalletController {

    private final WalletService walletService;
    private final BalanceMonitorService balanceMonitorService;
    private final AnalyticsService analyticsService;

    public WalletController(WalletService walletService, BalanceMonitorService balanceMonitorService,
                            AnalyticsService analyticsService) {
        this.walletService = walletService;
        this.balanceMonitorService = balanceMonitorService;
        this.analyticsService = analyticsService;
    }

    @Operation(summary = "Register a wallet",
            description = "Starts monitoring an address on a chain. Registering the same address twice returns the existing wallet.")
    @PostMapping
    public ResponseEntity<Wallet> registerWallet(@RequestBody WalletRequest request) {
        ChainId chain = ChainParams.required(request.chain());
        Wallet wallet = walletService.register(request.address(), chain, request.name(), request.description());
        return ResponseEntity.ok(wallet);
    }

    @Operation(summary = "List wallets")
    @GetMapping
    public ResponseEntity<List<Wallet>> listWallets(
            @Parameter(description = "Only wallets on this chain", example = "ETHEREUM")
            @RequestParam(required = false) String chain,
            @Parameter(description = "Only active wallets")
            @RequestParam(defaultValue = "false") boolean activeOnly) {
        return ResponseEntity.ok(walletService.list(ChainParams.optional(chain), activeOnly));
    }

    @Operation(summary = "Asset distribution",
            description = "Native balances of the active wallets, totalled per chain in each chain's own unit. " +
                    "Wallets whose balance could not be read are only counted.")
    @GetMapping("/distribution")
    public ResponseEntity<AssetDistribution> getDistribution(
            @Parameter(description = "Only wallets on this chain", example = "ETHEREUM")
            @RequestParam(required = false) String chain) {
        return ResponseEntity.ok(analyticsService.assetDistribution(ChainParams.optional(chain)));
    }

    @Operation(summary = "Get a wallet")
    @GetMapping("/{chain}/{address}")
    public ResponseEntity<Wallet> getWallet(
            @Parameter(description = "Chain", example = "ETHEREUM") @PathVariable String chain,
            @Parameter(description = "Wallet address") @PathVariable String address) {
        return walletService.get(address, ChainParams.required(chain))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Update a wallet's name or description")
    @PutMapping("/{chain}/{address}")
    public ResponseEntity<Wallet> updateWallet(
            @Parameter(description = "Chain", example = "ETHEREUM") @PathVariable String chain,
            @Parameter(description = "Wallet address") @PathVariable String address,
            @RequestBody WalletRequest request) {
        return walletService.update(address, ChainParams.required(chain), request.name(), request.description())
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Deactivate a wallet",
            description = "Stops monitoring the wallet. The wallet and its history are kept.")
    @DeleteMapping("/{chain}/{address}")
    public ResponseEntity<Void> deactivateWallet(
            @Parameter(description = "Chain", example = "ETHEREUM") @PathVariable String chain,
            @Parameter(description = "Wallet address") @PathVariable String address) {
        if (!walletService.deactivate(address, ChainParams.required(chain))) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Read a wallet's balance",
            description = "Queries the chain and evaluates BALANCE rules against the native balance. "
                    + "Alerts are stored only when the chain answered.")
    @GetMapping("/{chain}/{address}/balance")
    public ResponseEntity<BalanceMonitorService.BalanceCheck> getBalance(
            @Parameter(description = "Chain", example = "ETHEREUM") @PathVariable String chain,
            @Parameter(description = "Wallet address") @PathVariable String address,
            @Parameter(description = "Token contract; omit for the native balance. Token balances are not checked against rules.")
            @RequestParam(required = false) String tokenAddress) {
        return ResponseEntity.ok(balanceMonitorService.checkBalance(address, ChainParams.required(chain), tokenAddress));
    }

    @Schema(description = "Wallet registration or update")
    public record WalletRequest(
            @Schema(description = "Wallet address", example = "0x742d35Cc6634C0532925a3b844Bc454e4438f44e") String address,
            @Schema(description = "Chain", example = "ETHEREUM") String chain,
            @Schema(description = "Display name") String name,
            @Schema(description = "Description") String description) {}
}
