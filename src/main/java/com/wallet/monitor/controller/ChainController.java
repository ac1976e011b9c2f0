package com.wallet.monitor.controller;

import com.wallet.monitor.model.BlockInfo;
import com.wallet.monitor.model.ChainDescriptor;
import com.wallet.monitor.service.ChainService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/chains")
@Tag(name = "Chains", description = "Supported chains and their current state")
public class ChainController {

    private final ChainService chainService;

    public ChainController(ChainService chainService) {
        this.chainService = chainService;
    }

    @Operation(summary = "List known chains", description = "Includes whether an adapter is registered for each chain.")
    @GetMapping
    public ResponseEntity<List<ChainDescriptor>> listChains() {
        return ResponseEntity.ok(chainService.supportedChains());
    }

    @Operation(summary = "Block of a chain",
            description = "The latest block unless a number is given. 404 when the chain did not answer.")
    @GetMapping("/{chain}/block")
    public ResponseEntity<BlockInfo> getBlock(
            @Parameter(description = "Chain", example = "SOLANA") @PathVariable String chain,
            @Parameter(description = "Block number (slot on Solana)", example = "19000000")
            @RequestParam(required = false) Long number) {
        return chainService.block(ChainParams.required(chain), number)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
