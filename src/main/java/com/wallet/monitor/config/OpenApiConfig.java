package com.wallet.monitor.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI walletMonitorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Wallet Monitor API")
                        .version("1.0.0")
                        .description(
                                "Multi-chain wallet activity monitoring and alerting.\n\n" +
                                "**Sync Pipeline:**\n" +
                                "1. Register a wallet via `POST /api/v1/wallets`\n" +
                                "2. Trigger `POST /api/v1/transactions/sync` (or enable the periodic sync)\n" +
                                "3. Each fetched transaction is normalized into the canonical shape\n" +
                                "4. It is scored against the wallet's stored history (0-1)\n" +
                                "5. New transactions are stored once per hash and evaluated against enabled rules\n\n" +
                                "**Anomaly factors:** `LARGE_AMOUNT` (+0.5), `UNFAMILIAR_COUNTERPARTY` (+0.3), " +
                                "`HIGH_FREQUENCY` (+0.2). Risk: **HIGH** (>=0.8), **MEDIUM** (>=0.4), **LOW**.\n\n" +
                                "**Rule Types:**\n" +
                                "- `TRANSACTION`: amount above a threshold\n" +
                                "- `BALANCE`: balance below a threshold\n" +
                                "- `CONTRACT`: any contract interaction\n" +
                                "- `ANOMALY`: amount above a multiple of the historical mean\n" +
                                "- `FREQUENCY`: too many transactions in a trailing window\n\n" +
                                "**Chains:** ETHEREUM, BSC, POLYGON, SOLANA. Amounts are in each chain's native unit.")
                        .contact(new Contact().name("Wallet Monitor Team")));
    }
}
