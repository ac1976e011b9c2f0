package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Balance of an address as reported by the chain")
public class BalanceReading {

    private String address;

    private ChainId chain;

    @Schema(description = "Token contract the balance is for; absent for the native balance")
    private String tokenAddress;

    @Schema(description = "Balance in the chain's native unit, or in token units when tokenAddress is set; meaningless when available is false", example = "12.5")
    private double balance;

    @Schema(description = "False when the chain could not be queried. A genuine zero balance is available.", example = "true")
    private boolean available;

    @Schema(description = "Read time in epoch milliseconds")
    private long readAt;

    public static BalanceReading of(String address, ChainId chain, double balance) {
        return of(address, chain, null, balance);
    }

    public static BalanceReading of(String address, ChainId chain, String tokenAddress, double balance) {
        return new BalanceReading(address, chain, tokenAddress, balance, true, System.currentTimeMillis());
    }

    public static BalanceReading unavailable(String address, ChainId chain) {
        return unavailable(address, chain, null);
    }

    public static BalanceReading unavailable(String address, ChainId chain, String tokenAddress) {
        return new BalanceReading(address, chain, tokenAddress, 0.0, false, System.currentTimeMillis());
    }
}
