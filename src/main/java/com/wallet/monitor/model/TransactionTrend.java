package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Daily activity over a trailing period and its direction")
public class TransactionTrend {

    public enum Direction { INCREASING, DECREASING, STABLE }

    @Schema(description = "Length of the trailing period in days", example = "30")
    private int periodDays;

    @Schema(description = "Per-day statistics, oldest day first")
    private List<DailyVolume> daily;

    private double averageDailyCount;

    private double averageDailyVolume;

    @Schema(description = "INCREASING when the second half of the active days carries over 1.2x the volume of the first, " +
            "DECREASING under 0.8x, otherwise STABLE", example = "STABLE")
    private Direction direction;
}
