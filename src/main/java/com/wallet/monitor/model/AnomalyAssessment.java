package com.wallet.monitor.model;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(description = "Outcome of scoring one transaction against its wallet history")
public record AnomalyAssessment(double anomalyScore, List<AnomalyFactor> contributingFactors, RiskLevel riskLevel) {

    public AnomalyAssessment {
        contributingFactors = contributingFactors == null ? List.of() : List.copyOf(contributingFactors);
    }
}
