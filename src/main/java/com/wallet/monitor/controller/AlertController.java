package com.wallet.monitor.controller;

import com.wallet.monitor.config.MonitorConfig;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertPatterns;
import com.wallet.monitor.model.AlertStatus;
import com.wallet.monitor.model.PagedResponse;
import com.wallet.monitor.service.AlertService;
import com.wallet.monitor.service.AnalyticsService;
import com.wallet.monitor.service.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/alerts")
@Tag(name = "Alerts", description = "Query and resolve alerts raised by rules")
public class AlertController {

    private final AlertService alertService;
    private final AnalyticsService analyticsService;
    private final MonitorConfig monitorConfig;

    public AlertController(AlertService alertService, AnalyticsService analyticsService, MonitorConfig monitorConfig) {
        this.alertService = alertService;
        this.analyticsService = analyticsService;
        this.monitorConfig = monitorConfig;
    }

    @Operation(summary = "List alerts", description = "Newest first.")
    @GetMapping
    public ResponseEntity<PagedResponse<Alert>> listAlerts(
            @Parameter(description = "Only alerts for this wallet")
            @RequestParam(required = false) String walletAddress,
            @Parameter(description = "Only alerts on this chain", example = "ETHEREUM")
            @RequestParam(required = false) String chain,
            @Parameter(description = "PENDING or RESOLVED", example = "PENDING")
            @RequestParam(required = false) String status,
            @Parameter(description = "Max number of alerts to return", example = "100")
            @RequestParam(required = false) Integer limit) {
        int effectiveLimit = ChainParams.limit(limit != null ? limit : monitorConfig.getDefaultListLimit());
        List<Alert> alerts = alertService.list(walletAddress, ChainParams.optional(chain),
                parseStatus(status), effectiveLimit);
        return ResponseEntity.ok(PagedResponse.of(alerts, effectiveLimit));
    }

    @Operation(summary = "Get an alert by ID")
    @GetMapping("/{alertId}")
    public ResponseEntity<Alert> getAlert(@PathVariable String alertId) {
        return alertService.get(alertId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Resolve an alert",
            description = "Moves a PENDING alert to RESOLVED. 400 when the alert is already resolved.")
    @PostMapping("/{alertId}/resolve")
    public ResponseEntity<Alert> resolveAlert(@PathVariable String alertId) {
        return alertService.resolve(alertId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Alert patterns", description = "Alert counts by risk level, type, wallet and chain.")
    @GetMapping("/stats/patterns")
    public ResponseEntity<AlertPatterns> getPatterns() {
        return ResponseEntity.ok(analyticsService.alertPatterns());
    }

    private AlertStatus parseStatus(String status) {
        if (status == null || status.isBlank()) return null;
        try {
            return AlertStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown alert status: " + status, "status");
        }
    }
}
