package com.wallet.monitor.controller;

import com.wallet.monitor.engine.RuleEngine;
import com.wallet.monitor.model.Alert;
import com.wallet.monitor.model.AlertRule;
import com.wallet.monitor.service.RuleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/rules")
@Tag(name = "Rules", description = "Manage alert rules (CRUD + enable/disable + reload)")
public class RuleController {

    private final RuleService ruleService;

    public RuleController(RuleService ruleService) {
        this.ruleService = ruleService;
    }

    @Operation(summary = "List alert rules")
    @GetMapping
    public ResponseEntity<List<AlertRule>> listRules(
            @Parameter(description = "Only enabled rules")
            @RequestParam(defaultValue = "false") boolean enabledOnly) {
        return ResponseEntity.ok(ruleService.getRules(enabledOnly));
    }

    @Operation(summary = "Get a specific rule by ID")
    @GetMapping("/{ruleId}")
    public ResponseEntity<AlertRule> getRule(
            @Parameter(description = "Rule ID", example = "RULE-LARGE-TX")
            @PathVariable String ruleId) {
        return ruleService.getRule(ruleId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Create a new alert rule",
            description = "The rule is validated (threshold or expression) and takes effect immediately.")
    @PostMapping
    public ResponseEntity<AlertRule> createRule(@RequestBody AlertRule rule) {
        return ResponseEntity.ok(ruleService.createRule(rule));
    }

    @Operation(summary = "Update an existing rule",
            description = "Change thresholds or expressions, or enable/disable the rule. An empty expression clears it.")
    @PutMapping("/{ruleId}")
    public ResponseEntity<AlertRule> updateRule(
            @Parameter(description = "Rule ID", example = "RULE-LARGE-TX")
            @PathVariable String ruleId,
            @RequestBody AlertRule updated) {
        return ruleService.updateRule(ruleId, updated)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @Operation(summary = "Delete a rule")
    @DeleteMapping("/{ruleId}")
    public ResponseEntity<Void> deleteRule(
            @Parameter(description = "Rule ID", example = "RULE-CONTRACT")
            @PathVariable String ruleId) {
        if (!ruleService.deleteRule(ruleId)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "Reload rules",
            description = "Recompiles enabled rules from storage. Malformed rules are skipped and counted.")
    @PostMapping("/reload")
    public ResponseEntity<RuleEngine.ReloadSummary> reloadRules() {
        return ResponseEntity.ok(ruleService.reload());
    }

    @Operation(summary = "Evaluate rules against a stored transaction",
            description = "Dry run: returns the alerts the active rules would raise. Nothing is persisted.")
    @PostMapping("/evaluate/{hash}")
    public ResponseEntity<List<Alert>> evaluateTransaction(
            @Parameter(description = "Transaction hash or signature")
            @PathVariable String hash) {
        return ruleService.evaluateStoredTransaction(hash)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
