package com.wallet.monitor.controller;

import com.wallet.monitor.config.MonitorConfig;
import com.wallet.monitor.model.*;
import com.wallet.monitor.service.AlertService;
import com.wallet.monitor.service.AnalyticsService;
import com.wallet.monitor.service.ValidationException;
import com.wallet.monitor.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.wallet.monitor.testutil.TestDataFactory.WALLET;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(AlertController.class)
class AlertControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private AlertService alertService;

    @MockBean
    private AnalyticsService analyticsService;

    @MockBean
    private MonitorConfig monitorConfig;

    @BeforeEach
    void setUp() {
        when(monitorConfig.getDefaultListLimit()).thenReturn(100);
    }

    @Test
    void listAlerts_parsesFilters() throws Exception {
        when(alertService.list(WALLET, ChainId.ETHEREUM, AlertStatus.PENDING, 20)).thenReturn(List.of(
                TestDataFactory.createAlert("A1", RiskLevel.HIGH, AlertStatus.PENDING)));

        mockMvc.perform(get("/api/v1/alerts")
                        .param("walletAddress", WALLET)
                        .param("chain", "ethereum")
                        .param("status", "pending")
                        .param("limit", "20"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].id").value("A1"))
                .andExpect(jsonPath("$.data[0].ruleId").value("RULE-1"))
                .andExpect(jsonPath("$.data[0].status").value("PENDING"))
                .andExpect(jsonPath("$.limit").value(20));
    }

    @Test
    void listAlerts_unknownStatus_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/alerts").param("status", "ARCHIVED"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("status"));
    }

    @Test
    void getAlert_notFound() throws Exception {
        when(alertService.get("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/alerts/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void resolveAlert_success() throws Exception {
        Alert resolved = TestDataFactory.createAlert("A1", RiskLevel.HIGH, AlertStatus.RESOLVED);
        resolved.setResolvedAt(1_700_000_000_000L);
        when(alertService.resolve("A1")).thenReturn(Optional.of(resolved));

        mockMvc.perform(post("/api/v1/alerts/A1/resolve"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("RESOLVED"))
                .andExpect(jsonPath("$.resolvedAt").value(1_700_000_000_000L));
    }

    @Test
    void resolveAlert_alreadyResolved_badRequest() throws Exception {
        when(alertService.resolve("A1")).thenThrow(new ValidationException("Alert A1 is not pending", "status"));

        mockMvc.perform(post("/api/v1/alerts/A1/resolve"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Alert A1 is not pending"));
    }

    @Test
    void resolveAlert_unknown_notFound() throws Exception {
        when(alertService.resolve("missing")).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/alerts/missing/resolve"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getPatterns_success() throws Exception {
        when(analyticsService.alertPatterns()).thenReturn(AlertPatterns.builder()
                .totalAlerts(3)
                .pendingAlerts(2)
                .byRiskLevel(Map.of(RiskLevel.HIGH, 2))
                .byType(Map.of(RuleType.TRANSACTION, 3))
                .byWallet(Map.of(WALLET, 3))
                .byChain(Map.of(ChainId.ETHEREUM, 3))
                .build());

        mockMvc.perform(get("/api/v1/alerts/stats/patterns"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalAlerts").value(3))
                .andExpect(jsonPath("$.byRiskLevel.HIGH").value(2))
                .andExpect(jsonPath("$.byType.TRANSACTION").value(3));
    }
}
