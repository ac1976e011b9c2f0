package com.wallet.monitor.controller;

import com.wallet.monitor.adapter.UnsupportedChainException;
import com.wallet.monitor.config.MonitorConfig;
import com.wallet.monitor.model.*;
import com.wallet.monitor.service.AnalyticsService;
import com.wallet.monitor.service.IngestionCoordinator;
import com.wallet.monitor.service.TransactionService;
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

import static com.wallet.monitor.testutil.TestDataFactory.BASE_TIME;
import static com.wallet.monitor.testutil.TestDataFactory.WALLET;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TransactionController.class)
class TransactionControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TransactionService transactionService;

    @MockBean
    private IngestionCoordinator ingestionCoordinator;

    @MockBean
    private AnalyticsService analyticsService;

    @MockBean
    private MonitorConfig monitorConfig;

    @BeforeEach
    void setUp() {
        when(monitorConfig.getDefaultListLimit()).thenReturn(100);
    }

    @Test
    void listTransactions_usesDefaultLimit() throws Exception {
        Transaction txn = TestDataFactory.createTransaction("0xabc", 1.5, BASE_TIME);
        txn.setRiskLevel(RiskLevel.HIGH);
        txn.setAnomalyScore(0.8);
        when(transactionService.list(WALLET, ChainId.ETHEREUM, 100)).thenReturn(List.of(txn));

        mockMvc.perform(get("/api/v1/transactions")
                        .param("walletAddress", WALLET)
                        .param("chain", "ETHEREUM"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].hash").value("0xabc"))
                .andExpect(jsonPath("$.data[0].riskLevel").value("HIGH"))
                .andExpect(jsonPath("$.data[0].anomalyScore").value(0.8))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.limit").value(100));
    }

    @Test
    void listTransactions_nonPositiveLimit_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/transactions").param("limit", "0"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("limit"));

        verify(transactionService, never()).list(any(), any(), anyInt());
    }

    @Test
    void listTransactions_unknownChain_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/transactions").param("chain", "cardano"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("chain"));
    }

    @Test
    void getTransaction_notFound() throws Exception {
        when(transactionService.get("0xnone", null)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/transactions/0xnone"))
                .andExpect(status().isNotFound());
    }

    @Test
    void getTransaction_withChain_passesChainForFallbackFetch() throws Exception {
        Transaction txn = TestDataFactory.createTransaction("0xremote", 2.0, BASE_TIME);
        when(transactionService.get("0xremote", ChainId.BSC)).thenReturn(Optional.of(txn));

        mockMvc.perform(get("/api/v1/transactions/0xremote").param("chain", "bsc"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hash").value("0xremote"));
    }

    @Test
    void syncTransactions_returnsCounts() throws Exception {
        when(ingestionCoordinator.sync(WALLET, ChainId.POLYGON)).thenReturn(SyncResult.builder()
                .walletAddress(WALLET).chain(ChainId.POLYGON)
                .fetchedCount(5).syncedCount(5).failedCount(0).alertCount(2).build());

        mockMvc.perform(post("/api/v1/transactions/sync")
                        .param("walletAddress", WALLET)
                        .param("chain", "polygon"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.syncedCount").value(5))
                .andExpect(jsonPath("$.alertCount").value(2))
                .andExpect(jsonPath("$.chain").value("POLYGON"));
    }

    @Test
    void syncTransactions_chainWithoutAdapter_badRequest() throws Exception {
        when(ingestionCoordinator.sync(anyString(), eq(ChainId.SOLANA)))
                .thenThrow(new UnsupportedChainException(ChainId.SOLANA));

        mockMvc.perform(post("/api/v1/transactions/sync")
                        .param("walletAddress", "So1anaAddr")
                        .param("chain", "SOLANA"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unsupported chain: SOLANA"));
    }

    @Test
    void syncTransactions_missingParam_badRequest() throws Exception {
        mockMvc.perform(post("/api/v1/transactions/sync").param("chain", "ETHEREUM"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void analyzeTransactions_noHistory_notFound() throws Exception {
        when(analyticsService.analyzeWallet(WALLET, ChainId.ETHEREUM)).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/v1/transactions/analyze")
                        .param("walletAddress", WALLET)
                        .param("chain", "ETHEREUM"))
                .andExpect(status().isNotFound());
    }

    @Test
    void analyzeTransactions_success() throws Exception {
        WalletAnalysis analysis = WalletAnalysis.builder()
                .walletAddress(WALLET)
                .chain(ChainId.ETHEREUM)
                .activity(WalletActivity.builder().transactionCount(3).unit("ETH").build())
                .trend(TransactionTrend.builder().periodDays(30).direction(TransactionTrend.Direction.STABLE).build())
                .anomalies(List.of())
                .build();
        when(analyticsService.analyzeWallet(WALLET, ChainId.ETHEREUM)).thenReturn(Optional.of(analysis));

        mockMvc.perform(post("/api/v1/transactions/analyze")
                        .param("walletAddress", WALLET)
                        .param("chain", "ETHEREUM"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.activity.transactionCount").value(3))
                .andExpect(jsonPath("$.trend.direction").value("STABLE"));
    }

    @Test
    void getSummary_reportsVolumesPerChain() throws Exception {
        when(analyticsService.transactionSummary()).thenReturn(TransactionSummary.builder()
                .totalTransactions(3)
                .byChain(List.of(new ChainVolume(ChainId.ETHEREUM, "ETH", 2, 5.0),
                        new ChainVolume(ChainId.SOLANA, "SOL", 1, 7.0)))
                .byRiskLevel(Map.of(RiskLevel.LOW, 3))
                .build());

        mockMvc.perform(get("/api/v1/transactions/stats/summary"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalTransactions").value(3))
                .andExpect(jsonPath("$.byChain[1].unit").value("SOL"))
                .andExpect(jsonPath("$.byChain[1].volume").value(7.0));
    }
}
