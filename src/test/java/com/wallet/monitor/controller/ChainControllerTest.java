package com.wallet.monitor.controller;

import com.wallet.monitor.model.BlockInfo;
import com.wallet.monitor.model.ChainDescriptor;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.service.ChainService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(ChainController.class)
class ChainControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ChainService chainService;

    @Test
    void listChains_success() throws Exception {
        when(chainService.supportedChains()).thenReturn(List.of(
                new ChainDescriptor(ChainId.ETHEREUM, true, "ETH", true),
                new ChainDescriptor(ChainId.SOLANA, false, "SOL", false)));

        mockMvc.perform(get("/api/v1/chains"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].chain").value("ETHEREUM"))
                .andExpect(jsonPath("$[0].adapterAvailable").value(true))
                .andExpect(jsonPath("$[1].nativeUnit").value("SOL"))
                .andExpect(jsonPath("$[1].evm").value(false));
    }

    @Test
    void latestBlock_noAnswer_notFound() throws Exception {
        when(chainService.block(ChainId.BSC, null)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/chains/bsc/block"))
                .andExpect(status().isNotFound());
    }

    @Test
    void latestBlock_unknownChain_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/chains/bitcoin/block"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("chain"));
    }

    @Test
    void latestBlock_success() throws Exception {
        BlockInfo block = BlockInfo.builder().chain(ChainId.ETHEREUM).number(19_000_000L).hash("0xblock").build();
        when(chainService.block(ChainId.ETHEREUM, null)).thenReturn(Optional.of(block));

        mockMvc.perform(get("/api/v1/chains/ETHEREUM/block"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.number").value(19_000_000));
    }

    @Test
    void blockByNumber_passesNumberThrough() throws Exception {
        BlockInfo block = BlockInfo.builder().chain(ChainId.SOLANA).number(250_000_000L).hash("slotHash").build();
        when(chainService.block(ChainId.SOLANA, 250_000_000L)).thenReturn(Optional.of(block));

        mockMvc.perform(get("/api/v1/chains/solana/block").param("number", "250000000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hash").value("slotHash"));
    }

    @Test
    void blockByNumber_notANumber_badRequest() throws Exception {
        mockMvc.perform(get("/api/v1/chains/solana/block").param("number", "latest"))
                .andExpect(status().isBadRequest());
    }
}
