package com.wallet.monitor.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.ResultCode;
import com.aerospike.client.policy.GenerationPolicy;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.RecordExistsAction;
import com.aerospike.client.policy.WritePolicy;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.model.Wallet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.wallet.monitor.testutil.TestDataFactory.WALLET;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WalletRepositoryTest {

    @Mock private AerospikeClient client;

    private WalletRepository repository;

    @BeforeEach
    void setUp() {
        WritePolicy createOnly = new WritePolicy();
        createOnly.recordExistsAction = RecordExistsAction.CREATE_ONLY;
        repository = new WalletRepository(client, "test", new Policy(), new WritePolicy(), createOnly);
    }

    @Test
    void updateDetails_writesOnlyChangedBinsWithExpectedGeneration() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(walletRecord(false, 4));

        Wallet updated = repository.updateDetails(WALLET, ChainId.ETHEREUM, "renamed", null, 99L);

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(policy.capture(), any(Key.class), bins.capture());
        assertThat(policy.getValue().generationPolicy).isEqualTo(GenerationPolicy.EXPECT_GEN_EQUAL);
        assertThat(policy.getValue().generation).isEqualTo(4);
        assertThat(binNames(bins.getValue())).containsExactlyInAnyOrder("name", "updatedAt");

        assertThat(updated.getName()).isEqualTo("renamed");
        assertThat(updated.getDescription()).isEqualTo("old desc");
        assertThat(updated.isActive()).isFalse();
        assertThat(updated.getUpdatedAt()).isEqualTo(99L);
    }

    @Test
    void updateDetails_generationConflict_rereadsAndRetries() {
        when(client.get(any(Policy.class), any(Key.class)))
                .thenReturn(walletRecord(true, 4))
                .thenReturn(walletRecord(false, 5));
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .doNothing()
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        Wallet updated = repository.updateDetails(WALLET, ChainId.ETHEREUM, "renamed", null, 99L);

        assertThat(updated.isActive()).isFalse();
        verify(client, times(2)).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void updateDetails_persistentConflict_givesUp() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(walletRecord(true, 4));
        doThrow(new AerospikeException(ResultCode.GENERATION_ERROR))
                .when(client).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));

        assertThatThrownBy(() -> repository.updateDetails(WALLET, ChainId.ETHEREUM, "renamed", null, 99L))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void updateDetails_missingWallet_returnsNull() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(null);

        assertThat(repository.updateDetails(WALLET, ChainId.ETHEREUM, "renamed", null, 99L)).isNull();
        verify(client, never()).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    @Test
    void deactivate_activeWallet_writesFlagWithExpectedGeneration() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(walletRecord(true, 2));

        assertThat(repository.deactivate(WALLET, ChainId.ETHEREUM, 99L)).isTrue();

        ArgumentCaptor<WritePolicy> policy = ArgumentCaptor.forClass(WritePolicy.class);
        ArgumentCaptor<Bin[]> bins = ArgumentCaptor.forClass(Bin[].class);
        verify(client).put(policy.capture(), any(Key.class), bins.capture());
        assertThat(policy.getValue().generation).isEqualTo(2);
        assertThat(binNames(bins.getValue())).containsExactlyInAnyOrder("active", "updatedAt");
    }

    @Test
    void deactivate_alreadyInactive_doesNotWrite() {
        when(client.get(any(Policy.class), any(Key.class))).thenReturn(walletRecord(false, 2));

        assertThat(repository.deactivate(WALLET, ChainId.ETHEREUM, 99L)).isTrue();
        verify(client, never()).put(any(WritePolicy.class), any(Key.class), any(Bin[].class));
    }

    private static List<String> binNames(Bin[] bins) {
        return Arrays.stream(bins).map(b -> b.name).toList();
    }

    private static Record walletRecord(boolean active, int generation) {
        Map<String, Object> bins = new HashMap<>();
        bins.put("id", "W1");
        bins.put("address", WALLET);
        bins.put("chain", "ETHEREUM");
        bins.put("name", "old name");
        bins.put("description", "old desc");
        bins.put("active", active);
        bins.put("createdAt", 1L);
        bins.put("updatedAt", 1L);
        return new Record(bins, generation, 0);
    }
}
