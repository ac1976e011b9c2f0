package com.wallet.monitor.adapter;

import com.wallet.monitor.model.BalanceReading;
import com.wallet.monitor.model.BlockInfo;
import com.wallet.monitor.model.ChainDescriptor;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.testutil.StubChainAdapter;
import com.wallet.monitor.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChainAdapterRegistryTest {

    @Test
    void get_unregisteredChain_throws() {
        ChainAdapterRegistry registry = new ChainAdapterRegistry(List.of());

        assertThatThrownBy(() -> registry.get(ChainId.POLYGON))
                .isInstanceOf(UnsupportedChainException.class)
                .satisfies(e -> assertThat(((UnsupportedChainException) e).getChain()).isEqualTo("POLYGON"));
        assertThat(registry.isSupported(ChainId.POLYGON)).isFalse();
    }

    @Test
    void get_wrapsAdapterSoFailuresBecomeEmptyResults() {
        StubChainAdapter stub = new StubChainAdapter(ChainId.ETHEREUM).failingWith(new IllegalStateException("timeout"));
        ChainAdapterRegistry registry = new ChainAdapterRegistry(List.of(stub.factory()));

        ChainAdapter adapter = registry.get(ChainId.ETHEREUM);

        assertThat(adapter).isInstanceOf(FailSoftChainAdapter.class);
        assertThat(((FailSoftChainAdapter) adapter).getDelegate()).isSameAs(stub);
        assertThat(adapter.getTransactions("0xabc", 10)).isEmpty();
        assertThat(adapter.getTransaction("0xabc")).isEmpty();
        assertThat(adapter.getBlock(null)).isEmpty();
        assertThat(adapter.getBlock(19_000_000L)).isEmpty();
        BalanceReading reading = adapter.getBalance("0xabc", null);
        assertThat(reading.isAvailable()).isFalse();
        assertThat(reading.getChain()).isEqualTo(ChainId.ETHEREUM);
    }

    @Test
    void get_concurrentFirstAccess_createsOneAdapter() throws Exception {
        AtomicInteger created = new AtomicInteger();
        StubChainAdapter stub = new StubChainAdapter(ChainId.BSC);
        ChainAdapterFactory countingFactory = new ChainAdapterFactory() {
            @Override
            public ChainId getChain() {
                return ChainId.BSC;
            }

            @Override
            public ChainAdapter create() {
                created.incrementAndGet();
                return stub;
            }
        };
        ChainAdapterRegistry registry = new ChainAdapterRegistry(List.of(countingFactory));

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<CompletableFuture<ChainAdapter>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(CompletableFuture.supplyAsync(() -> {
                    try {
                        start.await();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                    return registry.get(ChainId.BSC);
                }, pool));
            }
            start.countDown();

            ChainAdapter first = futures.get(0).join();
            for (CompletableFuture<ChainAdapter> future : futures) {
                assertThat(future.join()).isSameAs(first);
            }
            assertThat(created.get()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void describeChains_listsEveryChainWithAvailability() {
        ChainAdapterRegistry registry = new ChainAdapterRegistry(List.of(new StubChainAdapter(ChainId.SOLANA).factory()));

        List<ChainDescriptor> chains = registry.describeChains();

        assertThat(chains).hasSize(ChainId.values().length);
        assertThat(chains).filteredOn(ChainDescriptor::adapterAvailable)
                .extracting(ChainDescriptor::chain).containsExactly(ChainId.SOLANA);
        assertThat(chains).filteredOn(c -> c.chain() == ChainId.ETHEREUM).singleElement()
                .satisfies(c -> {
                    assertThat(c.evm()).isTrue();
                    assertThat(c.nativeUnit()).isEqualTo("ETH");
                });
    }

    @Test
    void get_forwardsTokenAndBlockNumberArguments() {
        BlockInfo latest = BlockInfo.builder().chain(ChainId.ETHEREUM).number(20L).hash("0xlatest").build();
        BlockInfo older = BlockInfo.builder().chain(ChainId.ETHEREUM).number(10L).hash("0xolder").build();
        StubChainAdapter stub = new StubChainAdapter(ChainId.ETHEREUM)
                .withBalance(3.0)
                .withTokenBalance("0xtoken", 42.0)
                .withLatestBlock(latest)
                .withBlock(older);
        ChainAdapter adapter = new ChainAdapterRegistry(List.of(stub.factory())).get(ChainId.ETHEREUM);

        assertThat(adapter.getBalance("0xabc", null).getBalance()).isEqualTo(3.0);
        BalanceReading token = adapter.getBalance("0xabc", "0xtoken");
        assertThat(token.getBalance()).isEqualTo(42.0);
        assertThat(token.getTokenAddress()).isEqualTo("0xtoken");
        assertThat(adapter.getBlock(null)).get().extracting(BlockInfo::getHash).isEqualTo("0xlatest");
        assertThat(adapter.getBlock(10L)).get().extracting(BlockInfo::getHash).isEqualTo("0xolder");
        assertThat(adapter.getBlock(11L)).isEmpty();
    }

    @Test
    void get_tokenBalanceFailure_keepsTokenOnUnavailableReading() {
        StubChainAdapter stub = new StubChainAdapter(ChainId.POLYGON).failingWith(new IllegalStateException("timeout"));
        ChainAdapter adapter = new ChainAdapterRegistry(List.of(stub.factory())).get(ChainId.POLYGON);

        BalanceReading reading = adapter.getBalance("0xabc", "0xtoken");

        assertThat(reading.isAvailable()).isFalse();
        assertThat(reading.getTokenAddress()).isEqualTo("0xtoken");
    }

    @Test
    void get_factoryFailure_returnsUnreachableAdapterAndRetriesNextTime() {
        AtomicInteger attempts = new AtomicInteger();
        StubChainAdapter stub = new StubChainAdapter(ChainId.ETHEREUM)
                .withTransactions(List.of(TestDataFactory.createRawEvmTransaction("0x01", "5", 1_700_000_000L)));
        ChainAdapterFactory flakyFactory = new ChainAdapterFactory() {
            @Override
            public ChainId getChain() {
                return ChainId.ETHEREUM;
            }

            @Override
            public ChainAdapter create() {
                if (attempts.incrementAndGet() == 1) {
                    throw new IllegalStateException("rpc connect refused");
                }
                return stub;
            }
        };
        ChainAdapterRegistry registry = new ChainAdapterRegistry(List.of(flakyFactory));

        ChainAdapter unreachable = registry.get(ChainId.ETHEREUM);
        assertThat(unreachable.getTransactions("0xabc", 10)).isEmpty();
        assertThat(unreachable.getBalance("0xabc", null).isAvailable()).isFalse();
        assertThat(unreachable.getBlock(null)).isEmpty();
        assertThat(unreachable.isValidAddress("0xabc")).isTrue();

        ChainAdapter recovered = registry.get(ChainId.ETHEREUM);
        assertThat(recovered.getTransactions("0xabc", 10)).hasSize(1);
        assertThat(registry.get(ChainId.ETHEREUM)).isSameAs(recovered);
        assertThat(attempts.get()).isEqualTo(2);
    }
}
