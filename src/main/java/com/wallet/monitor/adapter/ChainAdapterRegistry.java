package com.wallet.monitor.adapter;

import com.wallet.monitor.model.ChainDescriptor;
import com.wallet.monitor.model.ChainId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out one adapter per chain. Adapters are created lazily from the registered
 * {@link ChainAdapterFactory} beans; concurrent first requests for the same chain
 * create exactly one instance.
 */
@Component
public class ChainAdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ChainAdapterRegistry.class);

    private final Map<ChainId, ChainAdapterFactory> factories;
    private final ConcurrentHashMap<ChainId, ChainAdapter> adapters = new ConcurrentHashMap<>();

    public ChainAdapterRegistry(List<ChainAdapterFactory> factoryBeans) {
        this.factories = new EnumMap<>(ChainId.class);
        for (ChainAdapterFactory factory : factoryBeans) {
            ChainAdapterFactory previous = factories.put(factory.getChain(), factory);
            if (previous != null) {
                log.warn("Replacing adapter factory for {}: {} -> {}", factory.getChain(),
                        previous.getClass().getSimpleName(), factory.getClass().getSimpleName());
            }
            log.info("Registered chain adapter factory: {} -> {}",
                    factory.getChain(), factory.getClass().getSimpleName());
        }
        if (factories.isEmpty()) {
            log.warn("No chain adapter factories registered; sync and balance lookups will be rejected");
        }
    }

    /**
     * When the factory fails to build the adapter, an unreachable adapter is returned
     * and nothing is cached, so the next call tries again.
     *
     * @throws UnsupportedChainException when no factory is registered for the chain
     */
    public ChainAdapter get(ChainId chain) {
        ChainAdapterFactory factory = factories.get(chain);
        if (factory == null) {
            throw new UnsupportedChainException(chain);
        }
        ChainAdapter adapter = adapters.computeIfAbsent(chain, c -> create(c, factory));
        return adapter != null ? adapter : new UnreachableChainAdapter(chain);
    }

    private ChainAdapter create(ChainId chain, ChainAdapterFactory factory) {
        log.info("Creating chain adapter for {}", chain);
        try {
            return new FailSoftChainAdapter(factory.create());
        } catch (Exception e) {
            log.error("Failed to create chain adapter for {}: {}", chain, e.getMessage(), e);
            return null;
        }
    }

    public boolean isSupported(ChainId chain) {
        return factories.containsKey(chain);
    }

    public List<ChainDescriptor> describeChains() {
        return Arrays.stream(ChainId.values())
                .map(c -> new ChainDescriptor(c, c.isEvm(), c.getNativeUnit(), isSupported(c)))
                .toList();
    }
}
