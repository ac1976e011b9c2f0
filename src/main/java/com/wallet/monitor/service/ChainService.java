package com.wallet.monitor.service;

import com.wallet.monitor.adapter.ChainAdapterRegistry;
import com.wallet.monitor.model.BlockInfo;
import com.wallet.monitor.model.ChainDescriptor;
import com.wallet.monitor.model.ChainId;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

@Service
public class ChainService {

    private final ChainAdapterRegistry adapterRegistry;

    public ChainService(ChainAdapterRegistry adapterRegistry) {
        this.adapterRegistry = adapterRegistry;
    }

    public List<ChainDescriptor> supportedChains() {
        return adapterRegistry.describeChains();
    }

    /**
     * @param number block number, or null for the latest block
     */
    public Optional<BlockInfo> block(ChainId chain, Long number) {
        if (number != null && number < 0) {
            throw new ValidationException("number must be >= 0", "number");
        }
        return adapterRegistry.get(chain).getBlock(number);
    }
}
