package com.wallet.monitor.adapter;

import com.wallet.monitor.model.ChainId;

/**
 * Spring bean that knows how to build the adapter for one chain.
 * Creation may be expensive (connection setup), so the registry calls it at most once per chain.
 */
public interface ChainAdapterFactory {

    ChainId getChain();

    ChainAdapter create();
}
