package com.wallet.monitor.controller;

import com.wallet.monitor.adapter.UnsupportedChainException;
import com.wallet.monitor.model.ChainId;
import com.wallet.monitor.service.ValidationException;

/**
 * Request parameter parsing shared by the controllers.
 */
final class ChainParams {

    private ChainParams() {
    }

    static ChainId required(String chain) {
        return ChainId.fromName(chain).orElseThrow(() -> new UnsupportedChainException(chain));
    }

    static ChainId optional(String chain) {
        if (chain == null || chain.isBlank()) return null;
        return required(chain);
    }

    static int limit(int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit must be > 0", "limit");
        }
        return limit;
    }
}
