package com.wallet.monitor.model;

import java.util.List;

public record PagedResponse<T>(List<T> data, int count, int limit) {

    public static <T> PagedResponse<T> of(List<T> data, int limit) {
        return new PagedResponse<>(data, data.size(), limit);
    }
}
