package com.wallet.monitor.repository;

import com.aerospike.client.Bin;
import com.aerospike.client.Record;

import java.util.List;

/**
 * Helpers for optional bins. Absent bins read back as null instead of 0.
 */
final class RecordBins {

    private RecordBins() {
    }

    static void addIfPresent(List<Bin> bins, String name, String value) {
        if (value != null) {
            bins.add(new Bin(name, value));
        }
    }

    static void addIfPresent(List<Bin> bins, String name, Long value) {
        if (value != null) {
            bins.add(new Bin(name, value.longValue()));
        }
    }

    static void addIfPresent(List<Bin> bins, String name, Double value) {
        if (value != null) {
            bins.add(new Bin(name, value.doubleValue()));
        }
    }

    static Long getNullableLong(Record record, String name) {
        Object value = record.getValue(name);
        return value instanceof Number n ? n.longValue() : null;
    }

    static Double getNullableDouble(Record record, String name) {
        Object value = record.getValue(name);
        return value instanceof Number n ? n.doubleValue() : null;
    }

    static <E extends Enum<E>> E getEnum(Record record, String name, Class<E> type) {
        String value = record.getString(name);
        return value != null ? Enum.valueOf(type, value) : null;
    }
}
