package com.wallet.monitor.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Chain-specific transaction payload exactly as returned by a chain adapter.
 * Field names and value types vary per chain.
 */
public final class RawTransaction {

    private final Map<String, Object> fields;

    public RawTransaction(Map<String, ?> fields) {
        this.fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public static RawTransaction of(Map<String, ?> fields) {
        return new RawTransaction(fields);
    }

    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * First non-null value among the given field names.
     */
    public Object firstOf(String... candidates) {
        for (String candidate : candidates) {
            Object value = fields.get(candidate);
            if (value != null) return value;
        }
        return null;
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    @Override
    public String toString() {
        return "RawTransaction" + fields;
    }
}
