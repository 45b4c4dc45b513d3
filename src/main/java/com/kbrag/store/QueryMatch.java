package com.kbrag.store;

import java.util.Map;

public record QueryMatch(String id, double similarity, Map<String, Object> meta) {
    public QueryMatch {
        meta = meta == null ? Map.of() : meta;
    }

    public String metaString(String key, String fallback) {
        Object value = meta.get(key);
        return value == null ? fallback : value.toString();
    }

    public int metaInt(String key, int fallback) {
        Object value = meta.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.parseInt(value.toString().trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }
}
