package com.kbrag.store;

import java.util.Locale;

import com.kbrag.runtime.ConfigurationException;

public enum Precision {
    BINARY2,
    INT8D,
    INT16D,
    FLOAT16,
    FLOAT32;

    public static Precision parse(String value) {
        String normalized = value == null ? "" : value.trim().toUpperCase(Locale.ROOT);
        if ("BINARY".equals(normalized)) {
            return BINARY2;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown precision: " + value, e);
        }
    }
}
