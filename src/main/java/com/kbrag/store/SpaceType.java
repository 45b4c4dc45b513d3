package com.kbrag.store;

import java.util.Locale;

import com.kbrag.runtime.ConfigurationException;

public enum SpaceType {
    COSINE("cosine"),
    L2("l2"),
    INNER_PRODUCT("ip");

    private final String wireName;

    SpaceType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static SpaceType parse(String value) {
        String normalized = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        for (SpaceType type : values()) {
            if (type.wireName.equals(normalized) || type.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return type;
            }
        }
        throw new ConfigurationException("Unknown space type: " + value);
    }
}
